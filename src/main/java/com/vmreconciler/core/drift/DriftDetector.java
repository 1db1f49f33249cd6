package com.vmreconciler.core.drift;

import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.DataDisk;
import com.vmreconciler.cloud.NetworkApi;
import com.vmreconciler.cloud.ProvisioningState;
import com.vmreconciler.cloud.VirtualMachine;
import com.vmreconciler.core.engine.BackingStoreService;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares a freshly fetched VM with the recorded state and repairs what can
 * be repaired safely.
 *
 * <p>Caching, size and the public IP are copied from the live VM into the
 * record. Root disk and disk name differences are only reported. A data disk
 * found at the wrong slot is detached and marked for re-attach, and disks the
 * record does not know about are detached in one batched update. Backing
 * stores are never deleted here.
 */
@Service
public class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    private final ComputeApi computeApi;
    private final NetworkApi networkApi;
    private final BackingStoreService backingStore;
    private final ReconcilerMetrics metrics;

    public DriftDetector(ComputeApi computeApi, NetworkApi networkApi,
                         BackingStoreService backingStore, ReconcilerMetrics metrics) {
        this.computeApi = computeApi;
        this.networkApi = networkApi;
        this.backingStore = backingStore;
        this.metrics = metrics;
    }

    public DriftReport detect(VirtualMachine vm, StateRecord state) {
        var warnings = new ArrayList<DriftWarning>();
        var machine = state.fullName();

        if (vm.provisioningState() == ProvisioningState.FAILED) {
            warn(warnings, DriftKind.VM_FAILED, machine, "vm resource exists, but is in a failed state", false);
        }

        if (!Objects.equals(state.getSize(), vm.size())) {
            warnChanged(warnings, DriftKind.VM_SIZE, machine, "size", state.getSize(), vm.size(), true);
            state.setSize(vm.size());
        }

        var liveIp = networkApi.currentAddress(state.getResourceGroup(), state.getPublicIp());
        if (!Objects.equals(state.getPublicIpv4(), liveIp)) {
            warnChanged(warnings, DriftKind.PUBLIC_IP, machine, "public IPv4", state.getPublicIpv4(), liveIp, true);
            state.setPublicIpv4(liveIp);
        }

        checkRootDisk(vm, state, warnings);
        vm = checkDataDisks(vm, state, warnings);
        detachUnexpectedDisks(vm, state, warnings);

        return new DriftReport(warnings);
    }

    private void checkRootDisk(VirtualMachine vm, StateRecord state, List<DriftWarning> warnings) {
        var root = state.getDisks().findAttachedRoot()
                .orElseThrow(() -> ReconcileException.internal(state.fullName() + " has no attached root disk recorded"));
        var osDisk = vm.osDisk();
        var resource = "OS disk of " + state.fullName();

        if (root.hostCaching() != osDisk.caching()) {
            warnChanged(warnings, DriftKind.ROOT_DISK, resource, "host_caching", root.hostCaching(), osDisk.caching(), false);
        }
        if (!Objects.equals(root.name(), osDisk.name())) {
            warnChanged(warnings, DriftKind.ROOT_DISK, resource, "name", root.name(), osDisk.name(), false);
        }
        if (!Objects.equals(root.id(), osDisk.uri())) {
            warnChanged(warnings, DriftKind.ROOT_DISK, resource, "media_link", root.id(), osDisk.uri(), false);
        }
    }

    private VirtualMachine checkDataDisks(VirtualMachine vm, StateRecord state, List<DriftWarning> warnings) {
        for (DiskRecord disk : state.getDisks().slotDisks()) {
            int slot = disk.slot().getAsInt();
            var resource = "data disk " + disk.label();
            var live = vm.findDataDisk(disk.id());

            if (live.isPresent()) {
                DataDisk liveDisk = live.get();
                var updated = disk;

                if (disk.hostCaching() != liveDisk.caching()) {
                    warnChanged(warnings, DriftKind.DISK_CACHING, resource, "host_caching",
                            disk.hostCaching(), liveDisk.caching(), true);
                    updated = updated.withHostCaching(liveDisk.caching());
                }
                if (!Objects.equals(disk.size(), liveDisk.sizeGb())) {
                    warnChanged(warnings, DriftKind.DISK_SIZE, resource, "size", disk.size(), liveDisk.sizeGb(), true);
                    updated = updated.withSize(liveDisk.sizeGb());
                }
                if (!Objects.equals(disk.name(), liveDisk.name())) {
                    warnChanged(warnings, DriftKind.DISK_NAME, resource, "name", disk.name(), liveDisk.name(), false);
                }
                if (disk.needsAttach()) {
                    warn(warnings, DriftKind.DISK_UNEXPECTEDLY_ATTACHED, resource,
                            "disk %s was not supposed to be attached".formatted(disk.label()), true);
                    updated = updated.withNeedsAttach(false);
                }
                if (liveDisk.lun() != slot) {
                    warn(warnings, DriftKind.DISK_WRONG_SLOT, resource,
                            "disk %s is attached to this instance at a wrong LUN %d instead of %d"
                                    .formatted(disk.label(), liveDisk.lun(), slot), true);
                    log.info("detaching disk {}...", disk.label());
                    vm = vm.withoutDataDisk(disk.id());
                    computeApi.createOrUpdate(state.getResourceGroup(), vm);
                    metrics.recordRemoteCall("vm.update");
                    updated = updated.withNeedsAttach(true);
                }
                state.putDisk(updated);
            } else {
                var updated = disk;
                if (!disk.needsAttach()) {
                    warn(warnings, DriftKind.DISK_UNEXPECTEDLY_DETACHED, resource,
                            "disk %s has been unexpectedly detached".formatted(disk.label()), true);
                    updated = updated.withNeedsAttach(true);
                }
                if (!backingStore.exists(state, disk.id())) {
                    warn(warnings, DriftKind.DISK_UNEXPECTEDLY_DELETED, resource,
                            "disk BLOB %s has been unexpectedly deleted".formatted(disk.label()), true);
                    state.removeDisk(disk.id());
                } else {
                    state.putDisk(updated);
                }
            }
        }
        return vm;
    }

    private void detachUnexpectedDisks(VirtualMachine vm, StateRecord state, List<DriftWarning> warnings) {
        var recorded = state.getDisks();
        var unexpected = vm.dataDisks().stream()
                .filter(d -> !recorded.contains(d.uri()))
                .toList();
        if (unexpected.isEmpty()) {
            return;
        }
        for (DataDisk disk : unexpected) {
            warn(warnings, DriftKind.UNEXPECTED_DISK, state.fullName(),
                    "unexpected disk %s(%s) is attached to this virtual machine".formatted(disk.name(), disk.uri()), true);
        }
        log.info("detaching unexpected disk(s)...");
        var kept = vm.dataDisks().stream()
                .filter(d -> recorded.contains(d.uri()))
                .toList();
        computeApi.createOrUpdate(state.getResourceGroup(), vm.withDataDisks(kept));
        metrics.recordRemoteCall("vm.update");
    }

    private void warnChanged(List<DriftWarning> warnings, DriftKind kind, String resource, String field,
                             Object expected, Object actual, boolean canFix) {
        var message = "%s %s has changed to '%s'; expected it to be '%s'%s"
                .formatted(resource, field, actual, expected, canFix ? "" : "; cannot fix this automatically");
        warn(warnings, kind, resource, message, canFix);
    }

    private void warn(List<DriftWarning> warnings, DriftKind kind, String resource, String message, boolean fixed) {
        log.warn(message);
        metrics.recordDriftWarning(kind.name());
        warnings.add(new DriftWarning(kind, resource, message, fixed));
    }
}

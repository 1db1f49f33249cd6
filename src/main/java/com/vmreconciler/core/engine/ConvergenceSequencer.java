package com.vmreconciler.core.engine;

import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.core.drift.DriftDetector;
import com.vmreconciler.core.drift.DriftReport;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.legality.LegalityChecker;
import com.vmreconciler.core.logging.MdcContext;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.ReconcileOptions;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Drives one machine from its recorded state to the declared state.
 *
 * <p>The steps run in a fixed order:
 * <ol>
 *   <li>reject changes to identity fields of a deployed machine</li>
 *   <li>optionally compare with the live VM and repair drift</li>
 *   <li>reject size or availability set changes without {@code allowReboot}</li>
 *   <li>reject disk layouts that cannot be reached in one step</li>
 *   <li>re-create the VM when the root disk changes (needs {@code allowRecreate})</li>
 *   <li>update parameters of disks that are already recorded</li>
 *   <li>provision network resources and, if missing, the VM</li>
 *   <li>attach new and previously detached data disks</li>
 *   <li>generate missing encryption keys</li>
 *   <li>push size changes to the VM</li>
 * </ol>
 * Every remote mutation is reflected in {@code state} before the next call is
 * issued, so the record is accurate even when a later step fails. Removing
 * disks is not part of this sequence; see {@link TeardownService}.
 */
@Service
public class ConvergenceSequencer {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceSequencer.class);

    private final ComputeApi computeApi;
    private final DriftDetector driftDetector;
    private final LegalityChecker legalityChecker;
    private final VmProvisioner provisioner;
    private final EncryptionKeyGenerator keyGenerator;
    private final Confirmer confirmer;
    private final ReconcilerMetrics metrics;

    public ConvergenceSequencer(ComputeApi computeApi, DriftDetector driftDetector, LegalityChecker legalityChecker,
                                VmProvisioner provisioner, EncryptionKeyGenerator keyGenerator,
                                Confirmer confirmer, ReconcilerMetrics metrics) {
        this.computeApi = computeApi;
        this.driftDetector = driftDetector;
        this.legalityChecker = legalityChecker;
        this.provisioner = provisioner;
        this.keyGenerator = keyGenerator;
        this.confirmer = confirmer;
        this.metrics = metrics;
    }

    /**
     * @return drift found by the check pass, clean when no check was requested
     */
    public DriftReport reconcile(DesiredSpec spec, StateRecord state, ReconcileOptions options) {
        MdcContext.setMachine(spec.machineName(), spec.resourceGroup());
        MdcContext.setOperation("deploy");
        long start = System.currentTimeMillis();
        String status = "success";
        try {
            return doReconcile(spec, state, options);
        } catch (ReconcileException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            metrics.recordReconcileDuration(System.currentTimeMillis() - start);
            metrics.recordReconcileResult(status);
        }
    }

    private DriftReport doReconcile(DesiredSpec spec, StateRecord state, ReconcileOptions options) {
        guardImmutableFields(spec, state);
        adoptIdentity(spec, state);

        var report = options.check() ? checkPass(state, options) : DriftReport.clean();

        if (state.hasVm() && !options.allowReboot()) {
            if (!Objects.equals(spec.size(), state.getSize())) {
                throw ReconcileException.permissionRequired(
                        "reboot is required to change the virtual machine size; please run with --allow-reboot");
            }
            if (!Objects.equals(spec.availabilitySet(), state.getAvailabilitySet())) {
                throw ReconcileException.permissionRequired(
                        "reboot is required to change the availability set name; please run with --allow-reboot");
            }
        }

        if (state.hasVm()) {
            legalityChecker.check(spec.disks(), state.getDisks());
        }

        substituteRootDisk(spec, state, options);
        changeExistingDiskParameters(spec, state);
        provisioner.provision(spec, state);
        attachMissingDisks(spec, state);
        keyGenerator.generateMissingKeys(state);
        syncProperties(spec, state);

        return report;
    }

    private void guardImmutableFields(DesiredSpec spec, StateRecord state) {
        if (!state.isDeployed()) {
            return;
        }
        noChange(state, "instance name", state.getMachineName(), spec.machineName());
        noChange(state, "resource group", state.getResourceGroup(), spec.resourceGroup());
        noChange(state, "virtual network", state.getVirtualNetwork(), spec.virtualNetwork());
        noChange(state, "storage", state.getStorage(), spec.storage());
        noChange(state, "location", state.getLocation(), spec.location());
    }

    private static void noChange(StateRecord state, String field, String recorded, String declared) {
        if (!Objects.equals(recorded, declared)) {
            throw ReconcileException.configuration(
                    "cannot change the %s of a deployed %s".formatted(field, state.fullName()));
        }
    }

    private static void adoptIdentity(DesiredSpec spec, StateRecord state) {
        state.setMachineName(spec.machineName());
        state.setResourceGroup(spec.resourceGroup());
        state.setVirtualNetwork(spec.virtualNetwork());
        state.setStorage(spec.storage());
        state.setLocation(spec.location());
    }

    private DriftReport checkPass(StateRecord state, ReconcileOptions options) {
        var rg = state.getResourceGroup();
        var live = computeApi.get(rg, state.getMachineName());

        if (live.isPresent()) {
            if (state.hasVm()) {
                return driftDetector.detect(live.get(), state);
            }
            log.warn("{} exists, but isn't supposed to; probably this is the result of a botched creation "
                    + "attempt and can be fixed by deletion, but it could also be a name collision and valuable "
                    + "data could be lost; please make sure it isn't one", state.fullName());
            if (confirmer.confirm("are you sure you want to destroy %s?".formatted(state.fullName()))) {
                log.info("destroying...");
                computeApi.delete(rg, state.getMachineName());
                metrics.recordRemoteCall("vm.delete");
            }
        } else if (state.hasVm()) {
            log.warn("the instance seems to have been destroyed behind our back");
            if (!options.allowRecreate()) {
                throw ReconcileException.permissionRequired("use --allow-recreate to fix");
            }
            state.markResourceDeleted();
        }
        return DriftReport.clean();
    }

    private void substituteRootDisk(DesiredSpec spec, StateRecord state, ReconcileOptions options) {
        if (!state.hasVm()) {
            return;
        }
        var desired = spec.rootDisk();
        var recorded = state.getDisks().findAttachedRoot()
                .orElseThrow(() -> ReconcileException.internal(state.fullName() + " has no attached root disk recorded"));

        if (desired.id().equals(recorded.id())
                && desired.hostCaching() == recorded.hostCaching()
                && Objects.equals(desired.name(), recorded.name())) {
            return;
        }
        log.warn("a modification of the root disk is requested that requires that the virtual machine is re-created");
        if (!options.allowRecreate()) {
            throw ReconcileException.permissionRequired("use --allow-recreate to fix");
        }
        log.info("destroying the virtual machine, but preserving the disk contents...");
        computeApi.delete(state.getResourceGroup(), state.getMachineName());
        metrics.recordRemoteCall("vm.delete");
        state.markResourceDeleted();
    }

    private void changeExistingDiskParameters(DesiredSpec spec, StateRecord state) {
        for (DiskRecord disk : spec.disks().slotDisks()) {
            var found = state.getDisks().get(disk.id());
            if (found.isEmpty()) {
                continue;
            }
            var recorded = found.get();

            if (state.hasVm() && !recorded.needsAttach()) {
                if (disk.hostCaching() != recorded.hostCaching()) {
                    log.info("changing parameters of the attached disk {}", disk.label());
                    var vm = computeApi.require(state.getResourceGroup(), state.getMachineName());
                    if (vm.findDataDisk(disk.id()).isEmpty()) {
                        throw ReconcileException.remoteFailure(
                                "disk %s was supposed to be attached at %s but wasn't found; please run deploy --check to fix this"
                                        .formatted(disk.label(), disk.device()));
                    }
                    var updated = vm.withDataDisks(vm.dataDisks().stream()
                            .map(d -> d.uri().equals(disk.id()) ? d.withCaching(disk.hostCaching()) : d)
                            .toList());
                    computeApi.createOrUpdate(state.getResourceGroup(), updated);
                    metrics.recordRemoteCall("vm.update");
                    recorded = recorded.withHostCaching(disk.hostCaching());
                }
            } else {
                recorded = recorded.withPlacement(disk.device(), disk.name(), disk.hostCaching());
            }
            state.putDisk(recorded.withLocalMetadata(disk));
        }
    }

    private void attachMissingDisks(DesiredSpec spec, StateRecord state) {
        for (DiskRecord disk : spec.disks().slotDisks()) {
            var recorded = state.getDisks().get(disk.id());
            if (recorded.isPresent() && !recorded.get().needsAttach()) {
                continue;
            }
            log.info("attaching data disk {}", disk.label());
            var vm = computeApi.require(state.getResourceGroup(), state.getMachineName());
            computeApi.createOrUpdate(state.getResourceGroup(), vm.withDataDisk(provisioner.toDataDisk(state, disk)));
            metrics.recordRemoteCall("vm.update");
            state.putDisk(disk);
        }
    }

    private void syncProperties(DesiredSpec spec, StateRecord state) {
        boolean changed = !Objects.equals(spec.size(), state.getSize())
                || !Objects.equals(spec.availabilitySet(), state.getAvailabilitySet());
        if (!changed) {
            state.setObtainIp(spec.obtainIp());
            return;
        }
        log.info("updating properties of {}...", state.fullName());
        var vm = computeApi.require(state.getResourceGroup(), state.getMachineName());
        computeApi.createOrUpdate(state.getResourceGroup(), vm.withSize(spec.size()));
        metrics.recordRemoteCall("vm.update");
        VmProvisioner.copyProperties(spec, state);
    }
}

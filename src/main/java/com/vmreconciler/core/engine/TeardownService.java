package com.vmreconciler.core.engine;

import com.vmreconciler.cloud.CloudApiException;
import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.ResourceNotFoundException;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.StateRecord;
import com.vmreconciler.core.shell.MachineShell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Releases recorded disks that are no longer declared. Runs after the new
 * machine configuration is active, so the disks are no longer in use.
 *
 * <p>Each disk is unmounted on the machine (best effort), detached from the
 * VM if attached, its backing store deleted if ephemeral, and finally dropped
 * from the record together with its generated key. A VM that is already gone
 * counts as detached; any other failed detach keeps the record so the next run
 * retries.
 */
@Service
public class TeardownService {

    private static final Logger log = LoggerFactory.getLogger(TeardownService.class);

    private final ComputeApi computeApi;
    private final BackingStoreService backingStore;
    private final MachineShell shell;
    private final KeyRetirement keyRetirement;
    private final ReconcilerMetrics metrics;

    public TeardownService(ComputeApi computeApi, BackingStoreService backingStore, MachineShell shell,
                           KeyRetirement keyRetirement, ReconcilerMetrics metrics) {
        this.computeApi = computeApi;
        this.backingStore = backingStore;
        this.shell = shell;
        this.keyRetirement = keyRetirement;
        this.metrics = metrics;
    }

    /**
     * @return number of disk records removed
     */
    public int releaseRemovedDisks(DesiredSpec spec, StateRecord state) {
        int released = 0;
        for (DiskRecord disk : new ArrayList<>(state.getDisks().values())) {
            if (spec.disks().contains(disk.id())) {
                continue;
            }

            if (!disk.needsAttach() && disk.slot().isPresent()) {
                unmount(state, disk);
                if (!detach(state, disk)) {
                    continue;
                }
                disk = disk.withNeedsAttach(true);
                state.putDisk(disk);
            }

            if (disk.ephemeral()) {
                backingStore.deleteVolume(state, disk.id(), disk.name(), null);
            }

            // make the device node disappear on older kernels
            shell.run(state, "sg_scan " + disk.device());

            state.removeDisk(disk.id());
            keyRetirement.retire(state, disk.id());
            released++;
        }
        return released;
    }

    private void unmount(StateRecord state, DiskRecord disk) {
        if (disk.encrypt()) {
            var mapper = "/dev/mapper/" + disk.name();
            log.info("unmounting device '{}'...", mapper);
            shell.run(state, "umount -l " + mapper);
            shell.run(state, "cryptsetup luksClose " + mapper);
        } else {
            log.info("unmounting device '{}'...", disk.device());
            shell.run(state, "umount -l " + disk.device());
        }
    }

    private boolean detach(StateRecord state, DiskRecord disk) {
        log.info("detaching Azure disk {}...", disk.label());
        try {
            var vm = computeApi.require(state.getResourceGroup(), state.getMachineName());
            computeApi.createOrUpdate(state.getResourceGroup(), vm.withoutDataDisk(disk.id()));
            metrics.recordRemoteCall("vm.update");
            return true;
        } catch (ResourceNotFoundException e) {
            log.warn("virtual machine {} seems to have been destroyed already; Azure disk {} is not attached",
                    state.fullName(), disk.label());
            return true;
        } catch (CloudApiException e) {
            log.warn("failed to detach Azure disk {}, keeping it for the next run: {}", disk.label(), e.getMessage());
            return false;
        }
    }
}

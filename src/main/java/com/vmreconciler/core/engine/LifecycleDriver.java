package com.vmreconciler.core.engine;

import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.NetworkApi;
import com.vmreconciler.cloud.ResourceNotFoundException;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.LifecycleState;
import com.vmreconciler.core.model.StateRecord;
import com.vmreconciler.core.shell.MachineShell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Start, stop, reboot and destroy of a provisioned machine.
 */
@Service
public class LifecycleDriver {

    private static final Logger log = LoggerFactory.getLogger(LifecycleDriver.class);

    private final ComputeApi computeApi;
    private final NetworkApi networkApi;
    private final BackingStoreService backingStore;
    private final KeyRetirement keyRetirement;
    private final MachineShell shell;
    private final Confirmer confirmer;
    private final ReconcilerMetrics metrics;

    public LifecycleDriver(ComputeApi computeApi, NetworkApi networkApi, BackingStoreService backingStore,
                           KeyRetirement keyRetirement, MachineShell shell, Confirmer confirmer,
                           ReconcilerMetrics metrics) {
        this.computeApi = computeApi;
        this.networkApi = networkApi;
        this.backingStore = backingStore;
        this.keyRetirement = keyRetirement;
        this.shell = shell;
        this.confirmer = confirmer;
        this.metrics = metrics;
    }

    public void start(StateRecord state) {
        if (!state.hasVm()) {
            return;
        }
        state.setLifecycleState(LifecycleState.STARTING);
        log.info("starting Azure machine...");
        computeApi.start(state.getResourceGroup(), state.getMachineName());
        metrics.recordRemoteCall("vm.start");
    }

    public void stop(StateRecord state) {
        if (!state.hasVm()) {
            return;
        }
        log.info("stopping Azure machine...");
        state.setLifecycleState(LifecycleState.STOPPING);
        computeApi.powerOff(state.getResourceGroup(), state.getMachineName());
        metrics.recordRemoteCall("vm.power_off");
        state.setLifecycleState(LifecycleState.STOPPED);
    }

    /**
     * A hard reboot resets the VM through the compute API; a soft one asks the
     * guest OS to reboot.
     */
    public void reboot(StateRecord state, boolean hard) {
        if (hard) {
            log.info("sending hard reset to Azure machine...");
            computeApi.restart(state.getResourceGroup(), state.getMachineName());
            metrics.recordRemoteCall("vm.restart");
        } else {
            log.info("rebooting...");
            if (!shell.run(state, "systemctl reboot")) {
                log.warn("reboot command did not complete; the machine may still be rebooting");
            }
        }
        state.setLifecycleState(LifecycleState.STARTING);
    }

    /**
     * Deletes the VM, ephemeral backing stores, the network interface and the
     * public IP.
     *
     * @return {@code false} if the operator declined, either before anything
     *         was deleted or when asked to discard the remaining generated keys
     */
    public boolean destroy(StateRecord state) {
        var rg = state.getResourceGroup();

        if (state.hasVm()) {
            if (computeApi.get(rg, state.getMachineName()).isPresent()) {
                if (!confirmer.confirm("are you sure you want to destroy %s?".formatted(state.fullName()))) {
                    return false;
                }
                log.info("destroying the Azure machine...");
                computeApi.delete(rg, state.getMachineName());
                metrics.recordRemoteCall("vm.delete");
            } else {
                log.warn("{} seems to have been destroyed already", state.fullName());
            }
        }
        state.markResourceDeleted();

        for (DiskRecord disk : new ArrayList<>(state.getDisks().values())) {
            if (disk.ephemeral()) {
                backingStore.deleteVolume(state, disk.id(), disk.name(), null);
            }
            state.removeDisk(disk.id());
            keyRetirement.retire(state, disk.id());
        }

        var nic = state.getNetworkInterface();
        if (nic != null) {
            log.info("destroying the network interface...");
            release(networkApi.getNetworkInterface(rg, nic).isPresent(),
                    () -> networkApi.deleteNetworkInterface(rg, nic), "nic.delete",
                    "network interface %s seems to have been destroyed already".formatted(nic));
            state.setNetworkInterface(null);
        }

        var publicIp = state.getPublicIp();
        if (publicIp != null) {
            log.info("releasing the ip address...");
            release(networkApi.getPublicIp(rg, publicIp).isPresent(),
                    () -> networkApi.deletePublicIp(rg, publicIp), "publicip.delete",
                    "public IP %s seems to have been released already".formatted(publicIp));
            state.setPublicIp(null);
            state.setObtainIp(null);
        }

        if (!state.getGeneratedEncryptionKeys().isEmpty()) {
            boolean discard = confirmer.confirm(("%s resource still stores generated encryption keys for disks %s; if the "
                    + "resource is deleted, the keys are deleted along with it and the data will be lost even if "
                    + "you have a copy of the disks' contents; are you sure you want to delete the encryption keys?")
                    .formatted(state.fullName(), state.getGeneratedEncryptionKeys().keySet()));
            if (!discard) {
                return false;
            }
            for (String diskId : new ArrayList<>(state.getGeneratedEncryptionKeys().keySet())) {
                state.removeGeneratedKey(diskId);
            }
        }
        return true;
    }

    private void release(boolean exists, Runnable delete, String operation, String goneMessage) {
        if (!exists) {
            log.warn(goneMessage);
            return;
        }
        try {
            delete.run();
            metrics.recordRemoteCall(operation);
        } catch (ResourceNotFoundException e) {
            log.warn(goneMessage);
        }
    }
}

package com.vmreconciler.core.health;

import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.NetworkApi;
import com.vmreconciler.cloud.ProvisioningState;
import com.vmreconciler.core.engine.BackingStoreService;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.LifecycleState;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Read-only comparison of the live VM with the record. Only the lifecycle
 * state and the public IPv4 are updated.
 */
@Service
public class MachineHealthChecker {

    private static final Logger log = LoggerFactory.getLogger(MachineHealthChecker.class);

    private final ComputeApi computeApi;
    private final NetworkApi networkApi;
    private final BackingStoreService backingStore;

    public MachineHealthChecker(ComputeApi computeApi, NetworkApi networkApi, BackingStoreService backingStore) {
        this.computeApi = computeApi;
        this.networkApi = networkApi;
        this.backingStore = backingStore;
    }

    public MachineCheckResult check(StateRecord state) {
        var found = computeApi.get(state.getResourceGroup(), state.getMachineName());
        if (found.isEmpty()) {
            state.setLifecycleState(LifecycleState.MISSING);
            return MachineCheckResult.missing();
        }
        var vm = found.get();
        var messages = new ArrayList<String>();

        boolean isUp = vm.provisioningState() == ProvisioningState.SUCCEEDED;
        if (vm.provisioningState() == ProvisioningState.FAILED) {
            messages.add("vm resource exists, but is in a failed state");
        }
        if (!isUp) {
            state.setLifecycleState(LifecycleState.STOPPED);
            return new MachineCheckResult(true, false, null, messages);
        }
        state.setLifecycleState(LifecycleState.RUNNING);

        boolean disksOk = true;
        for (DiskRecord disk : state.getDisks().values()) {
            if (disk.isRoot()) {
                if (!disk.id().equals(vm.osDisk().uri())) {
                    // a replaced root disk stays recorded as detached until teardown
                    if (!disk.needsAttach()) {
                        disksOk = false;
                        messages.add("different root disk instead of " + disk.id());
                    }
                }
                continue;
            }
            if (vm.findDataDisk(disk.id()).isEmpty()) {
                disksOk = false;
                messages.add("disk %s is detached".formatted(disk.label()));
                if (!backingStore.exists(state, disk.id())) {
                    messages.add("disk %s is destroyed".formatted(disk.label()));
                }
            }
        }

        var liveIp = networkApi.currentAddress(state.getResourceGroup(), state.getPublicIp());
        if (!Objects.equals(liveIp, state.getPublicIpv4())) {
            log.warn("{} public IPv4 has changed to '{}'; expected it to be '{}'",
                    state.fullName(), liveIp, state.getPublicIpv4());
            state.setPublicIpv4(liveIp);
        }
        return new MachineCheckResult(true, true, disksOk, messages);
    }
}

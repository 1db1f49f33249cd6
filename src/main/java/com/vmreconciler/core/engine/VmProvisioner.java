package com.vmreconciler.core.engine;

import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.DataDisk;
import com.vmreconciler.cloud.DiskCreateOption;
import com.vmreconciler.cloud.NetworkApi;
import com.vmreconciler.cloud.OperationStatus;
import com.vmreconciler.cloud.OsDisk;
import com.vmreconciler.cloud.OsProfile;
import com.vmreconciler.cloud.PublicIpAddress;
import com.vmreconciler.cloud.VirtualMachine;
import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.LifecycleState;
import com.vmreconciler.core.model.StateRecord;
import com.vmreconciler.core.poll.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.List;

/**
 * Creates the public IP, the network interface and the VM itself.
 *
 * <p>VM creation is submitted as one request carrying the root disk and every
 * declared data disk. Completion is assumed as soon as the public IP has an
 * address or the operation is no longer in progress, whichever is seen first;
 * a failure reported after the address appeared goes unnoticed here and shows
 * up in the next {@code check}.
 */
@Service
public class VmProvisioner {

    private static final Logger log = LoggerFactory.getLogger(VmProvisioner.class);

    static final String ADMIN_USERNAME = "randomuser";
    private static final String PASSWORD_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final ComputeApi computeApi;
    private final NetworkApi networkApi;
    private final BackingStoreService backingStore;
    private final BoundedRetry retry;
    private final ReconcilerProperties properties;
    private final ReconcilerMetrics metrics;
    private final SecureRandom random = new SecureRandom();

    public VmProvisioner(ComputeApi computeApi, NetworkApi networkApi, BackingStoreService backingStore,
                         BoundedRetry retry, ReconcilerProperties properties, ReconcilerMetrics metrics) {
        this.computeApi = computeApi;
        this.networkApi = networkApi;
        this.backingStore = backingStore;
        this.retry = retry;
        this.properties = properties;
        this.metrics = metrics;
    }

    public void provision(DesiredSpec spec, StateRecord state) {
        ensurePublicIp(spec, state);
        ensureNetworkInterface(spec, state);

        if (state.hasVm()) {
            return;
        }

        var rg = state.getResourceGroup();
        if (computeApi.get(rg, state.getMachineName()).isPresent()) {
            throw ReconcileException.remoteFailure("tried creating a virtual machine that already exists; "
                    + "please run 'deploy --check' to fix this");
        }

        var rootSpec = spec.rootDisk();
        var nicId = networkApi.getNetworkInterface(rg, state.getNetworkInterface())
                .orElseThrow(() -> ReconcileException.remoteFailure(
                        "network interface %s of %s doesn't exist".formatted(state.getNetworkInterface(), state.fullName())))
                .id();

        var dataDisks = spec.disks().slotDisks().stream()
                .map(disk -> toDataDisk(state, disk))
                .toList();

        boolean rootExists = backingStore.exists(state, rootSpec.id());
        var osDisk = new OsDisk(rootSpec.name(), rootSpec.id(), rootSpec.hostCaching(),
                rootExists ? DiskCreateOption.ATTACH : DiskCreateOption.FROM_IMAGE,
                rootExists ? null : spec.rootDiskImageUrl());
        var osProfile = rootExists ? null
                : new OsProfile(ADMIN_USERNAME, "aA9+" + randomString(32), state.getMachineName(), null);

        log.info("creating {}...", state.fullName());
        var request = new VirtualMachine(state.getMachineName(), state.getLocation(), spec.size(),
                spec.availabilitySet(), null, osProfile, osDisk, dataDisks, List.of(nicId));
        var operation = computeApi.beginCreateOrUpdate(rg, request);
        metrics.recordRemoteCall("vm.create");

        retry.await("provisioning of " + state.fullName(),
                () -> fetchPublicIpv4(state) != null
                        || !computeApi.getOperationStatus(operation).inProgressState(),
                properties.getPollInterval(), properties.getMaxPollAttempts());

        var status = computeApi.getOperationStatus(operation);
        if (status.state() == OperationStatus.State.FAILED) {
            throw ReconcileException.remoteFailure(
                    "failed to provision %s; %s".formatted(state.fullName(), status.error()));
        }

        state.setVmId(state.getMachineName());
        state.setLifecycleState(LifecycleState.STARTING);
        copyProperties(spec, state);

        state.setPublicIpv4(fetchPublicIpv4(state));
        log.info("got IP: {}", state.getPublicIpv4());

        for (DiskRecord disk : spec.disks().values()) {
            state.putDisk(disk);
        }
    }

    /**
     * Data disk entry for {@code disk}, attaching its backing store when it
     * already exists and creating an empty one otherwise.
     */
    public DataDisk toDataDisk(StateRecord state, DiskRecord disk) {
        var option = backingStore.exists(state, disk.id()) ? DiskCreateOption.ATTACH : DiskCreateOption.EMPTY;
        return new DataDisk(disk.name(), disk.id(), disk.hostCaching(), option, disk.slot().getAsInt(), disk.size());
    }

    private String fetchPublicIpv4(StateRecord state) {
        return networkApi.currentAddress(state.getResourceGroup(), state.getPublicIp());
    }

    static void copyProperties(DesiredSpec spec, StateRecord state) {
        state.setSize(spec.size());
        state.setObtainIp(spec.obtainIp());
        state.setAvailabilitySet(spec.availabilitySet());
    }

    private void ensurePublicIp(DesiredSpec spec, StateRecord state) {
        if (state.getPublicIp() != null || !spec.obtainIp()) {
            return;
        }
        log.info("getting an IP address");
        networkApi.createOrUpdatePublicIp(state.getResourceGroup(), state.getMachineName(), spec.location());
        metrics.recordRemoteCall("publicip.create");
        state.setPublicIp(state.getMachineName());
        state.setObtainIp(spec.obtainIp());
    }

    private void ensureNetworkInterface(DesiredSpec spec, StateRecord state) {
        if (state.getNetworkInterface() != null) {
            return;
        }
        log.info("creating a network interface");
        var rg = state.getResourceGroup();
        var publicIpId = state.getPublicIp() == null ? null
                : networkApi.getPublicIp(rg, state.getPublicIp())
                        .map(PublicIpAddress::id)
                        .orElseThrow(() -> ReconcileException.remoteFailure(
                                "public IP %s of %s doesn't exist".formatted(state.getPublicIp(), state.fullName())));

        var vnet = state.getVirtualNetwork();
        var subnet = networkApi.getSubnet(rg, vnet, vnet)
                .orElseThrow(() -> ReconcileException.configuration(
                        "virtual network %s has no subnet named %s".formatted(vnet, vnet)));

        networkApi.createOrUpdateNetworkInterface(rg, state.getMachineName(), spec.location(), subnet, publicIpId);
        metrics.recordRemoteCall("nic.create");
        state.setNetworkInterface(state.getMachineName());
    }

    private String randomString(int length) {
        var sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(PASSWORD_ALPHABET.charAt(random.nextInt(PASSWORD_ALPHABET.length())));
        }
        return sb.toString();
    }
}

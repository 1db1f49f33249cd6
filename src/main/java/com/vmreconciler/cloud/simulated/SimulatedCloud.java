package com.vmreconciler.cloud.simulated;

import com.vmreconciler.cloud.AsyncOperation;
import com.vmreconciler.cloud.BlobApi;
import com.vmreconciler.cloud.BlobProperties;
import com.vmreconciler.cloud.BlobRef;
import com.vmreconciler.cloud.BlobUrl;
import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.DataDisk;
import com.vmreconciler.cloud.DiskCreateOption;
import com.vmreconciler.cloud.NetworkApi;
import com.vmreconciler.cloud.NetworkInterface;
import com.vmreconciler.cloud.OperationStatus;
import com.vmreconciler.cloud.ProvisioningState;
import com.vmreconciler.cloud.PublicIpAddress;
import com.vmreconciler.cloud.ResourceNotFoundException;
import com.vmreconciler.cloud.Subnet;
import com.vmreconciler.cloud.VirtualMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory compute, network and blob service.
 * <p>
 * Behaves like the remote APIs closely enough for dry runs: data disks created
 * empty and OS disks created from an image leave a blob behind, public IPs get
 * an address once VM provisioning completes, and every mutating call is
 * recorded in {@link #calls()}. Provisioning reports "in progress" for a
 * configurable number of polls.
 */
public class SimulatedCloud implements ComputeApi, NetworkApi, BlobApi {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCloud.class);

    private static final String SUBSCRIPTION = "/subscriptions/00000000-0000-0000-0000-000000000000";

    /**
     * One mutating call, e.g. {@code vm.update} on {@code rg/web-1}.
     */
    public record Call(String operation, String target) {}

    private static final class Blob {
        String content;
        final Map<String, String> metadata = new HashMap<>();
        final Map<String, String> snapshots = new LinkedHashMap<>();

        Blob(String content) {
            this.content = content;
        }
    }

    private static final class PendingOperation {
        final String resourceGroup;
        final String vmName;
        int remainingPolls;
        final OperationStatus outcome;

        PendingOperation(String resourceGroup, String vmName, int remainingPolls, OperationStatus outcome) {
            this.resourceGroup = resourceGroup;
            this.vmName = vmName;
            this.remainingPolls = remainingPolls;
            this.outcome = outcome;
        }
    }

    private final Map<String, VirtualMachine> vms = new LinkedHashMap<>();
    private final Map<String, PublicIpAddress> publicIps = new LinkedHashMap<>();
    private final Map<String, NetworkInterface> nics = new LinkedHashMap<>();
    private final Map<String, Blob> blobs = new LinkedHashMap<>();
    private final Map<String, PendingOperation> operations = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private final List<VirtualMachine> submitted = new ArrayList<>();

    private int provisioningPolls = 0;
    private String provisioningError;
    private int operationCounter;
    private int snapshotCounter;
    private int addressCounter;

    // -- test and dry-run controls --

    /** Number of status polls that report "in progress" before a creation completes. */
    public void setProvisioningPolls(int polls) {
        this.provisioningPolls = polls;
    }

    /** Makes the next VM creation fail with {@code error} as the provider payload. */
    public void failNextProvisioning(String error) {
        this.provisioningError = error;
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public List<Call> calls(String operation) {
        return calls.stream().filter(c -> c.operation().equals(operation)).toList();
    }

    public void clearCalls() {
        calls.clear();
        submitted.clear();
    }

    /** Every VM definition sent through create-or-update, in order. */
    public List<VirtualMachine> submittedVms() {
        return List.copyOf(submitted);
    }

    /** Replaces the live VM without recording a call, as an out-of-band change would. */
    public void putVm(String resourceGroup, VirtualMachine vm) {
        vms.put(key(resourceGroup, vm.name()), vm);
    }

    /** Removes the live VM without recording a call. */
    public void removeVm(String resourceGroup, String name) {
        vms.remove(key(resourceGroup, name));
    }

    /** Creates the blob or overwrites its content, keeping existing snapshots. */
    public void putBlob(String url, String content) {
        var existing = blobs.get(blobKey(parse(url)));
        if (existing != null) {
            existing.content = content;
        } else {
            blobs.put(blobKey(parse(url)), new Blob(content));
        }
    }

    public void removeBlob(String url) {
        blobs.remove(blobKey(parse(url)));
    }

    public Optional<String> blobContent(String url) {
        return Optional.ofNullable(blobs.get(blobKey(parse(url)))).map(b -> b.content);
    }

    public void setPublicIpAddress(String resourceGroup, String name, String address) {
        var ip = publicIps.get(key(resourceGroup, name));
        if (ip == null) {
            throw new ResourceNotFoundException("public IP " + name);
        }
        publicIps.put(key(resourceGroup, name), new PublicIpAddress(ip.id(), ip.name(), address));
    }

    // -- compute --

    @Override
    public Optional<VirtualMachine> get(String resourceGroup, String name) {
        return Optional.ofNullable(vms.get(key(resourceGroup, name)));
    }

    @Override
    public VirtualMachine createOrUpdate(String resourceGroup, VirtualMachine vm) {
        boolean exists = vms.containsKey(key(resourceGroup, vm.name()));
        record(exists ? "vm.update" : "vm.create", resourceGroup, vm.name());
        submitted.add(vm);
        return store(resourceGroup, vm, ProvisioningState.SUCCEEDED);
    }

    @Override
    public AsyncOperation beginCreateOrUpdate(String resourceGroup, VirtualMachine vm) {
        boolean exists = vms.containsKey(key(resourceGroup, vm.name()));
        record(exists ? "vm.update" : "vm.create", resourceGroup, vm.name());
        submitted.add(vm);

        var outcome = provisioningError == null
                ? OperationStatus.succeeded()
                : OperationStatus.failed(provisioningError);
        provisioningError = null;

        store(resourceGroup, vm, ProvisioningState.CREATING);
        var handle = "operation-" + (++operationCounter);
        operations.put(handle, new PendingOperation(resourceGroup, vm.name(), provisioningPolls, outcome));
        return new AsyncOperation(handle);
    }

    @Override
    public OperationStatus getOperationStatus(AsyncOperation operation) {
        var pending = operations.get(operation.handle());
        if (pending == null) {
            throw new ResourceNotFoundException("operation " + operation.handle());
        }
        if (pending.remainingPolls > 0) {
            pending.remainingPolls--;
            return OperationStatus.inProgress();
        }
        var vmKey = key(pending.resourceGroup, pending.vmName);
        var vm = vms.get(vmKey);
        if (vm != null && vm.provisioningState() == ProvisioningState.CREATING) {
            var finalState = pending.outcome.state() == OperationStatus.State.SUCCEEDED
                    ? ProvisioningState.SUCCEEDED
                    : ProvisioningState.FAILED;
            vms.put(vmKey, withState(vm, finalState));
            if (finalState == ProvisioningState.SUCCEEDED) {
                assignAddresses(pending.resourceGroup, vm);
            }
        }
        return pending.outcome;
    }

    @Override
    public void delete(String resourceGroup, String name) {
        if (vms.remove(key(resourceGroup, name)) == null) {
            throw new ResourceNotFoundException("virtual machine " + name);
        }
        record("vm.delete", resourceGroup, name);
    }

    @Override
    public void start(String resourceGroup, String name) {
        require(resourceGroup, name);
        record("vm.start", resourceGroup, name);
    }

    @Override
    public void powerOff(String resourceGroup, String name) {
        require(resourceGroup, name);
        record("vm.powerOff", resourceGroup, name);
    }

    @Override
    public void restart(String resourceGroup, String name) {
        require(resourceGroup, name);
        record("vm.restart", resourceGroup, name);
    }

    // -- network --

    @Override
    public PublicIpAddress createOrUpdatePublicIp(String resourceGroup, String name, String location) {
        record("publicip.create", resourceGroup, name);
        var ip = new PublicIpAddress(resourceId(resourceGroup, "Microsoft.Network/publicIPAddresses", name), name, null);
        publicIps.put(key(resourceGroup, name), ip);
        return ip;
    }

    @Override
    public Optional<PublicIpAddress> getPublicIp(String resourceGroup, String name) {
        return Optional.ofNullable(publicIps.get(key(resourceGroup, name)));
    }

    @Override
    public void deletePublicIp(String resourceGroup, String name) {
        if (publicIps.remove(key(resourceGroup, name)) == null) {
            throw new ResourceNotFoundException("public IP " + name);
        }
        record("publicip.delete", resourceGroup, name);
    }

    @Override
    public Optional<Subnet> getSubnet(String resourceGroup, String virtualNetwork, String subnetName) {
        var id = resourceId(resourceGroup, "Microsoft.Network/virtualNetworks", virtualNetwork) + "/subnets/" + subnetName;
        return Optional.of(new Subnet(id, subnetName));
    }

    @Override
    public NetworkInterface createOrUpdateNetworkInterface(String resourceGroup, String name, String location,
                                                           Subnet subnet, String publicIpId) {
        record("nic.create", resourceGroup, name);
        var nic = new NetworkInterface(resourceId(resourceGroup, "Microsoft.Network/networkInterfaces", name),
                name, publicIpId);
        nics.put(key(resourceGroup, name), nic);
        return nic;
    }

    @Override
    public Optional<NetworkInterface> getNetworkInterface(String resourceGroup, String name) {
        return Optional.ofNullable(nics.get(key(resourceGroup, name)));
    }

    @Override
    public void deleteNetworkInterface(String resourceGroup, String name) {
        if (nics.remove(key(resourceGroup, name)) == null) {
            throw new ResourceNotFoundException("network interface " + name);
        }
        record("nic.delete", resourceGroup, name);
    }

    // -- blobs --

    @Override
    public Optional<BlobProperties> getProperties(BlobRef ref) {
        var blob = blobs.get(blobKey(ref));
        if (blob == null) {
            return Optional.empty();
        }
        if (ref.isSnapshot()) {
            var snapshot = blob.snapshots.get(ref.snapshotId());
            return snapshot == null ? Optional.empty()
                    : Optional.of(new BlobProperties(snapshot.length(), etag(snapshot), Map.of()));
        }
        return Optional.of(new BlobProperties(blob.content.length(), etag(blob.content), blob.metadata));
    }

    @Override
    public void deleteBlob(BlobRef ref) {
        var blob = blobs.get(blobKey(ref));
        if (ref.isSnapshot()) {
            if (blob == null || blob.snapshots.remove(ref.snapshotId()) == null) {
                throw new ResourceNotFoundException("snapshot %s of %s".formatted(ref.snapshotId(), blobKey(ref)));
            }
        } else if (blobs.remove(blobKey(ref)) == null) {
            throw new ResourceNotFoundException("blob " + blobKey(ref));
        }
        record("blob.delete", null, blobKey(ref) + (ref.isSnapshot() ? "?snapshot=" + ref.snapshotId() : ""));
    }

    @Override
    public String snapshotBlob(BlobRef ref, Map<String, String> metadata) {
        var blob = blobs.get(blobKey(ref));
        if (blob == null) {
            throw new ResourceNotFoundException("blob " + blobKey(ref));
        }
        var id = "snapshot-" + (++snapshotCounter);
        blob.snapshots.put(id, blob.content);
        record("blob.snapshot", null, blobKey(ref));
        return id;
    }

    @Override
    public void copyBlob(BlobRef target, String sourceUrl) {
        var parts = sourceUrl.split("\\?snapshot=", 2);
        var source = blobs.get(blobKey(parse(parts[0])));
        String content = source == null ? null
                : parts.length == 2 ? source.snapshots.get(parts[1]) : source.content;
        if (content == null) {
            throw new ResourceNotFoundException("copy source " + sourceUrl);
        }
        var existing = blobs.get(blobKey(target));
        if (existing != null) {
            existing.content = content;
        } else {
            blobs.put(blobKey(target), new Blob(content));
        }
        record("blob.copy", null, blobKey(target));
    }

    // -- internals --

    private VirtualMachine store(String resourceGroup, VirtualMachine vm, ProvisioningState state) {
        for (DataDisk disk : vm.dataDisks()) {
            if (disk.createOption() == DiskCreateOption.EMPTY) {
                blobs.putIfAbsent(blobKey(parse(disk.uri())), new Blob(""));
            }
        }
        if (vm.osDisk() != null && vm.osDisk().createOption() == DiskCreateOption.FROM_IMAGE) {
            blobs.putIfAbsent(blobKey(parse(vm.osDisk().uri())), new Blob("image:" + vm.osDisk().sourceImageUri()));
        }
        var stored = withState(vm, state);
        vms.put(key(resourceGroup, vm.name()), stored);
        return stored;
    }

    private void assignAddresses(String resourceGroup, VirtualMachine vm) {
        for (String nicId : vm.networkInterfaceIds()) {
            nics.values().stream()
                    .filter(nic -> nic.id().equals(nicId) && nic.publicIpId() != null)
                    .forEach(nic -> publicIps.replaceAll((k, ip) -> ip.id().equals(nic.publicIpId()) && ip.ipAddress() == null
                            ? new PublicIpAddress(ip.id(), ip.name(), "203.0.113." + (++addressCounter))
                            : ip));
        }
        log.debug("Simulated provisioning of {}/{} completed", resourceGroup, vm.name());
    }

    private static VirtualMachine withState(VirtualMachine vm, ProvisioningState state) {
        return new VirtualMachine(vm.name(), vm.location(), vm.size(), vm.availabilitySet(), state,
                vm.osProfile(), vm.osDisk(), vm.dataDisks(), vm.networkInterfaceIds());
    }

    private void record(String operation, String resourceGroup, String name) {
        var target = resourceGroup == null ? name : resourceGroup + "/" + name;
        log.debug("Simulated {} on {}", operation, target);
        calls.add(new Call(operation, target));
    }

    private static BlobRef parse(String url) {
        return BlobUrl.parse(url)
                .orElseThrow(() -> new IllegalArgumentException("not a BLOB URL: " + url));
    }

    private static String blobKey(BlobRef ref) {
        return ref.account() + "/" + ref.container() + "/" + ref.name();
    }

    private static String key(String resourceGroup, String name) {
        return resourceGroup + "/" + name;
    }

    private static String resourceId(String resourceGroup, String type, String name) {
        return "%s/resourceGroups/%s/providers/%s/%s".formatted(SUBSCRIPTION, resourceGroup, type, name);
    }

    private static String etag(String content) {
        return "\"0x" + Integer.toHexString(content.hashCode()) + "\"";
    }
}

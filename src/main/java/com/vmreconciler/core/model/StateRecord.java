package com.vmreconciler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted record of one managed machine, carried between reconciliation runs.
 *
 * <p>The disk map is immutable; changes are made on a copy and committed with
 * {@link #commitDisks}. Generated encryption keys are only written by the key
 * generation step and removed on teardown.
 */
public class StateRecord {

    private String machineName;
    private String resourceGroup;
    private String location;
    private String storage;
    private String virtualNetwork;
    private String size;
    private Boolean obtainIp;
    private String availabilitySet;

    /** Remote VM resource id; {@code null} while no VM exists. */
    private String vmId;
    private LifecycleState lifecycleState = LifecycleState.MISSING;

    /** Public IP resource name. */
    private String publicIp;
    private String publicIpv4;
    private String networkInterface;

    @JsonProperty("disks")
    private DiskMap disks = DiskMap.empty();

    @JsonProperty("generatedEncryptionKeys")
    private Map<String, String> generatedEncryptionKeys = new LinkedHashMap<>();

    /** backup id -> (disk media link -> snapshot id) */
    @JsonProperty("backups")
    private Map<String, Map<String, String>> backups = new LinkedHashMap<>();

    public StateRecord() {}

    public StateRecord(String machineName) {
        this.machineName = machineName;
    }

    @JsonIgnore
    public String fullName() {
        return "Azure machine '%s'".formatted(machineName);
    }

    /** Anything remote may still exist for this machine. */
    @JsonIgnore
    public boolean isDeployed() {
        return vmId != null || !disks.isEmpty() || publicIp != null || networkInterface != null;
    }

    @JsonIgnore
    public boolean hasVm() {
        return vmId != null;
    }

    /**
     * Bookkeeping after the VM resource is gone: disks survive but none is attached.
     */
    public void markResourceDeleted() {
        vmId = null;
        lifecycleState = LifecycleState.STOPPED;
        disks = disks.markAllNeedsAttach();
        publicIpv4 = null;
    }

    public DiskMap getDisks() {
        return disks;
    }

    public void commitDisks(DiskMap updated) {
        this.disks = updated == null ? DiskMap.empty() : updated;
    }

    public void putDisk(DiskRecord disk) {
        commitDisks(disks.with(disk));
    }

    public void removeDisk(String id) {
        commitDisks(disks.without(id));
    }

    public Map<String, String> getGeneratedEncryptionKeys() {
        return Collections.unmodifiableMap(generatedEncryptionKeys);
    }

    public String generatedKey(String diskId) {
        return generatedEncryptionKeys.get(diskId);
    }

    public void putGeneratedKey(String diskId, String key) {
        generatedEncryptionKeys.put(diskId, key);
    }

    public void removeGeneratedKey(String diskId) {
        generatedEncryptionKeys.remove(diskId);
    }

    public Map<String, Map<String, String>> getBackups() {
        return Collections.unmodifiableMap(backups);
    }

    public void putBackup(String backupId, Map<String, String> snapshots) {
        backups.put(backupId, new LinkedHashMap<>(snapshots));
    }

    public void removeBackup(String backupId) {
        backups.remove(backupId);
    }

    public String getMachineName() { return machineName; }
    public void setMachineName(String machineName) { this.machineName = machineName; }
    public String getResourceGroup() { return resourceGroup; }
    public void setResourceGroup(String resourceGroup) { this.resourceGroup = resourceGroup; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public String getStorage() { return storage; }
    public void setStorage(String storage) { this.storage = storage; }
    public String getVirtualNetwork() { return virtualNetwork; }
    public void setVirtualNetwork(String virtualNetwork) { this.virtualNetwork = virtualNetwork; }
    public String getSize() { return size; }
    public void setSize(String size) { this.size = size; }
    public Boolean getObtainIp() { return obtainIp; }
    public void setObtainIp(Boolean obtainIp) { this.obtainIp = obtainIp; }
    public String getAvailabilitySet() { return availabilitySet; }
    public void setAvailabilitySet(String availabilitySet) { this.availabilitySet = availabilitySet; }
    public String getVmId() { return vmId; }
    public void setVmId(String vmId) { this.vmId = vmId; }
    public LifecycleState getLifecycleState() { return lifecycleState; }
    public void setLifecycleState(LifecycleState lifecycleState) { this.lifecycleState = lifecycleState; }
    public String getPublicIp() { return publicIp; }
    public void setPublicIp(String publicIp) { this.publicIp = publicIp; }
    public String getPublicIpv4() { return publicIpv4; }
    public void setPublicIpv4(String publicIpv4) { this.publicIpv4 = publicIpv4; }
    public String getNetworkInterface() { return networkInterface; }
    public void setNetworkInterface(String networkInterface) { this.networkInterface = networkInterface; }
}

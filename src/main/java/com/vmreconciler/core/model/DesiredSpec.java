package com.vmreconciler.core.model;

import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.slot.SlotAddressing;

import java.util.HashSet;
import java.util.Objects;

/**
 * Declared state of one machine for a single reconciliation run.
 *
 * <p>Construction validates the disk layout: every device is the root path or a
 * valid slot path, no device is used twice and exactly one root disk exists.
 * Backing-store URL checks happen earlier in {@code DesiredSpecParser}.
 */
public record DesiredSpec(
    String machineName,
    String resourceGroup,
    String location,
    String size,
    String storage,
    String virtualNetwork,
    String rootDiskImageUrl,
    boolean obtainIp,
    String availabilitySet,
    DiskMap disks
) {

    public DesiredSpec {
        Objects.requireNonNull(machineName, "machineName");
        disks = disks == null ? DiskMap.empty() : disks;

        var devices = new HashSet<String>();
        int roots = 0;
        for (DiskRecord disk : disks.values()) {
            if (!SlotAddressing.isValidDevice(disk.device())) {
                throw ReconcileException.configuration(
                        ("%s: disk %s uses device %s; only %s and /dev/disk/by-lun/X block devices, "
                                + "where X is in 0..%d range, are supported")
                                .formatted(machineName, disk.label(), disk.device(),
                                        SlotAddressing.ROOT_DEVICE, SlotAddressing.MAX_SLOT));
            }
            if (!devices.add(disk.device())) {
                throw ReconcileException.configuration(
                        "%s: more than one disk is mapped to %s".formatted(machineName, disk.device()));
            }
            if (disk.isRoot()) {
                roots++;
            }
        }
        if (roots != 1) {
            throw ReconcileException.configuration("%s needs exactly one root disk".formatted(machineName));
        }
    }

    public DiskRecord rootDisk() {
        return disks.findRoot()
                .orElseThrow(() -> ReconcileException.internal(machineName + " has no root disk"));
    }

    public DesiredSpec withDisks(DiskMap newDisks) {
        return new DesiredSpec(machineName, resourceGroup, location, size, storage, virtualNetwork,
                rootDiskImageUrl, obtainIp, availabilitySet, newDisks);
    }

    public DesiredSpec withHardware(String newSize, String newAvailabilitySet) {
        return new DesiredSpec(machineName, resourceGroup, location, newSize, storage, virtualNetwork,
                rootDiskImageUrl, obtainIp, newAvailabilitySet, disks);
    }
}

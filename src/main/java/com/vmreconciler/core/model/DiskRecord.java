package com.vmreconciler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vmreconciler.core.slot.SlotAddressing;

import java.util.OptionalInt;

/**
 * One logical block device of a machine, either as declared or as recorded.
 *
 * @param id backing-store blob URL; the disk identity, stable across VM re-creation
 * @param device {@code /dev/sda} for the root disk, {@code /dev/disk/by-lun/N} otherwise
 * @param name disk name as known to the compute API
 * @param size size in GB, {@code null} to let the API decide
 * @param hostCaching host caching mode
 * @param ephemeral whether the backing store is deleted together with the disk
 * @param encrypt whether the disk is LUKS-encrypted on the machine
 * @param passphrase declared passphrase; empty or {@code null} means "generate one"
 * @param needsAttach recorded disk that should exist but is not attached to the live VM
 */
public record DiskRecord(
    String id,
    String device,
    String name,
    Integer size,
    HostCaching hostCaching,
    boolean ephemeral,
    boolean encrypt,
    String passphrase,
    boolean needsAttach
) {

    @JsonIgnore
    public boolean isRoot() {
        return SlotAddressing.isRoot(device);
    }

    public OptionalInt slot() {
        return SlotAddressing.deviceToSlot(device);
    }

    public boolean hasExplicitPassphrase() {
        return passphrase != null && !passphrase.isEmpty();
    }

    public boolean needsGeneratedKey() {
        return encrypt && !hasExplicitPassphrase();
    }

    public DiskRecord withNeedsAttach(boolean value) {
        return new DiskRecord(id, device, name, size, hostCaching, ephemeral, encrypt, passphrase, value);
    }

    public DiskRecord withHostCaching(HostCaching value) {
        return new DiskRecord(id, device, name, size, value, ephemeral, encrypt, passphrase, needsAttach);
    }

    public DiskRecord withSize(Integer value) {
        return new DiskRecord(id, device, name, value, hostCaching, ephemeral, encrypt, passphrase, needsAttach);
    }

    /** Copies the slot-related attributes that may only change while detached. */
    public DiskRecord withPlacement(String newDevice, String newName, HostCaching newCaching) {
        return new DiskRecord(id, newDevice, newName, size, newCaching, ephemeral, encrypt, passphrase, needsAttach);
    }

    /** Copies the tool-local bookkeeping that has no remote counterpart. */
    public DiskRecord withLocalMetadata(DiskRecord declared) {
        return new DiskRecord(id, device, name, size, hostCaching,
                declared.ephemeral(), declared.encrypt(), declared.passphrase(), needsAttach);
    }

    public String label() {
        return "%s(%s)".formatted(name, id);
    }
}

package com.vmreconciler.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable collection of {@link DiskRecord}s keyed by disk id. Every mutator
 * returns a new map; the owner commits it back explicitly.
 */
public final class DiskMap {

    private static final DiskMap EMPTY = new DiskMap(Map.of());

    private final Map<String, DiskRecord> disks;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public DiskMap(Map<String, DiskRecord> disks) {
        var copy = new LinkedHashMap<String, DiskRecord>();
        if (disks != null) {
            disks.forEach((id, disk) -> {
                if (!id.equals(disk.id())) {
                    throw new IllegalArgumentException("Disk keyed as " + id + " has id " + disk.id());
                }
                copy.put(id, disk);
            });
        }
        this.disks = Collections.unmodifiableMap(copy);
    }

    public static DiskMap empty() {
        return EMPTY;
    }

    public static DiskMap of(Collection<DiskRecord> records) {
        var map = new LinkedHashMap<String, DiskRecord>();
        for (DiskRecord record : records) {
            map.put(record.id(), record);
        }
        return new DiskMap(map);
    }

    @JsonValue
    public Map<String, DiskRecord> asMap() {
        return disks;
    }

    public Optional<DiskRecord> get(String id) {
        return Optional.ofNullable(disks.get(id));
    }

    public boolean contains(String id) {
        return disks.containsKey(id);
    }

    public Collection<DiskRecord> values() {
        return disks.values();
    }

    public Set<String> ids() {
        return disks.keySet();
    }

    public int size() {
        return disks.size();
    }

    public boolean isEmpty() {
        return disks.isEmpty();
    }

    public DiskMap with(DiskRecord disk) {
        var copy = new LinkedHashMap<>(disks);
        copy.put(disk.id(), disk);
        return new DiskMap(copy);
    }

    public DiskMap without(String id) {
        if (!disks.containsKey(id)) {
            return this;
        }
        var copy = new LinkedHashMap<>(disks);
        copy.remove(id);
        return new DiskMap(copy);
    }

    /** Root disk of a declaration, looked up by device path. */
    public Optional<DiskRecord> findRoot() {
        return disks.values().stream()
                .filter(DiskRecord::isRoot)
                .findFirst();
    }

    /**
     * Root disk currently attached to the live VM. A previous root disk may
     * still be recorded as detached, so the device path alone is not enough.
     */
    public Optional<DiskRecord> findAttachedRoot() {
        return disks.values().stream()
                .filter(d -> d.isRoot() && !d.needsAttach())
                .findFirst();
    }

    public Optional<DiskRecord> findByDevice(String device) {
        return disks.values().stream()
                .filter(d -> d.device().equals(device))
                .findFirst();
    }

    /** Non-root disks addressed by a valid slot. */
    public List<DiskRecord> slotDisks() {
        return disks.values().stream()
                .filter(d -> d.slot().isPresent())
                .toList();
    }

    public DiskMap markAllNeedsAttach() {
        return DiskMap.of(disks.values().stream()
                .map(d -> d.withNeedsAttach(true))
                .toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiskMap other)) return false;
        return disks.equals(other.disks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(disks);
    }

    @Override
    public String toString() {
        return "DiskMap" + disks.keySet();
    }
}

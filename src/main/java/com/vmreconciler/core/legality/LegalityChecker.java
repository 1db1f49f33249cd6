package com.vmreconciler.core.legality;

import com.vmreconciler.core.error.IllegalDiskTransitionException;
import com.vmreconciler.core.error.IllegalDiskTransitionException.Violation;
import com.vmreconciler.core.model.DiskMap;
import com.vmreconciler.core.model.DiskRecord;
import org.springframework.stereotype.Component;

/**
 * Rejects disk layouts that cannot be reached from the recorded layout in a
 * single deployment.
 *
 * <p>Slot changes are staged: new disks are attached, the machine configuration
 * is activated (mounting the new disks and unmounting the leaving ones) and only
 * then are the leaving disks detached. A slot therefore has to be vacated by one
 * deployment before another disk can take it, and an attached disk cannot move
 * or be renamed.
 */
@Component
public class LegalityChecker {

    /**
     * @throws IllegalDiskTransitionException on the first violation found
     */
    public void check(DiskMap desired, DiskMap current) {
        for (DiskRecord disk : desired.values()) {
            if (disk.slot().isPresent()) {
                current.findByDevice(disk.device())
                        .filter(occupant -> !occupant.id().equals(disk.id()))
                        .filter(occupant -> !occupant.needsAttach())
                        .ifPresent(occupant -> {
                            throw new IllegalDiskTransitionException(Violation.SLOT_OCCUPIED, disk.id(), disk.device(),
                                    ("can't attach Azure disk %s because the target LUN %s is already occupied by "
                                            + "Azure disk %s; you need to deploy a configuration with this LUN left "
                                            + "empty before using it to attach a different data disk")
                                            .formatted(disk.label(), disk.device(), occupant.id()));
                        });
            }

            var recorded = current.get(disk.id()).orElse(null);
            if (recorded == null || recorded.slot().isEmpty() || recorded.needsAttach()) {
                continue;
            }
            if (disk.slot().isEmpty()) {
                throw new IllegalDiskTransitionException(Violation.SLOT_REASSIGNMENT, disk.id(), disk.device(),
                        ("can't reattach data disk %s as the OS disk in one step; you need to deploy a "
                                + "configuration with this disk detached from %s first")
                                .formatted(disk.label(), recorded.device()));
            }
            if (!recorded.device().equals(disk.device())) {
                throw new IllegalDiskTransitionException(Violation.SLOT_REASSIGNMENT, disk.id(), disk.device(),
                        ("can't reattach Azure disk %s to a different LUN in one step; you need to deploy a "
                                + "configuration with this disk detached from %s before attaching it to %s")
                                .formatted(disk.label(), recorded.device(), disk.device()));
            }
            if (!recorded.name().equals(disk.name())) {
                throw new IllegalDiskTransitionException(Violation.NAME_CHANGE, disk.id(), disk.device(),
                        "cannot change the name of the attached disk %s".formatted(recorded.label()));
            }
        }
    }
}

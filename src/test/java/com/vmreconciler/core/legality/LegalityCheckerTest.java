package com.vmreconciler.core.legality;

import com.vmreconciler.core.error.ErrorKind;
import com.vmreconciler.core.error.IllegalDiskTransitionException;
import com.vmreconciler.core.error.IllegalDiskTransitionException.Violation;
import com.vmreconciler.core.model.DiskMap;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.HostCaching;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vmreconciler.SimulatedEnvironment.blob;
import static com.vmreconciler.SimulatedEnvironment.data;
import static com.vmreconciler.SimulatedEnvironment.root;
import static org.junit.jupiter.api.Assertions.*;

class LegalityCheckerTest {

    private final LegalityChecker checker = new LegalityChecker();

    private static DiskMap disks(DiskRecord... records) {
        return DiskMap.of(List.of(records));
    }

    private Violation violationOf(DiskMap desired, DiskMap current) {
        var e = assertThrows(IllegalDiskTransitionException.class, () -> checker.check(desired, current));
        assertEquals(ErrorKind.ILLEGAL_TRANSITION, e.getKind());
        return e.getViolation();
    }

    @Test
    @DisplayName("an unchanged layout is accepted")
    void unchanged() {
        var layout = disks(root("r"), data("a", 0), data("b", 1));
        assertDoesNotThrow(() -> checker.check(layout, layout));
    }

    @Test
    @DisplayName("a caching-only change is accepted")
    void cachingChange() {
        assertDoesNotThrow(() -> checker.check(
                disks(root("r"), data("a", 0).withHostCaching(HostCaching.READ_WRITE)),
                disks(root("r"), data("a", 0))));
    }

    @Test
    @DisplayName("swapping two attached disks is rejected")
    void swap() {
        assertEquals(Violation.SLOT_OCCUPIED, violationOf(
                disks(root("r"), data("a", 1), data("b", 0)),
                disks(root("r"), data("a", 0), data("b", 1))));
    }

    @Test
    @DisplayName("moving an attached disk to a free LUN is rejected")
    void move() {
        assertEquals(Violation.SLOT_REASSIGNMENT, violationOf(
                disks(root("r"), data("a", 3)),
                disks(root("r"), data("a", 0))));
    }

    @Test
    @DisplayName("turning an attached data disk into the root disk is rejected")
    void dataDiskBecomesRoot() {
        var promoted = new DiskRecord(blob("a"), "/dev/sda", "a", 10, HostCaching.NONE, false, false, "", false);

        assertEquals(Violation.SLOT_REASSIGNMENT, violationOf(
                disks(promoted),
                disks(root("r"), data("a", 0))));
    }

    @Test
    @DisplayName("a detached data disk may become the root disk")
    void detachedDiskBecomesRoot() {
        var promoted = new DiskRecord(blob("a"), "/dev/sda", "a", 10, HostCaching.NONE, false, false, "", false);

        assertDoesNotThrow(() -> checker.check(disks(promoted),
                disks(root("r"), data("a", 0).withNeedsAttach(true))));
    }

    @Test
    @DisplayName("renaming an attached disk is rejected")
    void rename() {
        var renamed = new DiskRecord(blob("a"), "/dev/disk/by-lun/0", "other", 10, HostCaching.NONE,
                false, false, "", false);
        assertEquals(Violation.NAME_CHANGE, violationOf(
                disks(root("r"), renamed),
                disks(root("r"), data("a", 0))));
    }

    @Test
    @DisplayName("detached disks may move, be renamed and free their LUN")
    void detachedDisksAreFlexible() {
        var current = disks(root("r"), data("a", 0).withNeedsAttach(true));

        assertDoesNotThrow(() -> checker.check(disks(root("r"), data("a", 4)), current));
        assertDoesNotThrow(() -> checker.check(disks(root("r"), data("b", 0)), current));
    }

    @Test
    @DisplayName("the error names the occupying disk")
    void messageNamesOccupant() {
        var e = assertThrows(IllegalDiskTransitionException.class, () -> checker.check(
                disks(root("r"), data("b", 0)),
                disks(root("r"), data("a", 0))));
        assertTrue(e.getMessage().contains(blob("a")));
        assertEquals("/dev/disk/by-lun/0", e.getDevice());
        assertEquals(blob("b"), e.getDiskId());
    }
}

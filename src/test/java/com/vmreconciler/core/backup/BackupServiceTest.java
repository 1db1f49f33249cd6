package com.vmreconciler.core.backup;

import com.vmreconciler.SimulatedEnvironment;
import com.vmreconciler.cloud.BlobUrl;
import com.vmreconciler.cloud.DiskCreateOption;
import com.vmreconciler.core.backup.BackupStatus.Availability;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.StateRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vmreconciler.SimulatedEnvironment.*;
import static org.junit.jupiter.api.Assertions.*;

class BackupServiceTest {

    private SimulatedEnvironment env;
    private DesiredSpec declared;
    private StateRecord state;

    @BeforeEach
    void setUp() {
        env = new SimulatedEnvironment();
        declared = spec(root("root"), data("d0", 0), data("d1", 1));
        state = env.deployed(declared);
        env.cloud.putBlob(blob("d0"), "v1");
    }

    @Test
    @DisplayName("backup snapshots every recorded disk")
    void snapshotsEveryDisk() {
        env.backups.backup(declared, state, "b1");

        assertEquals(3, env.cloud.calls("blob.snapshot").size());
        assertEquals(state.getDisks().ids(), state.getBackups().get("b1").keySet());
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @BeforeEach
        void backUp() {
            env.backups.backup(declared, state, "b1");
            env.cloud.putBlob(blob("d0"), "v2");
            env.cloud.putBlob(blob("d1"), "v2");
            env.cloud.clearCalls();
        }

        @Test
        @DisplayName("copies every disk back and re-creates the VM around them")
        void restoresAll() {
            env.backups.restore(declared, state, "b1", List.of());

            assertEquals(List.of("vm.powerOff", "vm.delete"),
                    env.cloud.calls().subList(0, 2).stream().map(c -> c.operation()).toList());
            assertEquals(3, env.cloud.calls("blob.copy").size());
            assertEquals("v1", env.cloud.blobContent(blob("d0")).orElseThrow());
            assertEquals(1, env.cloud.calls("vm.create").size());
            var request = env.cloud.submittedVms().get(0);
            assertEquals(DiskCreateOption.ATTACH, request.osDisk().createOption());
            assertEquals(2, request.dataDisks().size());
            assertTrue(state.hasVm());
        }

        @Test
        @DisplayName("restores only the selected devices")
        void restoresSelection() {
            env.backups.restore(declared, state, "b1", List.of("/dev/disk/by-lun/1"));

            assertEquals(1, env.cloud.calls("blob.copy").size());
            assertEquals("v2", env.cloud.blobContent(blob("d0")).orElseThrow());
        }

        @Test
        void unknownBackup() {
            assertThrows(ReconcileException.class, () -> env.backups.restore(declared, state, "nope", List.of()));
            assertEquals(List.of(), env.cloud.calls());
        }
    }

    @Nested
    @DisplayName("list and remove")
    class ListAndRemove {

        @Test
        @DisplayName("a fresh backup is complete")
        void complete() {
            env.backups.backup(declared, state, "b1");

            var status = env.backups.listBackups(state).get("b1");
            assertEquals(Availability.COMPLETE, status.status());
            assertEquals(List.of(), status.info());
        }

        @Test
        @DisplayName("a disk added after the backup makes it incomplete")
        void incomplete() {
            env.backups.backup(declared, state, "b1");
            state.putDisk(data("d2", 2));

            var status = env.backups.listBackups(state).get("b1");
            assertEquals(Availability.INCOMPLETE, status.status());
            assertTrue(status.info().get(0).endsWith("not available in backup"));
        }

        @Test
        @DisplayName("a vanished snapshot makes it unavailable")
        void unavailable() {
            env.backups.backup(declared, state, "b1");
            state.putDisk(data("d2", 2));
            var snapshotId = state.getBackups().get("b1").get(blob("d0"));
            env.cloud.deleteBlob(BlobUrl.parse(blob("d0")).orElseThrow().withSnapshot(snapshotId));

            var status = env.backups.listBackups(state).get("b1");
            assertEquals(Availability.UNAVAILABLE, status.status());
            assertTrue(status.info().stream().anyMatch(i -> i.endsWith("snapshot has disappeared")));
        }

        @Test
        @DisplayName("removing deletes each snapshot and forgets the backup")
        void remove() {
            env.backups.backup(declared, state, "b1");
            env.cloud.clearCalls();

            env.backups.removeBackup(state, "b1");
            env.backups.removeBackup(state, "b1");

            assertEquals(3, env.cloud.calls("blob.delete").size());
            assertTrue(state.getBackups().isEmpty());
        }
    }
}

package com.vmreconciler.core.engine;

import com.vmreconciler.SimulatedEnvironment;
import com.vmreconciler.cloud.DataDisk;
import com.vmreconciler.cloud.DiskCreateOption;
import com.vmreconciler.core.error.ErrorKind;
import com.vmreconciler.core.error.IllegalDiskTransitionException;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.DiskMap;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.HostCaching;
import com.vmreconciler.core.model.LifecycleState;
import com.vmreconciler.core.model.ReconcileOptions;
import com.vmreconciler.core.model.StateRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vmreconciler.SimulatedEnvironment.*;
import static org.junit.jupiter.api.Assertions.*;

class ConvergenceSequencerTest {

    private SimulatedEnvironment env;

    @BeforeEach
    void setUp() {
        env = new SimulatedEnvironment();
    }

    private static ReconcileOptions check() {
        return new ReconcileOptions(true, false, false);
    }

    private static ReconcileOptions allowReboot() {
        return new ReconcileOptions(false, true, false);
    }

    private static ReconcileOptions allowRecreate() {
        return new ReconcileOptions(true, false, true);
    }

    private static DesiredSpec standard() {
        return spec(root("root"), data("d0", 0), data("d1", 1));
    }

    @Nested
    @DisplayName("first deployment")
    class FirstDeployment {

        @Test
        @DisplayName("creates the VM in one request with the existing root and two new data disks")
        void createsVmInOneRequest() {
            env.cloud.putBlob(blob("root"), "os");
            var state = freshState();

            var report = env.sequencer.reconcile(standard(), state, ReconcileOptions.defaults());

            assertTrue(report.isClean());
            assertEquals(1, env.cloud.calls("vm.create").size());
            assertTrue(env.cloud.calls("vm.update").isEmpty());
            assertEquals(1, env.cloud.calls("publicip.create").size());
            assertEquals(1, env.cloud.calls("nic.create").size());

            var request = env.cloud.submittedVms().get(0);
            assertEquals(DiskCreateOption.ATTACH, request.osDisk().createOption());
            assertNull(request.osProfile(), "no OS profile when attaching an existing root disk");
            assertEquals(List.of(0, 1), request.dataDisks().stream().map(DataDisk::lun).toList());
            assertTrue(request.dataDisks().stream().allMatch(d -> d.createOption() == DiskCreateOption.EMPTY));

            assertEquals(MACHINE, state.getVmId());
            assertEquals(LifecycleState.STARTING, state.getLifecycleState());
            assertEquals("203.0.113.1", state.getPublicIpv4());
            assertEquals(3, state.getDisks().size());
            assertTrue(state.getDisks().values().stream().noneMatch(DiskRecord::needsAttach));
            assertEquals("Standard_A1", state.getSize());
        }

        @Test
        @DisplayName("builds the root disk from the image when its blob does not exist")
        void rootFromImage() {
            var state = freshState();

            env.sequencer.reconcile(spec(root("root")), state, ReconcileOptions.defaults());

            var request = env.cloud.submittedVms().get(0);
            assertEquals(DiskCreateOption.FROM_IMAGE, request.osDisk().createOption());
            assertEquals(IMAGE, request.osDisk().sourceImageUri());
            assertEquals("randomuser", request.osProfile().adminUsername());
            assertEquals(MACHINE, request.osProfile().computerName());
        }

        @Test
        @DisplayName("a second run with the same declaration issues no remote calls")
        void idempotent() {
            var state = env.deployed(standard());

            env.sequencer.reconcile(standard(), state, ReconcileOptions.defaults());

            assertEquals(List.of(), env.cloud.calls());
        }

        @Test
        @DisplayName("skips the public IP when none is wanted")
        void noPublicIp() {
            var declared = spec(root("root"));
            var withoutIp = new DesiredSpec(declared.machineName(), RG, LOCATION, "Standard_A1", STORAGE, VNET,
                    IMAGE, false, null, declared.disks());
            var state = freshState();

            env.sequencer.reconcile(withoutIp, state, ReconcileOptions.defaults());

            assertTrue(env.cloud.calls("publicip.create").isEmpty());
            assertNull(state.getPublicIp());
            assertNull(state.getPublicIpv4());
            assertTrue(state.hasVm());
        }
    }

    @Nested
    @DisplayName("changing a deployed machine")
    class Changes {

        private StateRecord state;

        @BeforeEach
        void deploy() {
            state = env.deployed(standard());
        }

        @Test
        @DisplayName("attaches a newly declared disk with one update")
        void attachesNewDisk() {
            env.sequencer.reconcile(spec(root("root"), data("d0", 0), data("d1", 1), data("d2", 2)),
                    state, ReconcileOptions.defaults());

            assertEquals(1, env.cloud.calls("vm.update").size());
            var update = env.cloud.submittedVms().get(0);
            assertEquals(3, update.dataDisks().size());
            assertEquals(DiskCreateOption.EMPTY, update.findDataDisk(blob("d2")).orElseThrow().createOption());
            assertFalse(state.getDisks().get(blob("d2")).orElseThrow().needsAttach());
        }

        @Test
        @DisplayName("dropping the public IP request alone does not update the VM")
        void obtainIpOnly() {
            var withoutIp = new DesiredSpec(MACHINE, RG, LOCATION, "Standard_A1", STORAGE, VNET, IMAGE,
                    false, null, standard().disks());

            env.sequencer.reconcile(withoutIp, state, ReconcileOptions.defaults());

            assertTrue(env.cloud.calls("vm.update").isEmpty());
            assertEquals(Boolean.FALSE, state.getObtainIp());
        }

        @Test
        @DisplayName("changes caching of an attached disk in place")
        void cachingChange() {
            var d0 = data("d0", 0).withHostCaching(HostCaching.READ_ONLY);

            env.sequencer.reconcile(spec(root("root"), d0, data("d1", 1)), state, ReconcileOptions.defaults());

            assertEquals(1, env.cloud.calls("vm.update").size());
            var update = env.cloud.submittedVms().get(0);
            assertEquals(HostCaching.READ_ONLY, update.findDataDisk(blob("d0")).orElseThrow().caching());
            assertEquals(HostCaching.READ_ONLY, state.getDisks().get(blob("d0")).orElseThrow().hostCaching());
        }

        @Test
        @DisplayName("rejects swapping two attached disks before any remote call")
        void swapRejected() {
            var e = assertThrows(IllegalDiskTransitionException.class,
                    () -> env.sequencer.reconcile(spec(root("root"), data("d0", 1), data("d1", 0)),
                            state, ReconcileOptions.defaults()));

            assertEquals(IllegalDiskTransitionException.Violation.SLOT_OCCUPIED, e.getViolation());
            assertEquals(List.of(), env.cloud.calls());
            assertEquals(0, state.getDisks().get(blob("d0")).orElseThrow().slot().getAsInt());
        }

        @Test
        @DisplayName("rejects renaming an attached disk")
        void renameRejected() {
            var renamed = new DiskRecord(blob("d0"), "/dev/disk/by-lun/0", "data-zero", 10, HostCaching.NONE,
                    false, false, "", false);

            var e = assertThrows(IllegalDiskTransitionException.class,
                    () -> env.sequencer.reconcile(spec(root("root"), renamed, data("d1", 1)),
                            state, ReconcileOptions.defaults()));

            assertEquals(IllegalDiskTransitionException.Violation.NAME_CHANGE, e.getViolation());
        }

        @Test
        @DisplayName("size changes need --allow-reboot")
        void rebootGuard() {
            var bigger = standard().withHardware("Standard_A2", null);

            var e = assertThrows(ReconcileException.class,
                    () -> env.sequencer.reconcile(bigger, state, ReconcileOptions.defaults()));
            assertEquals(ErrorKind.PERMISSION_REQUIRED, e.getKind());
            assertEquals(List.of(), env.cloud.calls());

            env.sequencer.reconcile(bigger, state, allowReboot());
            assertEquals(1, env.cloud.calls("vm.update").size());
            assertEquals("Standard_A2", env.cloud.require(RG, MACHINE).size());
            assertEquals("Standard_A2", state.getSize());
        }

        @Test
        @DisplayName("identity fields cannot change once deployed")
        void immutableFields() {
            var moved = new DesiredSpec(MACHINE, RG, "northeurope", "Standard_A1", STORAGE, VNET, IMAGE,
                    true, null, standard().disks());

            var e = assertThrows(ReconcileException.class,
                    () -> env.sequencer.reconcile(moved, state, ReconcileOptions.defaults()));

            assertEquals(ErrorKind.CONFIGURATION, e.getKind());
            assertTrue(e.getMessage().contains("cannot change the location"));
        }

        @Test
        @DisplayName("replacing the root disk re-creates the VM only with --allow-recreate")
        void rootSubstitution() {
            var newRoot = spec(root("root2"), data("d0", 0), data("d1", 1));

            var e = assertThrows(ReconcileException.class,
                    () -> env.sequencer.reconcile(newRoot, state, ReconcileOptions.defaults()));
            assertEquals(ErrorKind.PERMISSION_REQUIRED, e.getKind());

            env.sequencer.reconcile(newRoot, state, new ReconcileOptions(false, false, true));

            assertEquals(1, env.cloud.calls("vm.delete").size());
            assertEquals(1, env.cloud.calls("vm.create").size());
            assertEquals(blob("root2"), env.cloud.require(RG, MACHINE).osDisk().uri());
            assertTrue(state.getDisks().get(blob("root")).orElseThrow().needsAttach());
            assertEquals(blob("root2"), state.getDisks().findAttachedRoot().orElseThrow().id());
        }

        @Test
        @DisplayName("generates a key for an encrypted disk once")
        void generatesKeyOnce() {
            var encrypted = new DiskRecord(blob("secret"), "/dev/disk/by-lun/2", "secret", 10, HostCaching.NONE,
                    false, true, "", false);
            var declared = spec(root("root"), data("d0", 0), data("d1", 1), encrypted);

            env.sequencer.reconcile(declared, state, ReconcileOptions.defaults());
            var key = state.generatedKey(blob("secret"));
            env.sequencer.reconcile(declared, state, ReconcileOptions.defaults());

            assertNotNull(key);
            assertEquals(key, state.generatedKey(blob("secret")));
            assertEquals(1, state.getGeneratedEncryptionKeys().size());
        }
    }

    @Nested
    @DisplayName("with --check")
    class Check {

        private StateRecord state;

        @BeforeEach
        void deploy() {
            state = env.deployed(standard());
        }

        @Test
        @DisplayName("a VM deleted behind our back needs --allow-recreate")
        void deletedBehindOurBack() {
            env.cloud.removeVm(RG, MACHINE);

            var e = assertThrows(ReconcileException.class,
                    () -> env.sequencer.reconcile(standard(), state, check()));
            assertEquals(ErrorKind.PERMISSION_REQUIRED, e.getKind());
            assertTrue(state.hasVm());
        }

        @Test
        @DisplayName("a VM deleted behind our back is re-created around the surviving disks")
        void recreatesAfterDeletion() {
            env.cloud.removeVm(RG, MACHINE);

            env.sequencer.reconcile(standard(), state, allowRecreate());

            assertEquals(1, env.cloud.calls("vm.create").size());
            var request = env.cloud.submittedVms().get(0);
            assertEquals(DiskCreateOption.ATTACH, request.osDisk().createOption());
            assertTrue(request.dataDisks().stream().allMatch(d -> d.createOption() == DiskCreateOption.ATTACH));
            assertTrue(state.hasVm());
            assertTrue(state.getDisks().values().stream().noneMatch(DiskRecord::needsAttach));
        }

        @Test
        @DisplayName("repairs caching drift back to the declared value")
        void repairsCachingDrift() {
            var vm = env.cloud.require(RG, MACHINE);
            env.cloud.putVm(RG, vm.withDataDisks(vm.dataDisks().stream()
                    .map(d -> d.lun() == 0 ? d.withCaching(HostCaching.READ_WRITE) : d)
                    .toList()));

            var report = env.sequencer.reconcile(standard(), state, check());

            assertEquals(1, report.warnings().size());
            assertEquals(HostCaching.NONE,
                    env.cloud.require(RG, MACHINE).findDataDisk(blob("d0")).orElseThrow().caching());
            assertEquals(HostCaching.NONE, state.getDisks().get(blob("d0")).orElseThrow().hostCaching());
        }

        @Test
        @DisplayName("a live VM that should not exist is deleted after confirmation")
        void deletesStrayVm() {
            var stray = freshState();
            env.cloud.putVm(RG, env.cloud.require(RG, MACHINE));
            env.answer = false;

            var e = assertThrows(ReconcileException.class,
                    () -> env.sequencer.reconcile(spec(root("other")), stray, check()));

            assertEquals(ErrorKind.REMOTE_FAILURE, e.getKind());
            assertEquals(1, env.questions.size());
            assertTrue(env.cloud.calls("vm.delete").isEmpty());
        }
    }

    @Test
    @DisplayName("records the outcome of every run")
    void recordsMetrics() {
        env.sequencer.reconcile(standard(), freshState(), ReconcileOptions.defaults());

        assertEquals(1.0, env.registry.find("vmreconciler.reconcile.total").tag("status", "success").counter().count());
        assertNotNull(env.registry.find("vmreconciler.reconcile.duration").timer());
    }

    @Test
    void emptyDiskMapIsRejected() {
        assertThrows(ReconcileException.class, () -> spec().withDisks(DiskMap.empty()));
    }
}

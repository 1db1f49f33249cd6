package com.vmreconciler;

import com.vmreconciler.cloud.simulated.SimulatedCloud;
import com.vmreconciler.core.backup.BackupService;
import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.drift.DriftDetector;
import com.vmreconciler.core.engine.BackingStoreService;
import com.vmreconciler.core.engine.ConvergenceSequencer;
import com.vmreconciler.core.engine.EncryptionKeyGenerator;
import com.vmreconciler.core.engine.KeyRetirement;
import com.vmreconciler.core.engine.LifecycleDriver;
import com.vmreconciler.core.engine.TeardownService;
import com.vmreconciler.core.engine.VmProvisioner;
import com.vmreconciler.core.health.MachineHealthChecker;
import com.vmreconciler.core.legality.LegalityChecker;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.DiskMap;
import com.vmreconciler.core.model.DiskRecord;
import com.vmreconciler.core.model.HostCaching;
import com.vmreconciler.core.model.ReconcileOptions;
import com.vmreconciler.core.model.StateRecord;
import com.vmreconciler.core.poll.BoundedRetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * All services wired against one {@link SimulatedCloud}, with a scripted
 * operator and a recording machine shell.
 */
public class SimulatedEnvironment {

    public static final String MACHINE = "web-1";
    public static final String RG = "rg-test";
    public static final String LOCATION = "westeurope";
    public static final String STORAGE = "acct";
    public static final String VNET = "vnet";
    public static final String IMAGE = "https://acct.blob.core.windows.net/images/nixos.vhd";

    public final SimulatedCloud cloud = new SimulatedCloud();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final ReconcilerMetrics metrics = new ReconcilerMetrics(registry);
    public final ReconcilerProperties properties = new ReconcilerProperties();
    public final BoundedRetry retry = new BoundedRetry(d -> { });

    /** Questions asked so far. */
    public final List<String> questions = new ArrayList<>();
    /** Commands sent to the machine so far. */
    public final List<String> shellCommands = new ArrayList<>();
    public boolean answer = true;

    public final BackingStoreService backingStore;
    public final KeyRetirement keyRetirement;
    public final DriftDetector driftDetector;
    public final LegalityChecker legalityChecker = new LegalityChecker();
    public final VmProvisioner provisioner;
    public final EncryptionKeyGenerator keyGenerator = new EncryptionKeyGenerator();
    public final ConvergenceSequencer sequencer;
    public final TeardownService teardown;
    public final LifecycleDriver lifecycle;
    public final BackupService backups;
    public final MachineHealthChecker healthChecker;

    public SimulatedEnvironment() {
        properties.getProvisioning().setMaxPollAttempts(10);
        properties.getProvisioning().setPollIntervalMillis(1);

        backingStore = new BackingStoreService(cloud, this::confirm, metrics);
        keyRetirement = new KeyRetirement(this::confirm);
        driftDetector = new DriftDetector(cloud, cloud, backingStore, metrics);
        provisioner = new VmProvisioner(cloud, cloud, backingStore, retry, properties, metrics);
        sequencer = new ConvergenceSequencer(cloud, driftDetector, legalityChecker, provisioner,
                keyGenerator, this::confirm, metrics);
        teardown = new TeardownService(cloud, backingStore, this::shell, keyRetirement, metrics);
        lifecycle = new LifecycleDriver(cloud, cloud, backingStore, keyRetirement, this::shell,
                this::confirm, metrics);
        backups = new BackupService(cloud, cloud, backingStore, lifecycle, provisioner, metrics);
        healthChecker = new MachineHealthChecker(cloud, cloud, backingStore);
    }

    private boolean confirm(String question) {
        questions.add(question);
        return answer;
    }

    private boolean shell(StateRecord machine, String command) {
        shellCommands.add(command);
        return true;
    }

    // -- fixtures --

    public static String blob(String name) {
        return "https://acct.blob.core.windows.net/vhds/" + name + ".vhd";
    }

    public static DiskRecord root(String name) {
        return new DiskRecord(blob(name), "/dev/sda", name, null, HostCaching.READ_WRITE, false, false, "", false);
    }

    public static DiskRecord data(String name, int lun) {
        return new DiskRecord(blob(name), "/dev/disk/by-lun/" + lun, name, 10, HostCaching.NONE,
                false, false, "", false);
    }

    public static DesiredSpec spec(DiskRecord... disks) {
        return new DesiredSpec(MACHINE, RG, LOCATION, "Standard_A1", STORAGE, VNET, IMAGE,
                true, null, DiskMap.of(List.of(disks)));
    }

    /** A record that has not been deployed yet, with the identity fields filled in. */
    public static StateRecord freshState() {
        var state = new StateRecord(MACHINE);
        state.setResourceGroup(RG);
        state.setLocation(LOCATION);
        state.setStorage(STORAGE);
        state.setVirtualNetwork(VNET);
        return state;
    }

    /** Deploys {@code spec} from scratch and forgets the calls it took. */
    public StateRecord deployed(DesiredSpec spec) {
        var state = freshState();
        sequencer.reconcile(spec, state, ReconcileOptions.defaults());
        cloud.clearCalls();
        questions.clear();
        shellCommands.clear();
        return state;
    }
}

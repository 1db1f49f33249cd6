package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.engine.ConvergenceSequencer;
import com.vmreconciler.core.engine.TeardownService;
import com.vmreconciler.core.model.ReconcileOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: vm-reconciler deploy &lt;machine.json&gt;
 * <p>
 * Converges the machine towards its declaration, then releases disks that
 * are no longer declared.
 */
@Command(name = "deploy", mixinStandardHelpOptions = true,
        description = "Create or update a machine to match its declaration")
@Component
public class DeployCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine declaration (JSON)")
    private Path specFile;

    @Option(names = "--check", description = "Compare recorded state with the cloud first")
    private boolean check;

    @Option(names = "--allow-reboot", description = "Allow changes that restart the machine")
    private boolean allowReboot;

    @Option(names = "--allow-recreate", description = "Allow deleting and recreating the machine")
    private boolean allowRecreate;

    private final MachineSession session;
    private final ConvergenceSequencer sequencer;
    private final TeardownService teardown;

    public DeployCommand(MachineSession session, ConvergenceSequencer sequencer, TeardownService teardown) {
        this.session = session;
        this.sequencer = sequencer;
        this.teardown = teardown;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var options = new ReconcileOptions(check, allowReboot, allowRecreate);
        return session.withSpec(specFile, "deploy", (spec, state) -> {
            ConsoleOutput.info("Deploying " + spec.machineName() + " in " + spec.resourceGroup());
            var report = sequencer.reconcile(spec, state, options);
            report.warnings().forEach(ConsoleOutput::drift);

            int released = teardown.releaseRemovedDisks(spec, state);
            if (released > 0) {
                ConsoleOutput.info("Released " + released + " disk(s) no longer declared");
            }
            ConsoleOutput.success(spec.machineName() + " is up to date"
                    + (state.getPublicIpv4() != null ? " (" + state.getPublicIpv4() + ")" : ""));
            return 0;
        });
    }
}

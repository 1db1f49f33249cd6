package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.engine.LifecycleDriver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: vm-reconciler destroy &lt;machine&gt;
 * <p>
 * The state record is dropped only once every resource is gone and the
 * generated keys were given up.
 */
@Command(name = "destroy", mixinStandardHelpOptions = true,
        description = "Delete a machine with its network resources and ephemeral disks")
@Component
public class DestroyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    private final MachineSession session;
    private final LifecycleDriver lifecycle;

    public DestroyCommand(MachineSession session, LifecycleDriver lifecycle) {
        this.session = session;
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        boolean[] destroyed = {false};
        int exitCode = session.withRecord(machineName, "destroy", state -> {
            destroyed[0] = lifecycle.destroy(state);
            return 0;
        });
        if (destroyed[0]) {
            session.forget(machineName);
            ConsoleOutput.success(machineName + " destroyed");
        } else if (exitCode == 0) {
            ConsoleOutput.warn(machineName + " kept; its state record was not removed");
        }
        return exitCode;
    }
}

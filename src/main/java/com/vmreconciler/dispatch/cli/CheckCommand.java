package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.health.MachineHealthChecker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: vm-reconciler check &lt;machine&gt;
 * <p>
 * Reports whether the machine exists, is up and still has its disks.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Check a deployed machine")
@Component
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    private final MachineSession session;
    private final MachineHealthChecker healthChecker;

    public CheckCommand(MachineSession session, MachineHealthChecker healthChecker) {
        this.session = session;
        this.healthChecker = healthChecker;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        return session.withRecord(machineName, "check", state -> {
            var result = healthChecker.check(state);
            if (!result.exists()) {
                ConsoleOutput.error(machineName + ": missing");
                return MachineSession.EXIT_FAILURE;
            }
            if (result.isUp()) {
                ConsoleOutput.success(machineName + ": up (" + state.getLifecycleState() + ")");
            } else {
                ConsoleOutput.warn(machineName + ": down (" + state.getLifecycleState() + ")");
            }
            result.messages().forEach(ConsoleOutput::warn);
            if (Boolean.FALSE.equals(result.disksOk())) {
                ConsoleOutput.error("Disks: not as recorded");
                return MachineSession.EXIT_FAILURE;
            }
            return 0;
        });
    }
}

package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.engine.LifecycleDriver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "reboot", mixinStandardHelpOptions = true,
        description = "Reboot a machine, from inside unless --hard is given")
@Component
public class RebootCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    @Option(names = "--hard", description = "Restart through the compute API")
    private boolean hard;

    private final MachineSession session;
    private final LifecycleDriver lifecycle;

    public RebootCommand(MachineSession session, LifecycleDriver lifecycle) {
        this.session = session;
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        return session.withRecord(machineName, "reboot", state -> {
            lifecycle.reboot(state, hard);
            ConsoleOutput.success(machineName + ": rebooting");
            return 0;
        });
    }
}

package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.engine.LifecycleDriver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop (deallocate) a machine")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    private final MachineSession session;
    private final LifecycleDriver lifecycle;

    public StopCommand(MachineSession session, LifecycleDriver lifecycle) {
        this.session = session;
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        return session.withRecord(machineName, "stop", state -> {
            lifecycle.stop(state);
            ConsoleOutput.success(machineName + ": " + state.getLifecycleState());
            return 0;
        });
    }
}

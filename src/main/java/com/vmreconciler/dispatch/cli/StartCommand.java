package com.vmreconciler.dispatch.cli;

import com.vmreconciler.core.engine.LifecycleDriver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a stopped machine")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Machine name")
    private String machineName;

    private final MachineSession session;
    private final LifecycleDriver lifecycle;

    public StartCommand(MachineSession session, LifecycleDriver lifecycle) {
        this.session = session;
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        return session.withRecord(machineName, "start", state -> {
            lifecycle.start(state);
            ConsoleOutput.success(machineName + ": " + state.getLifecycleState());
            return 0;
        });
    }
}

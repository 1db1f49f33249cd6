package com.vmreconciler.dispatch.cli;

import com.vmreconciler.cloud.CloudApiException;
import com.vmreconciler.core.error.ErrorKind;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.logging.MdcContext;
import com.vmreconciler.core.model.DesiredSpec;
import com.vmreconciler.core.model.StateRecord;
import com.vmreconciler.core.persistence.StateStore;
import com.vmreconciler.core.spec.DesiredSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loads the state record a command works on, runs the command and saves the
 * record afterwards, also when the command failed halfway. Errors are printed
 * and turned into exit codes.
 */
@Component
public class MachineSession {

    private static final Logger log = LoggerFactory.getLogger(MachineSession.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_BUG = 2;

    private final StateStore stateStore;
    private final DesiredSpecParser specParser;

    public MachineSession(StateStore stateStore, DesiredSpecParser specParser) {
        this.stateStore = stateStore;
        this.specParser = specParser;
    }

    public int withSpec(Path specFile, String operation, BiFunction<DesiredSpec, StateRecord, Integer> action) {
        DesiredSpec spec;
        try {
            spec = specParser.read(specFile);
        } catch (ReconcileException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_FAILURE;
        }
        var state = stateStore.load(spec.machineName()).orElseGet(() -> new StateRecord(spec.machineName()));
        return run(state, spec.resourceGroup(), operation, () -> action.apply(spec, state));
    }

    public int withRecord(String machineName, String operation, Function<StateRecord, Integer> action) {
        var loaded = stateStore.load(machineName);
        if (loaded.isEmpty()) {
            ConsoleOutput.error("No state recorded for machine " + machineName);
            return EXIT_FAILURE;
        }
        var state = loaded.get();
        return run(state, state.getResourceGroup(), operation, () -> action.apply(state));
    }

    public void forget(String machineName) {
        stateStore.delete(machineName);
        log.info("Removed state record of {}", machineName);
    }

    private int run(StateRecord state, String resourceGroup, String operation,
                    Supplier<Integer> action) {
        MdcContext.setMachine(state.getMachineName(), resourceGroup);
        MdcContext.setOperation(operation);
        try {
            return action.get();
        } catch (ReconcileException e) {
            log.error("{} of {} failed ({}): {}", operation, state.getMachineName(), e.getKind(), e.getMessage());
            ConsoleOutput.error(e.getMessage());
            return e.getKind() == ErrorKind.INTERNAL_INVARIANT ? EXIT_BUG : EXIT_FAILURE;
        } catch (CloudApiException e) {
            log.error("{} of {} failed: {}", operation, state.getMachineName(), e.getMessage(), e);
            ConsoleOutput.error(e.getMessage());
            if (e.getPayload() != null) {
                System.out.println(e.getPayload());
            }
            return EXIT_FAILURE;
        } finally {
            stateStore.save(state);
            MdcContext.clear();
        }
    }
}

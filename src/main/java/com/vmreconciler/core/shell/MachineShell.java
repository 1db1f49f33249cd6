package com.vmreconciler.core.shell;

import com.vmreconciler.core.model.StateRecord;

/**
 * Runs a command on the managed machine. Used only for best-effort cleanup,
 * so implementations report failure through the return value and never throw.
 */
@FunctionalInterface
public interface MachineShell {

    /**
     * @return {@code true} when the command ran and exited with status 0
     */
    boolean run(StateRecord machine, String command);
}

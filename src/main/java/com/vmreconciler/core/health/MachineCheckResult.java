package com.vmreconciler.core.health;

import java.util.List;

/**
 * Outcome of a health check.
 *
 * @param disksOk {@code null} when the disks were not inspected (VM missing or not up)
 */
public record MachineCheckResult(boolean exists, boolean isUp, Boolean disksOk, List<String> messages) {

    public MachineCheckResult {
        messages = List.copyOf(messages);
    }

    public static MachineCheckResult missing() {
        return new MachineCheckResult(false, false, null, List.of());
    }
}

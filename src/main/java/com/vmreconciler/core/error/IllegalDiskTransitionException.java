package com.vmreconciler.core.error;

/**
 * A requested disk change that the compute API cannot apply in one step.
 */
public class IllegalDiskTransitionException extends ReconcileException {

    public enum Violation {
        /** Target slot is held by a different, attached disk. */
        SLOT_OCCUPIED,
        /** Attached disk asked to move to another slot. */
        SLOT_REASSIGNMENT,
        /** Attached disk asked to change its name. */
        NAME_CHANGE
    }

    private final Violation violation;
    private final String diskId;
    private final String device;

    public IllegalDiskTransitionException(Violation violation, String diskId, String device, String message) {
        super(ErrorKind.ILLEGAL_TRANSITION, message);
        this.violation = violation;
        this.diskId = diskId;
        this.device = device;
    }

    public Violation getViolation() {
        return violation;
    }

    public String getDiskId() {
        return diskId;
    }

    public String getDevice() {
        return device;
    }
}

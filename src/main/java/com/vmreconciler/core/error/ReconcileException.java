package com.vmreconciler.core.error;

/**
 * Fatal reconciliation error. The message is meant for the operator and names
 * what to change or which override flag to use.
 */
public class ReconcileException extends RuntimeException {

    private final ErrorKind kind;

    public ReconcileException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReconcileException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ReconcileException configuration(String message) {
        return new ReconcileException(ErrorKind.CONFIGURATION, message);
    }

    public static ReconcileException permissionRequired(String message) {
        return new ReconcileException(ErrorKind.PERMISSION_REQUIRED, message);
    }

    public static ReconcileException remoteFailure(String message) {
        return new ReconcileException(ErrorKind.REMOTE_FAILURE, message);
    }

    public static ReconcileException internal(String message) {
        return new ReconcileException(ErrorKind.INTERNAL_INVARIANT, message);
    }
}

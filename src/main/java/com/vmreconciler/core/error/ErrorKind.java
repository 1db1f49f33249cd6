package com.vmreconciler.core.error;

/**
 * Closed set of failure categories a reconciliation can end with.
 */
public enum ErrorKind {
    /** Invalid declaration, detected before any remote call. */
    CONFIGURATION,
    /** Disk transition that cannot be done in one step. */
    ILLEGAL_TRANSITION,
    /** Needs {@code --allow-reboot} or {@code --allow-recreate}. */
    PERMISSION_REQUIRED,
    /** Remote call failed, timed out or found unexpected remote state. */
    REMOTE_FAILURE,
    /** Broken internal assumption; a bug rather than a user error. */
    INTERNAL_INVARIANT
}

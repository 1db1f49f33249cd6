package com.vmreconciler.core.drift;

/**
 * Kinds of divergence between the recorded state and the live VM.
 */
public enum DriftKind {
    VM_FAILED,
    VM_SIZE,
    PUBLIC_IP,
    ROOT_DISK,
    DISK_CACHING,
    DISK_SIZE,
    DISK_NAME,
    DISK_UNEXPECTEDLY_ATTACHED,
    DISK_WRONG_SLOT,
    DISK_UNEXPECTEDLY_DETACHED,
    DISK_UNEXPECTEDLY_DELETED,
    UNEXPECTED_DISK
}

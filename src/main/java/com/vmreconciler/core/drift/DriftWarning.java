package com.vmreconciler.core.drift;

/**
 * @param resource human-readable name of the diverging resource
 * @param autoFixed whether the record (or the live VM) was corrected
 */
public record DriftWarning(DriftKind kind, String resource, String message, boolean autoFixed) {}

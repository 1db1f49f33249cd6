package com.vmreconciler.cloud;

/**
 * Guest OS bootstrap settings, sent only when the root disk is built from an image.
 */
public record OsProfile(
    String adminUsername,
    String adminPassword,
    String computerName,
    String customData
) {}

package com.vmreconciler.cloud;

import com.vmreconciler.core.model.HostCaching;

/**
 * The OS (root) disk of a VM. {@code sourceImageUri} is only set when the disk
 * is created from an image.
 */
public record OsDisk(
    String name,
    String uri,
    HostCaching caching,
    DiskCreateOption createOption,
    String sourceImageUri
) {}

package com.vmreconciler.cloud;

import com.vmreconciler.core.model.HostCaching;

/**
 * A data disk as seen in (or sent to) the VM storage profile.
 *
 * @param name disk name, immutable while attached
 * @param uri backing-store blob URL
 * @param caching host caching mode
 * @param createOption how the disk is obtained when added
 * @param lun attachment slot, 0..31
 * @param sizeGb size in GB, {@code null} when the API decides
 */
public record DataDisk(
    String name,
    String uri,
    HostCaching caching,
    DiskCreateOption createOption,
    int lun,
    Integer sizeGb
) {

    public DataDisk withCaching(HostCaching newCaching) {
        return new DataDisk(name, uri, newCaching, createOption, lun, sizeGb);
    }
}

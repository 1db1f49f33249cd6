package com.vmreconciler.core.engine;

import com.vmreconciler.cloud.BlobApi;
import com.vmreconciler.cloud.BlobRef;
import com.vmreconciler.cloud.BlobUrl;
import com.vmreconciler.cloud.ResourceNotFoundException;
import com.vmreconciler.core.error.ReconcileException;
import com.vmreconciler.core.metrics.ReconcilerMetrics;
import com.vmreconciler.core.model.StateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Existence checks and deletion of disk backing stores (blobs).
 */
@Service
public class BackingStoreService {

    private static final Logger log = LoggerFactory.getLogger(BackingStoreService.class);

    private final BlobApi blobApi;
    private final Confirmer confirmer;
    private final ReconcilerMetrics metrics;

    public BackingStoreService(BlobApi blobApi, Confirmer confirmer, ReconcilerMetrics metrics) {
        this.blobApi = blobApi;
        this.confirmer = confirmer;
        this.metrics = metrics;
    }

    /**
     * Parses a media link and checks that it lives in the machine's storage account.
     */
    public BlobRef resolve(StateRecord machine, String mediaLink) {
        var blob = BlobUrl.parse(mediaLink)
                .orElseThrow(() -> ReconcileException.configuration("failed to parse BLOB URL " + mediaLink));
        if (!blob.account().equals(machine.getStorage())) {
            throw ReconcileException.configuration(
                    "storage %s declared for the machine doesn't match the storage of BLOB %s"
                            .formatted(machine.getStorage(), mediaLink));
        }
        return blob;
    }

    public boolean exists(StateRecord machine, String mediaLink) {
        return blobApi.getProperties(resolve(machine, mediaLink)).isPresent();
    }

    /**
     * Deletes the blob behind a disk.
     *
     * @param deleteVhd {@code null} to ask the operator first
     */
    public void deleteVolume(StateRecord machine, String mediaLink, String diskName, Boolean deleteVhd) {
        if (mediaLink == null) {
            log.warn("attempted to delete disk {} without a BLOB URL; this is a bug", diskName);
            return;
        }
        boolean proceed = Boolean.TRUE.equals(deleteVhd)
                || (deleteVhd == null && confirmer.confirm(
                        "are you sure you want to destroy the contents(BLOB) of Azure disk %s(%s)?"
                                .formatted(diskName, mediaLink)));
        if (!proceed) {
            log.info("keeping the Azure disk BLOB {}...", mediaLink);
            return;
        }

        log.info("destroying Azure disk BLOB {}...", mediaLink);
        var blob = resolve(machine, mediaLink);
        try {
            blobApi.deleteBlob(blob);
            metrics.recordRemoteCall("blob.delete");
        } catch (ResourceNotFoundException e) {
            log.warn("BLOB {} seems to have been destroyed already", mediaLink);
        }
    }
}

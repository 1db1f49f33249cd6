package com.vmreconciler.cloud;

import java.util.Map;
import java.util.Optional;

/**
 * Blob storage operations on disk backing stores.
 */
public interface BlobApi {

    /**
     * @return the blob (or snapshot) properties, empty when it does not exist
     */
    Optional<BlobProperties> getProperties(BlobRef blob);

    /**
     * Deletes the blob, or only the snapshot when {@code blob} names one.
     *
     * @throws ResourceNotFoundException when nothing exists at that address
     */
    void deleteBlob(BlobRef blob);

    /**
     * @return the snapshot id of the new snapshot
     */
    String snapshotBlob(BlobRef blob, Map<String, String> metadata);

    /**
     * Overwrites {@code target} with the content at {@code sourceUrl}.
     */
    void copyBlob(BlobRef target, String sourceUrl);
}

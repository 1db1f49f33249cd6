package com.vmreconciler.cloud;

/**
 * Address of a blob (or one of its snapshots) inside a storage account.
 *
 * @param account storage account name
 * @param container container name
 * @param name blob name, may contain slashes
 * @param snapshotId snapshot timestamp, {@code null} for the live blob
 */
public record BlobRef(String account, String container, String name, String snapshotId) {

    public BlobRef withSnapshot(String snapshot) {
        return new BlobRef(account, container, name, snapshot);
    }

    public boolean isSnapshot() {
        return snapshotId != null;
    }
}

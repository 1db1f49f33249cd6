package com.vmreconciler.cloud;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses storage URLs of the form {@code scheme://account.host/container/name}.
 */
public final class BlobUrl {

    private static final Pattern BLOB_URL = Pattern.compile("https?://([^./]+)\\.[^/]+/([^/]+)/(.+)$");

    private BlobUrl() {}

    public static Optional<BlobRef> parse(String url) {
        if (url == null) {
            return Optional.empty();
        }
        var matcher = BLOB_URL.matcher(url);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BlobRef(matcher.group(1), matcher.group(2), matcher.group(3), null));
    }

    /** Appends the snapshot query used by the blob service to address a snapshot. */
    public static String snapshotUrl(String url, String snapshotId) {
        return url + "?snapshot=" + snapshotId;
    }
}

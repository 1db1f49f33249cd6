package com.vmreconciler.cloud;

import java.util.Map;

public record BlobProperties(long contentLength, String etag, Map<String, String> metadata) {

    public BlobProperties {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

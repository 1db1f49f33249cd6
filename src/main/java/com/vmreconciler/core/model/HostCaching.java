package com.vmreconciler.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Host-side caching mode of an attached disk, as named by the compute API.
 */
public enum HostCaching {
    NONE("None"),
    READ_ONLY("ReadOnly"),
    READ_WRITE("ReadWrite");

    private final String apiName;

    HostCaching(String apiName) {
        this.apiName = apiName;
    }

    @JsonValue
    public String apiName() {
        return apiName;
    }

    @JsonCreator
    public static HostCaching fromApiName(String value) {
        for (HostCaching caching : values()) {
            if (caching.apiName.equalsIgnoreCase(value)) {
                return caching;
            }
        }
        throw new IllegalArgumentException("Unknown host caching mode: " + value);
    }

    @Override
    public String toString() {
        return apiName;
    }
}

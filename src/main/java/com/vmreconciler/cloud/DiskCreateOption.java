package com.vmreconciler.cloud;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the compute API obtains the bytes of a disk when it is added to a VM.
 */
public enum DiskCreateOption {
    ATTACH("Attach"),     // backing store already exists
    EMPTY("Empty"),       // data disk, blob created blank
    FROM_IMAGE("FromImage");

    private final String apiName;

    DiskCreateOption(String apiName) {
        this.apiName = apiName;
    }

    @JsonValue
    public String apiName() {
        return apiName;
    }

    @JsonCreator
    public static DiskCreateOption fromApiName(String value) {
        for (DiskCreateOption option : values()) {
            if (option.apiName.equalsIgnoreCase(value)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown disk create option: " + value);
    }
}

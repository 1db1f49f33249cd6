package com.vmreconciler.core.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Machine declaration as written by the operator (JSON), before validation.
 *
 * @param blockDeviceMapping block devices keyed by device path
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MachineDeclaration(
    String machineName,
    String size,
    String location,
    String storage,
    String virtualNetwork,
    String resourceGroup,
    String rootDiskImageUrl,
    String baseEphemeralDiskUrl,
    boolean obtainIp,
    String availabilitySet,
    Map<String, BlockDevice> blockDeviceMapping
) {

    /**
     * @param mediaLink backing-store URL; derived from {@code baseEphemeralDiskUrl} when absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BlockDevice(
        String name,
        String mediaLink,
        Integer size,
        @JsonProperty("isEphemeral") boolean ephemeral,
        String hostCaching,
        boolean encrypt,
        String passphrase
    ) {}
}

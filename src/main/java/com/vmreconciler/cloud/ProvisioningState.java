package com.vmreconciler.cloud;

/**
 * Provisioning state reported for a VM resource.
 */
public enum ProvisioningState {
    CREATING,
    UPDATING,
    SUCCEEDED,
    FAILED,
    DELETING,
    UNKNOWN;

    public static ProvisioningState fromApiName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ProvisioningState state : values()) {
            if (state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        return UNKNOWN;
    }
}

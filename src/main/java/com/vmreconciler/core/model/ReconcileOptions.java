package com.vmreconciler.core.model;

/**
 * Flags supplied by the deployment run.
 *
 * @param check compare with the live resource and repair drift first
 * @param allowReboot permit changes that reboot the VM (size, availability set)
 * @param allowRecreate permit destroying and re-creating the VM resource
 */
public record ReconcileOptions(boolean check, boolean allowReboot, boolean allowRecreate) {

    public static ReconcileOptions defaults() {
        return new ReconcileOptions(false, false, false);
    }
}

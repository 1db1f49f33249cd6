package com.vmreconciler.core.model;

/**
 * Lifecycle of a managed machine as recorded between runs.
 *
 * <ul>
 *   <li>{@code MISSING}: no VM resource; initial state and the result of a failed health check lookup</li>
 *   <li>{@code STARTING}: set after provisioning, start and hard reboot</li>
 *   <li>{@code RUNNING}: health check saw a successfully provisioned VM</li>
 *   <li>{@code STOPPING}: power-off issued</li>
 *   <li>{@code STOPPED}: powered off, or the VM resource was deleted and disks await re-attach</li>
 * </ul>
 */
public enum LifecycleState {
    MISSING,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}

package com.vmreconciler.cloud;

/**
 * Public IP resource. {@code ipAddress} stays {@code null} until the address is
 * bound to a running NIC (dynamic allocation).
 */
public record PublicIpAddress(String id, String name, String ipAddress) {}

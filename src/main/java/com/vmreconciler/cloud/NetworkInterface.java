package com.vmreconciler.cloud;

public record NetworkInterface(String id, String name, String publicIpId) {}

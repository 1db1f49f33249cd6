package com.vmreconciler.cloud;

public record Subnet(String id, String name) {}

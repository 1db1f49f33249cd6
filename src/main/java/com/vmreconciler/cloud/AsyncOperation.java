package com.vmreconciler.cloud;

/**
 * Handle of a long-running remote operation, e.g. the async-operation URL ARM returns.
 */
public record AsyncOperation(String handle) {}

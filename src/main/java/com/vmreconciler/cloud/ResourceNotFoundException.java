package com.vmreconciler.cloud;

/**
 * The addressed remote resource does not exist.
 */
public class ResourceNotFoundException extends CloudApiException {

    public ResourceNotFoundException(String resource) {
        super("Resource not found: " + resource, 404, null);
    }
}

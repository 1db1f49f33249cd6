package com.vmreconciler.cloud;

/**
 * Status of a long-running operation. {@code error} holds the provider's error
 * payload verbatim when the operation failed.
 */
public record OperationStatus(State state, String error) {

    public enum State { IN_PROGRESS, SUCCEEDED, FAILED }

    public static OperationStatus inProgress() {
        return new OperationStatus(State.IN_PROGRESS, null);
    }

    public static OperationStatus succeeded() {
        return new OperationStatus(State.SUCCEEDED, null);
    }

    public static OperationStatus failed(String error) {
        return new OperationStatus(State.FAILED, error);
    }

    public boolean inProgressState() {
        return state == State.IN_PROGRESS;
    }
}

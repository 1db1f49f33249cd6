package com.vmreconciler.cloud;

import java.util.Optional;

/**
 * Whole-object access to VM resources. There is no fine-grained diff API:
 * every change is a full {@link #createOrUpdate}.
 *
 * <p>Implementations: {@code SimulatedCloud} (dry runs, tests), {@code ArmComputeApi} (Azure).
 * Methods addressing a missing VM throw {@link ResourceNotFoundException};
 * other failures surface as {@link CloudApiException}.
 */
public interface ComputeApi {

    Optional<VirtualMachine> get(String resourceGroup, String name);

    default VirtualMachine require(String resourceGroup, String name) {
        return get(resourceGroup, name)
                .orElseThrow(() -> new ResourceNotFoundException("virtual machine %s/%s".formatted(resourceGroup, name)));
    }

    /**
     * Sends the full VM definition and blocks until the update is accepted.
     */
    VirtualMachine createOrUpdate(String resourceGroup, VirtualMachine vm);

    /**
     * Starts a create-or-update without waiting; poll with {@link #getOperationStatus}.
     */
    AsyncOperation beginCreateOrUpdate(String resourceGroup, VirtualMachine vm);

    OperationStatus getOperationStatus(AsyncOperation operation);

    void delete(String resourceGroup, String name);

    void start(String resourceGroup, String name);

    void powerOff(String resourceGroup, String name);

    void restart(String resourceGroup, String name);
}

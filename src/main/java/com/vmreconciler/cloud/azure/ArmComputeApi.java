package com.vmreconciler.cloud.azure;

import com.vmreconciler.cloud.AsyncOperation;
import com.vmreconciler.cloud.CloudApiException;
import com.vmreconciler.cloud.ComputeApi;
import com.vmreconciler.cloud.OperationStatus;
import com.vmreconciler.cloud.VirtualMachine;
import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.poll.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link ComputeApi} over the {@code Microsoft.Compute/virtualMachines} REST resource.
 * <p>
 * All calls except {@link #beginCreateOrUpdate} wait for the long-running
 * operation ARM starts to finish.
 */
public class ArmComputeApi implements ComputeApi {

    private static final Logger log = LoggerFactory.getLogger(ArmComputeApi.class);

    private final ArmClient client;
    private final ArmJsonMapper mapper;
    private final AzureProperties azure;
    private final ReconcilerProperties properties;
    private final BoundedRetry retry;

    public ArmComputeApi(ArmClient client, ArmJsonMapper mapper, AzureProperties azure,
                         ReconcilerProperties properties, BoundedRetry retry) {
        this.client = client;
        this.mapper = mapper;
        this.azure = azure;
        this.properties = properties;
        this.retry = retry;
    }

    @Override
    public Optional<VirtualMachine> get(String resourceGroup, String name) {
        return client.get(vmPath(resourceGroup, name), azure.getComputeApiVersion())
                .map(mapper::toVirtualMachine);
    }

    @Override
    public VirtualMachine createOrUpdate(String resourceGroup, VirtualMachine vm) {
        var operation = beginCreateOrUpdate(resourceGroup, vm);
        if (operation != null) {
            awaitSuccess("update of virtual machine " + vm.name(), operation);
        }
        return require(resourceGroup, vm.name());
    }

    @Override
    public AsyncOperation beginCreateOrUpdate(String resourceGroup, VirtualMachine vm) {
        var availabilitySetId = vm.availabilitySet() == null ? null
                : azure.resourceGroupPath(resourceGroup)
                        + "/providers/Microsoft.Compute/availabilitySets/" + vm.availabilitySet();
        var response = client.put(vmPath(resourceGroup, vm.name()), azure.getComputeApiVersion(),
                mapper.toJson(vm, availabilitySetId));
        log.debug("Submitted virtual machine {} (async operation {})", vm.name(), response.asyncOperationUrl());
        return response.asyncOperationUrl() == null ? null : new AsyncOperation(response.asyncOperationUrl());
    }

    @Override
    public OperationStatus getOperationStatus(AsyncOperation operation) {
        if (operation == null) {
            return OperationStatus.succeeded();
        }
        return mapper.toOperationStatus(client.getAbsolute(operation.handle()));
    }

    @Override
    public void delete(String resourceGroup, String name) {
        var response = client.delete(vmPath(resourceGroup, name), azure.getComputeApiVersion());
        await("deletion of virtual machine " + name, response);
    }

    @Override
    public void start(String resourceGroup, String name) {
        action(resourceGroup, name, "start");
    }

    @Override
    public void powerOff(String resourceGroup, String name) {
        action(resourceGroup, name, "powerOff");
    }

    @Override
    public void restart(String resourceGroup, String name) {
        action(resourceGroup, name, "restart");
    }

    private void action(String resourceGroup, String name, String action) {
        var response = client.post(vmPath(resourceGroup, name) + "/" + action, azure.getComputeApiVersion());
        await(action + " of virtual machine " + name, response);
    }

    private void await(String what, ArmClient.ArmResponse response) {
        if (response.asyncOperationUrl() != null) {
            awaitSuccess(what, new AsyncOperation(response.asyncOperationUrl()));
        }
    }

    private void awaitSuccess(String what, AsyncOperation operation) {
        retry.await(what, () -> !getOperationStatus(operation).inProgressState(),
                properties.getPollInterval(), properties.getMaxPollAttempts());
        var status = getOperationStatus(operation);
        if (status.state() == OperationStatus.State.FAILED) {
            throw new CloudApiException(what + " failed", 500, status.error());
        }
    }

    private String vmPath(String resourceGroup, String name) {
        return azure.resourceGroupPath(resourceGroup) + "/providers/Microsoft.Compute/virtualMachines/" + name;
    }
}

package com.vmreconciler.cloud.azure;

import com.vmreconciler.cloud.NetworkApi;
import com.vmreconciler.cloud.NetworkInterface;
import com.vmreconciler.cloud.PublicIpAddress;
import com.vmreconciler.cloud.Subnet;

import java.util.Optional;

/**
 * {@link NetworkApi} over the {@code Microsoft.Network} REST resources.
 */
public class ArmNetworkApi implements NetworkApi {

    private final ArmClient client;
    private final ArmJsonMapper mapper;
    private final AzureProperties azure;

    public ArmNetworkApi(ArmClient client, ArmJsonMapper mapper, AzureProperties azure) {
        this.client = client;
        this.mapper = mapper;
        this.azure = azure;
    }

    @Override
    public PublicIpAddress createOrUpdatePublicIp(String resourceGroup, String name, String location) {
        var response = client.put(path(resourceGroup, "publicIPAddresses", name), azure.getNetworkApiVersion(),
                mapper.publicIpRequest(location));
        return mapper.toPublicIp(response.body());
    }

    @Override
    public Optional<PublicIpAddress> getPublicIp(String resourceGroup, String name) {
        return client.get(path(resourceGroup, "publicIPAddresses", name), azure.getNetworkApiVersion())
                .map(mapper::toPublicIp);
    }

    @Override
    public void deletePublicIp(String resourceGroup, String name) {
        client.delete(path(resourceGroup, "publicIPAddresses", name), azure.getNetworkApiVersion());
    }

    @Override
    public Optional<Subnet> getSubnet(String resourceGroup, String virtualNetwork, String subnetName) {
        return client.get(path(resourceGroup, "virtualNetworks", virtualNetwork) + "/subnets/" + subnetName,
                        azure.getNetworkApiVersion())
                .map(mapper::toSubnet);
    }

    @Override
    public NetworkInterface createOrUpdateNetworkInterface(String resourceGroup, String name, String location,
                                                           Subnet subnet, String publicIpId) {
        var response = client.put(path(resourceGroup, "networkInterfaces", name), azure.getNetworkApiVersion(),
                mapper.networkInterfaceRequest(name, location, subnet, publicIpId));
        return mapper.toNetworkInterface(response.body());
    }

    @Override
    public Optional<NetworkInterface> getNetworkInterface(String resourceGroup, String name) {
        return client.get(path(resourceGroup, "networkInterfaces", name), azure.getNetworkApiVersion())
                .map(mapper::toNetworkInterface);
    }

    @Override
    public void deleteNetworkInterface(String resourceGroup, String name) {
        client.delete(path(resourceGroup, "networkInterfaces", name), azure.getNetworkApiVersion());
    }

    private String path(String resourceGroup, String type, String name) {
        return azure.resourceGroupPath(resourceGroup) + "/providers/Microsoft.Network/" + type + "/" + name;
    }
}

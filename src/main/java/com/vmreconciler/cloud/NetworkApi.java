package com.vmreconciler.cloud;

import java.util.Optional;

/**
 * Public IP, network interface and subnet operations.
 */
public interface NetworkApi {

    PublicIpAddress createOrUpdatePublicIp(String resourceGroup, String name, String location);

    Optional<PublicIpAddress> getPublicIp(String resourceGroup, String name);

    /**
     * Address currently bound to the named public IP; {@code null} when the name is
     * {@code null}, the resource is gone or no address is assigned yet.
     */
    default String currentAddress(String resourceGroup, String publicIpName) {
        if (publicIpName == null) {
            return null;
        }
        return getPublicIp(resourceGroup, publicIpName)
                .map(PublicIpAddress::ipAddress)
                .orElse(null);
    }

    void deletePublicIp(String resourceGroup, String name);

    Optional<Subnet> getSubnet(String resourceGroup, String virtualNetwork, String subnetName);

    NetworkInterface createOrUpdateNetworkInterface(String resourceGroup, String name, String location,
                                                    Subnet subnet, String publicIpId);

    Optional<NetworkInterface> getNetworkInterface(String resourceGroup, String name);

    void deleteNetworkInterface(String resourceGroup, String name);
}

package com.vmreconciler.cloud.azure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Azure credentials and endpoints bound from {@code vmreconciler.azure.*}.
 * <p>
 * Not annotated with {@code @Component}; enabled by {@link AzureCloudConfig}
 * when the azure provider is active.
 */
@ConfigurationProperties(prefix = "vmreconciler.azure")
public class AzureProperties {

    private String subscriptionId = "";

    /** Directory (tenant) id of the service principal */
    private String tenantId = "";

    private String authorityUrl = "https://login.microsoftonline.com";

    private String clientId = "";

    private String clientSecret = "";

    private String managementUrl = "https://management.azure.com";

    private String computeApiVersion = "2017-12-01";

    private String networkApiVersion = "2017-09-01";

    /** Host suffix of blob endpoints: {@code <account>.<suffix>} */
    private String blobEndpointSuffix = "blob.core.windows.net";

    private String storageApiVersion = "2019-12-12";

    /** SAS token per storage account, without the leading {@code ?} */
    private Map<String, String> sasTokens = new HashMap<>();

    public String getSubscriptionId() { return subscriptionId; }
    public void setSubscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; }
    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }
    public String getAuthorityUrl() { return authorityUrl; }
    public void setAuthorityUrl(String authorityUrl) { this.authorityUrl = authorityUrl; }
    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
    public String getManagementUrl() { return managementUrl; }
    public void setManagementUrl(String managementUrl) { this.managementUrl = managementUrl; }
    public String getComputeApiVersion() { return computeApiVersion; }
    public void setComputeApiVersion(String computeApiVersion) { this.computeApiVersion = computeApiVersion; }
    public String getNetworkApiVersion() { return networkApiVersion; }
    public void setNetworkApiVersion(String networkApiVersion) { this.networkApiVersion = networkApiVersion; }
    public String getBlobEndpointSuffix() { return blobEndpointSuffix; }
    public void setBlobEndpointSuffix(String blobEndpointSuffix) { this.blobEndpointSuffix = blobEndpointSuffix; }
    public String getStorageApiVersion() { return storageApiVersion; }
    public void setStorageApiVersion(String storageApiVersion) { this.storageApiVersion = storageApiVersion; }
    public Map<String, String> getSasTokens() { return sasTokens; }
    public void setSasTokens(Map<String, String> sasTokens) { this.sasTokens = sasTokens; }

    /** Resource id prefix of a resource group. */
    public String resourceGroupPath(String resourceGroup) {
        return "/subscriptions/%s/resourceGroups/%s".formatted(subscriptionId, resourceGroup);
    }
}

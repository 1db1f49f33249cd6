package com.vmreconciler.cloud.azure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vmreconciler.core.config.ReconcilerProperties;
import com.vmreconciler.core.poll.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the Azure back end.
 * Activates when {@code vmreconciler.cloud.provider=azure}.
 */
@Configuration
@ConditionalOnProperty(name = "vmreconciler.cloud.provider", havingValue = "azure")
@EnableConfigurationProperties(AzureProperties.class)
public class AzureCloudConfig {

    private static final Logger log = LoggerFactory.getLogger(AzureCloudConfig.class);

    @Bean
    public ArmClient armClient(AzureProperties azure, ObjectMapper objectMapper) {
        log.info("Azure back end: subscription {} via {}", azure.getSubscriptionId(), azure.getManagementUrl());
        return new ArmClient(azure, objectMapper);
    }

    @Bean
    public ArmJsonMapper armJsonMapper(ObjectMapper objectMapper) {
        return new ArmJsonMapper(objectMapper);
    }

    @Bean
    public ArmComputeApi armComputeApi(ArmClient client, ArmJsonMapper mapper, AzureProperties azure,
                                       ReconcilerProperties properties, BoundedRetry retry) {
        return new ArmComputeApi(client, mapper, azure, properties, retry);
    }

    @Bean
    public ArmNetworkApi armNetworkApi(ArmClient client, ArmJsonMapper mapper, AzureProperties azure) {
        return new ArmNetworkApi(client, mapper, azure);
    }

    @Bean
    public AzureBlobApi azureBlobApi(AzureProperties azure) {
        return new AzureBlobApi(azure);
    }
}

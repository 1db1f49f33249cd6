package com.vmreconciler.cloud.simulated;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Activates when {@code vmreconciler.cloud.provider=simulated} (the default).
 * One {@link SimulatedCloud} serves as compute, network and blob API.
 */
@Configuration
@ConditionalOnProperty(name = "vmreconciler.cloud.provider", havingValue = "simulated", matchIfMissing = true)
public class SimulatedCloudConfig {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCloudConfig.class);

    @Bean
    public SimulatedCloud simulatedCloud() {
        log.info("Using the simulated cloud; no remote resources will be touched");
        return new SimulatedCloud();
    }
}

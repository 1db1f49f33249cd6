package com.vmreconciler.core.config;

import com.vmreconciler.core.poll.BoundedRetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReconcilerConfig {

    @Bean
    public BoundedRetry boundedRetry() {
        return BoundedRetry.realTime();
    }
}

package com.vmreconciler.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for reconciliation runs.
 */
@Service
public class ReconcilerMetrics {

    private final MeterRegistry registry;

    public ReconcilerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReconcileDuration(long ms) {
        Timer.builder("vmreconciler.reconcile.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordReconcileResult(String status) {
        Counter.builder("vmreconciler.reconcile.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDriftWarning(String kind) {
        Counter.builder("vmreconciler.drift.warnings")
                .description("Divergences found between recorded and live state")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Counts mutating calls issued against the remote API.
     *
     * @param operation e.g. {@code vm.update}, {@code vm.create}, {@code blob.delete}
     */
    public void recordRemoteCall(String operation) {
        Counter.builder("vmreconciler.remote.calls")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}

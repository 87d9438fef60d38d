package com.phillippitts.erasemark.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for watermark removal.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>End-to-end latency per backend (cloud, local, classical, none)</li>
 *   <li>Success/failure counts per backend</li>
 *   <li>Fallback transitions and no-op requests</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class InpaintMetrics {

    private static final String METRIC_PREFIX = "erasemark.inpaint";

    private final MeterRegistry registry;

    public InpaintMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records request latency for the backend that produced the result.
     *
     * @param backend backend name
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to remove a watermark")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String backend) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful removals")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    /**
     * @param backend backend name, or "chain" when every backend failed
     * @param reason short failure category (invalid_input, exhausted, ...)
     */
    public void incrementFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed removals")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a transition away from {@code backend}.
     *
     * @param outcome UNAVAILABLE or FAILED
     */
    public void incrementFallback(String backend, String outcome) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of backend fallbacks")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementNoOp() {
        Counter.builder(METRIC_PREFIX + ".noop")
                .description("Requests whose mask was empty")
                .register(registry)
                .increment();
    }
}

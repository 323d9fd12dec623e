package com.cee.telemetry;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Records events into a Micrometer registry: a counter {@code cee.<event>} per emission and a
 * distribution summary {@code cee.<event>.<count>} per count, so totals and per-call spreads are both available.
 */
public final class MicrometerTelemetrySink implements TelemetrySink {

    static final String PREFIX = "cee.";

    private final MeterRegistry registry;

    /** Uses a private {@link SimpleMeterRegistry}; intended for local runs and tests. */
    public MicrometerTelemetrySink() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerTelemetrySink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void emit(String event, Map<String, Number> counts) {
        String base = PREFIX + event;
        registry.counter(base).increment();
        if (counts == null) return;
        for (Map.Entry<String, Number> e : counts.entrySet()) {
            if (e.getValue() == null) continue;
            DistributionSummary.builder(base + "." + e.getKey())
                    .register(registry)
                    .record(e.getValue().doubleValue());
        }
    }
}

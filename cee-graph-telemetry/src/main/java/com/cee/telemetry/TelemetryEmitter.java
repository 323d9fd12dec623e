package com.cee.telemetry;

import com.cee.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Fail-safe facade for telemetry. All emissions delegate to {@link TelemetrySink};
 * any exception from the sink is caught, logged, and not rethrown, so a validation or
 * reconciliation result never depends on telemetry.
 */
public final class TelemetryEmitter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryEmitter.class);

    private final TelemetrySink sink;

    public TelemetryEmitter(TelemetrySink sink) {
        this.sink = sink != null ? sink : new NoOpTelemetrySink();
    }

    /** Emitter over the sink selected by {@code CEE_TELEMETRY_SINK}. */
    public static TelemetryEmitter fromConfig(EngineConfig config) {
        return new TelemetryEmitter(createSink(config));
    }

    static TelemetrySink createSink(EngineConfig config) {
        if (config == null) return new LoggingTelemetrySink();
        return switch (config.getTelemetrySink()) {
            case NONE -> new NoOpTelemetrySink();
            case LOG -> new LoggingTelemetrySink();
            case MICROMETER -> new MicrometerTelemetrySink();
        };
    }

    public TelemetrySink getSink() {
        return sink;
    }

    public void emit(String event, Map<String, Number> counts) {
        try {
            sink.emit(event, counts);
        } catch (Throwable t) {
            log.warn("Telemetry emit failed (event={}); result unaffected. Error: {}", event, t.getMessage(), t);
        }
    }
}

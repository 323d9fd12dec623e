package com.cee.telemetry;

import java.util.Map;

/**
 * Destination for engine telemetry: one event name plus a flat map of counts.
 * Implementations may throw; callers go through {@link TelemetryEmitter}, which contains the failure.
 */
public interface TelemetrySink {

    /**
     * @param event  event name, e.g. {@code graph_validator.complete}
     * @param counts metric name to value, in a stable order
     */
    void emit(String event, Map<String, Number> counts);
}

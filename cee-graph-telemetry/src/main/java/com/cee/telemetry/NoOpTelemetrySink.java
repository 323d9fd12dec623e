package com.cee.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Sink used when telemetry is disabled. Logs at debug so the call path stays visible. */
public final class NoOpTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(NoOpTelemetrySink.class);

    @Override
    public void emit(String event, Map<String, Number> counts) {
        log.debug("Telemetry (no-op) | event={} | emission skipped", event);
    }
}

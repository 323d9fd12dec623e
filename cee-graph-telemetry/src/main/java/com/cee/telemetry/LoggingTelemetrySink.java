package com.cee.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Writes each event as one structured info line. */
public final class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    @Override
    public void emit(String event, Map<String, Number> counts) {
        log.info("Telemetry | event={} | counts={}", event, counts);
    }
}

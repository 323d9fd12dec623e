package com.cee.config;

import java.util.Locale;

/** Telemetry sink selected by {@code CEE_TELEMETRY_SINK}. Unknown values resolve to {@link #LOG}. */
public enum TelemetrySinkType {
    NONE,
    LOG,
    MICROMETER;

    public static TelemetrySinkType fromValue(String value) {
        if (value == null || value.isBlank()) return LOG;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TelemetrySinkType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        return LOG;
    }
}

package com.cee.graph.model;

import java.util.Locale;

/** How a factor value was obtained ({@code data.extractionType}). */
public enum ExtractionType {
    EXPLICIT,
    INFERRED,
    RANGE,
    OBSERVED;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the matching type, or null when {@code value} is outside the valid set. */
    public static ExtractionType fromValue(String value) {
        if (value == null) return null;
        for (ExtractionType t : values()) {
            if (t.toValue().equals(value)) return t;
        }
        return null;
    }

    public static boolean isValid(String value) {
        return fromValue(value) != null;
    }
}

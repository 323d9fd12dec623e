package com.cee.graph.model;

import java.util.Locale;

/** Semantic type of a factor's value ({@code data.factor_type}). */
public enum FactorType {
    COST,
    PRICE,
    TIME,
    PROBABILITY,
    REVENUE,
    DEMAND,
    QUALITY,
    /** Safe default for missing or unrecognised types. */
    OTHER;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the matching type, or null when {@code value} is outside the valid set. */
    public static FactorType fromValue(String value) {
        if (value == null) return null;
        for (FactorType t : values()) {
            if (t.toValue().equals(value)) return t;
        }
        return null;
    }

    public static boolean isValid(String value) {
        return fromValue(value) != null;
    }
}

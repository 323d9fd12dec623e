package com.cee.graph.model;

import java.util.Locale;

/**
 * Structural category of a factor node. Controllable factors are set by an option,
 * observable factors are measured, external factors are neither.
 */
public enum FactorCategory {
    CONTROLLABLE,
    OBSERVABLE,
    EXTERNAL;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the matching category, or null when {@code value} is not one of the three names. */
    public static FactorCategory fromValue(String value) {
        if (value == null) return null;
        for (FactorCategory c : values()) {
            if (c.toValue().equals(value)) return c;
        }
        return null;
    }

    public static boolean isValid(String value) {
        return fromValue(value) != null;
    }
}

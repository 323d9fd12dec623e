package com.cee.graph.model;

import java.util.Locale;

/** Declared direction of a causal edge ({@code effect_direction}). */
public enum EffectDirection {
    POSITIVE,
    NEGATIVE,
    /** No sign claim; never compared against {@code strength_mean}. */
    MIXED;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the matching direction, or null when {@code value} is outside the valid set. */
    public static EffectDirection fromValue(String value) {
        if (value == null) return null;
        for (EffectDirection d : values()) {
            if (d.toValue().equals(value)) return d;
        }
        return null;
    }

    public static boolean isValid(String value) {
        return fromValue(value) != null;
    }

    /**
     * Returns true when this direction makes a sign claim that disagrees with {@code mean}.
     * Zero, NaN and {@link #MIXED} never disagree.
     */
    public boolean contradicts(double mean) {
        if (this == MIXED || mean == 0 || Double.isNaN(mean)) return false;
        return (mean > 0) != (this == POSITIVE);
    }

    /** Direction matching the sign of a non-zero mean. */
    public static EffectDirection ofSign(double mean) {
        return mean > 0 ? POSITIVE : NEGATIVE;
    }
}

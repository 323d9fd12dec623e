package com.cee.validation.tier;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonical form of an option's interventions: {@code factorId:value} entries with the value fixed to
 * four decimal places, sorted and joined by {@code |}. Options whose values differ only beyond the fourth
 * decimal share a signature.
 */
public final class InterventionSignature {

    private InterventionSignature() {
    }

    public static String of(Map<String, Double> interventions) {
        List<String> entries = interventions.entrySet().stream()
                .map(e -> e.getKey() + ":" + fixed4(e.getValue()))
                .sorted()
                .collect(Collectors.toList());
        return String.join("|", entries);
    }

    /** Half-up rounding of the exact binary value; non-finite values keep their symbolic name. */
    static String fixed4(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "Infinity" : "-Infinity";
        String s = new BigDecimal(value).setScale(4, RoundingMode.HALF_UP).toPlainString();
        // tiny negatives keep their sign, as in "-0.0000"
        return value < 0 && !s.startsWith("-") ? "-" + s : s;
    }
}

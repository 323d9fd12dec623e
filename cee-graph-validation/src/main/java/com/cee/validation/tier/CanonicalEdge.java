package com.cee.validation.tier;

import com.cee.graph.model.GraphEdge;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed values structural edges are expected to carry. Mean and probability read the legacy
 * {@code weight}/{@code belief} aliases when the canonical fields are absent.
 */
public final class CanonicalEdge {

    public static final double MEAN = 1.0;
    public static final double STD = 0.01;
    /** Tolerance applied by the advisory check. */
    public static final double STD_MAX = 0.05;
    public static final double PROB = 1.0;
    public static final String DIRECTION = "positive";

    private CanonicalEdge() {
    }

    /** Exactly mean 1, std 0.01, probability 1 and direction positive; absent fields fail. */
    public static boolean isStrict(GraphEdge edge) {
        return Objects.equals(edge.effectiveMean(), MEAN)
                && Objects.equals(edge.getStrengthStd(), STD)
                && Objects.equals(edge.effectiveBelief(), PROB)
                && DIRECTION.equals(edge.getEffectDirection());
    }

    /** Mean and probability exactly 1; std absent or at most 0.05; direction absent or positive. */
    public static boolean isTolerant(GraphEdge edge) {
        Double std = edge.getStrengthStd();
        String direction = edge.getEffectDirection();
        return Objects.equals(edge.effectiveMean(), MEAN)
                && (std == null || std <= STD_MAX)
                && Objects.equals(edge.effectiveBelief(), PROB)
                && (direction == null || DIRECTION.equals(direction));
    }

    public static Map<String, Object> expected(boolean withTolerance) {
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("mean", MEAN);
        expected.put("std", STD);
        if (withTolerance) expected.put("stdMax", STD_MAX);
        expected.put("prob", PROB);
        expected.put("direction", DIRECTION);
        return expected;
    }

    /** Values the edge actually carries; absent fields are left out. */
    public static Map<String, Object> actual(GraphEdge edge) {
        Map<String, Object> actual = new LinkedHashMap<>();
        putIfPresent(actual, "mean", edge.effectiveMean());
        putIfPresent(actual, "std", edge.getStrengthStd());
        putIfPresent(actual, "prob", edge.effectiveBelief());
        putIfPresent(actual, "direction", edge.getEffectDirection());
        return actual;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) map.put(key, value);
    }
}

package com.cee.graph.model;

import java.util.Locale;

/**
 * Kind of a decision graph node. JSON uses the lowercase name; unknown values resolve to {@link #UNKNOWN}
 * while the raw string is kept on the node.
 */
public enum NodeKind {
    GOAL,
    DECISION,
    OPTION,
    FACTOR,
    OUTCOME,
    RISK,
    ACTION,
    /** Used when the graph contains a kind string outside the set above. */
    UNKNOWN;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeKind fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (NodeKind k : values()) {
            if (k != UNKNOWN && k.toValue().equals(value)) return k;
        }
        return UNKNOWN;
    }

    /** True for outcome and risk nodes, the two kinds that feed the goal. */
    public boolean isOutcomeOrRisk() {
        return this == OUTCOME || this == RISK;
    }
}

package com.cee.validation;

import com.cee.config.EngineConfig;

import java.util.Objects;

/**
 * Size and option-count bounds enforced by the structural tier. All values must be positive
 * and {@code minOptions <= maxOptions}.
 */
public final class GraphLimits {

    /** Default: 50 nodes, 200 edges, 2 to 6 options. */
    public static final GraphLimits DEFAULT = new GraphLimits(
            EngineConfig.DEFAULT_NODE_LIMIT, EngineConfig.DEFAULT_EDGE_LIMIT,
            EngineConfig.DEFAULT_MIN_OPTIONS, EngineConfig.DEFAULT_MAX_OPTIONS);

    private final int nodeLimit;
    private final int edgeLimit;
    private final int minOptions;
    private final int maxOptions;

    public GraphLimits(int nodeLimit, int edgeLimit, int minOptions, int maxOptions) {
        this.nodeLimit = requirePositive(nodeLimit, "nodeLimit");
        this.edgeLimit = requirePositive(edgeLimit, "edgeLimit");
        this.minOptions = requirePositive(minOptions, "minOptions");
        this.maxOptions = requirePositive(maxOptions, "maxOptions");
        if (minOptions > maxOptions) {
            throw new IllegalArgumentException("minOptions must not exceed maxOptions, got: "
                    + minOptions + " > " + maxOptions);
        }
    }

    public static GraphLimits from(EngineConfig config) {
        return new GraphLimits(config.getNodeLimit(), config.getEdgeLimit(),
                config.getMinOptions(), config.getMaxOptions());
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    public int getNodeLimit() {
        return nodeLimit;
    }

    public int getEdgeLimit() {
        return edgeLimit;
    }

    public int getMinOptions() {
        return minOptions;
    }

    public int getMaxOptions() {
        return maxOptions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphLimits that = (GraphLimits) o;
        return nodeLimit == that.nodeLimit
                && edgeLimit == that.edgeLimit
                && minOptions == that.minOptions
                && maxOptions == that.maxOptions;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeLimit, edgeLimit, minOptions, maxOptions);
    }
}

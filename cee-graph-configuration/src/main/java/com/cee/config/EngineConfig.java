package com.cee.config;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the graph validation engine.
 * <p>
 * Limits: CEE_GRAPH_NODE_LIMIT, CEE_GRAPH_EDGE_LIMIT, CEE_GRAPH_MIN_OPTIONS, CEE_GRAPH_MAX_OPTIONS.
 * Telemetry: CEE_TELEMETRY_SINK ({@code none}, {@code log}, {@code micrometer}).
 * Reconciliation: CEE_STRP_FILL_CONTROLLABLE_DATA enables the controllable data completeness rule.
 * Unset, blank or unparseable values fall back to the defaults below.
 */
public final class EngineConfig {

    static final String ENV_NODE_LIMIT = "CEE_GRAPH_NODE_LIMIT";
    static final String ENV_EDGE_LIMIT = "CEE_GRAPH_EDGE_LIMIT";
    static final String ENV_MIN_OPTIONS = "CEE_GRAPH_MIN_OPTIONS";
    static final String ENV_MAX_OPTIONS = "CEE_GRAPH_MAX_OPTIONS";
    static final String ENV_TELEMETRY_SINK = "CEE_TELEMETRY_SINK";
    static final String ENV_FILL_CONTROLLABLE_DATA = "CEE_STRP_FILL_CONTROLLABLE_DATA";

    public static final int DEFAULT_NODE_LIMIT = 50;
    public static final int DEFAULT_EDGE_LIMIT = 200;
    public static final int DEFAULT_MIN_OPTIONS = 2;
    public static final int DEFAULT_MAX_OPTIONS = 6;

    private final int nodeLimit;
    private final int edgeLimit;
    private final int minOptions;
    private final int maxOptions;
    private final TelemetrySinkType telemetrySink;
    private final boolean fillControllableData;

    private EngineConfig(Builder b) {
        this.nodeLimit = b.nodeLimit;
        this.edgeLimit = b.edgeLimit;
        this.minOptions = b.minOptions;
        this.maxOptions = b.maxOptions;
        this.telemetrySink = b.telemetrySink;
        this.fillControllableData = b.fillControllableData;
    }

    /** Maximum number of nodes before Tier 1 reports NODE_LIMIT_EXCEEDED. Default 50. */
    public int getNodeLimit() {
        return nodeLimit;
    }

    /** Maximum number of edges before Tier 1 reports EDGE_LIMIT_EXCEEDED. Default 200. */
    public int getEdgeLimit() {
        return edgeLimit;
    }

    public int getMinOptions() {
        return minOptions;
    }

    public int getMaxOptions() {
        return maxOptions;
    }

    public TelemetrySinkType getTelemetrySink() {
        return telemetrySink;
    }

    /** Whether the engine pipeline runs reconciliation with the controllable data completeness rule. */
    public boolean isFillControllableData() {
        return fillControllableData;
    }

    /** Defaults only; no environment lookup. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig fromEnvironment() {
        return from(System.getenv());
    }

    /** Reads the same keys as {@link #fromEnvironment()} from the given map. */
    public static EngineConfig from(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .nodeLimit(parseInt(env.get(ENV_NODE_LIMIT), DEFAULT_NODE_LIMIT))
                .edgeLimit(parseInt(env.get(ENV_EDGE_LIMIT), DEFAULT_EDGE_LIMIT))
                .minOptions(parseInt(env.get(ENV_MIN_OPTIONS), DEFAULT_MIN_OPTIONS))
                .maxOptions(parseInt(env.get(ENV_MAX_OPTIONS), DEFAULT_MAX_OPTIONS))
                .telemetrySink(TelemetrySinkType.fromValue(env.get(ENV_TELEMETRY_SINK)))
                .fillControllableData(parseBoolean(env.get(ENV_FILL_CONTROLLABLE_DATA), false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{nodeLimit=" + nodeLimit + ", edgeLimit=" + edgeLimit
                + ", minOptions=" + minOptions + ", maxOptions=" + maxOptions
                + ", telemetrySink=" + telemetrySink + ", fillControllableData=" + fillControllableData + "}";
    }

    public static final class Builder {
        private int nodeLimit = DEFAULT_NODE_LIMIT;
        private int edgeLimit = DEFAULT_EDGE_LIMIT;
        private int minOptions = DEFAULT_MIN_OPTIONS;
        private int maxOptions = DEFAULT_MAX_OPTIONS;
        private TelemetrySinkType telemetrySink = TelemetrySinkType.LOG;
        private boolean fillControllableData;

        public Builder nodeLimit(int nodeLimit) {
            this.nodeLimit = nodeLimit;
            return this;
        }

        public Builder edgeLimit(int edgeLimit) {
            this.edgeLimit = edgeLimit;
            return this;
        }

        public Builder minOptions(int minOptions) {
            this.minOptions = minOptions;
            return this;
        }

        public Builder maxOptions(int maxOptions) {
            this.maxOptions = maxOptions;
            return this;
        }

        public Builder telemetrySink(TelemetrySinkType telemetrySink) {
            this.telemetrySink = telemetrySink != null ? telemetrySink : TelemetrySinkType.LOG;
            return this;
        }

        public Builder fillControllableData(boolean fillControllableData) {
            this.fillControllableData = fillControllableData;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}

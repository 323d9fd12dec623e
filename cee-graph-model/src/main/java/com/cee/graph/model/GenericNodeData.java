package com.cee.graph.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/** Data of any node kind the engine does not inspect; written back unchanged. */
public final class GenericNodeData implements NodeData {

    private final JsonNode raw;

    public GenericNodeData(JsonNode raw) {
        this.raw = Objects.requireNonNull(raw, "raw");
    }

    @JsonValue
    public JsonNode getRaw() {
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GenericNodeData other && raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }
}

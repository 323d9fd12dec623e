package com.cee.graph.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * External goal constraint targeting a node by id. Only {@code node_id} and {@code constraint_id} are
 * interpreted; every other property is carried through opaquely. Instances are never changed;
 * {@link #withNodeId(String)} returns a remapped copy.
 */
@JsonPropertyOrder({"constraint_id", "node_id"})
public final class GoalConstraint {

    private final String nodeId;
    private final String constraintId;
    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    @JsonCreator
    public GoalConstraint(@JsonProperty("node_id") String nodeId,
                          @JsonProperty("constraint_id") String constraintId) {
        this.nodeId = nodeId;
        this.constraintId = constraintId;
    }

    @JsonProperty("node_id")
    public String getNodeId() {
        return nodeId;
    }

    @JsonProperty("constraint_id")
    public String getConstraintId() {
        return constraintId;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    @JsonAnySetter
    void putExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    /** Copy targeting {@code newNodeId}, keeping the id and all opaque properties. */
    public GoalConstraint withNodeId(String newNodeId) {
        GoalConstraint copy = new GoalConstraint(newNodeId, constraintId);
        copy.extras.putAll(extras);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GoalConstraint that = (GoalConstraint) o;
        return Objects.equals(nodeId, that.nodeId)
                && Objects.equals(constraintId, that.constraintId)
                && extras.equals(that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, constraintId, extras);
    }

    @Override
    public String toString() {
        return "GoalConstraint{constraintId=" + constraintId + ", nodeId=" + nodeId + "}";
    }
}

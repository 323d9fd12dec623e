package com.cee.graph.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node of a decision graph. {@code kind} and {@code category} are kept as the raw strings from the input;
 * {@link #kind()} and {@link #declaredCategory()} resolve them. The id, kind and label never change;
 * category and factor data change only through the owning graph's {@link GraphFieldWriter}.
 */
@JsonPropertyOrder({"id", "kind", "label", "category", "data"})
public final class GraphNode {

    private final String id;
    private final String kind;
    private final String label;
    private String category;
    private NodeData data;
    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    public GraphNode(String id, String kind, String label, String category, NodeData data) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.category = category;
        this.data = data;
    }

    @JsonCreator
    static GraphNode fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("kind") String kind,
            @JsonProperty("label") String label,
            @JsonProperty("category") String category,
            @JsonProperty("data") JsonNode data) {
        return new GraphNode(id, kind, label, category, toNodeData(NodeKind.fromValue(kind), data));
    }

    private static NodeData toNodeData(NodeKind kind, JsonNode data) {
        if (JsonFields.isAbsent(data)) return null;
        if (!data.isObject()) return new GenericNodeData(data);
        return switch (kind) {
            case FACTOR -> FactorData.fromJson(data);
            case OPTION -> OptionData.fromJson(data);
            default -> new GenericNodeData(data);
        };
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /** Raw kind string as supplied. */
    @JsonProperty("kind")
    public String getKind() {
        return kind;
    }

    @JsonIgnore
    public NodeKind kind() {
        return NodeKind.fromValue(kind);
    }

    @JsonProperty("label")
    public String getLabel() {
        return label;
    }

    /** Raw declared category; may be outside the valid set or contradict structure. */
    @JsonProperty("category")
    public String getCategory() {
        return category;
    }

    /** Declared category resolved against the valid set; null when absent or invalid. */
    @JsonIgnore
    public FactorCategory declaredCategory() {
        return FactorCategory.fromValue(category);
    }

    @JsonProperty("data")
    public NodeData getData() {
        return data;
    }

    /** Factor data, or null when this node carries none. */
    @JsonIgnore
    public FactorData factorData() {
        return data instanceof FactorData f ? f : null;
    }

    /** Option data, or null when this node carries none. */
    @JsonIgnore
    public OptionData optionData() {
        return data instanceof OptionData o ? o : null;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    @JsonAnySetter
    void putExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    void setCategory(String category) {
        this.category = category;
    }

    /** Returns the factor data, attaching empty data first when the node had none. */
    FactorData ensureFactorData() {
        if (data == null) {
            data = FactorData.empty();
        }
        if (!(data instanceof FactorData f)) {
            throw new IllegalStateException("Node " + id + " carries non-factor data");
        }
        return f;
    }

    @Override
    public String toString() {
        return "GraphNode{id=" + id + ", kind=" + kind + "}";
    }
}

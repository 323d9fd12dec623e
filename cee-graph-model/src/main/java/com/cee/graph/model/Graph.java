package com.cee.graph.model;

import com.cee.graph.GraphContractException;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision graph: ordered nodes and edges. Both lists are required and unmodifiable, so topology is fixed
 * for the lifetime of the instance. Graph-level properties other than {@code nodes} and {@code edges}
 * (e.g. {@code version}, {@code default_seed}, {@code meta}) are kept and written back unchanged.
 */
@JsonPropertyOrder({"nodes", "edges"})
public final class Graph {

    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    /**
     * @throws GraphContractException when either list is null or holds a null element
     */
    @JsonCreator
    public Graph(@JsonProperty("nodes") List<GraphNode> nodes,
                 @JsonProperty("edges") List<GraphEdge> edges) {
        this.nodes = copyRequired(nodes, "nodes");
        this.edges = copyRequired(edges, "edges");
    }

    private static <T> List<T> copyRequired(List<T> items, String name) {
        if (items == null) {
            throw new GraphContractException("Graph " + name + " array is required");
        }
        List<T> copy = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            if (item == null) {
                throw new GraphContractException("Graph " + name + "[" + i + "] is null");
            }
            copy.add(item);
        }
        return Collections.unmodifiableList(copy);
    }

    @JsonProperty("nodes")
    public List<GraphNode> getNodes() {
        return nodes;
    }

    @JsonProperty("edges")
    public List<GraphEdge> getEdges() {
        return edges;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    @JsonAnySetter
    void putExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    /**
     * Returns the only write path into this graph: a writer limited to the metadata fields
     * reconciliation corrects, refusing nodes and edges that belong to another graph.
     */
    public GraphFieldWriter fieldWriter() {
        return new OwnedGraphFieldWriter(nodes, edges);
    }
}

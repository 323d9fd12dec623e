package com.cee.validation.index;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.Graph;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables over one graph: nodes by id and by kind, forward and reverse adjacency.
 * Built once per pass and read-only afterwards. Duplicate ids overwrite in {@link #node(String)};
 * edges to unknown ids still appear in the adjacency lists.
 */
public final class GraphIndex {

    private final Graph graph;
    private final Map<String, GraphNode> byId = new LinkedHashMap<>();
    private final Map<NodeKind, List<GraphNode>> byKind = new EnumMap<>(NodeKind.class);
    private final Map<String, List<String>> forward = new LinkedHashMap<>();
    private final Map<String, List<String>> reverse = new LinkedHashMap<>();

    private GraphIndex(Graph graph) {
        this.graph = graph;
        for (GraphNode node : graph.getNodes()) {
            byId.put(node.getId(), node);
            byKind.computeIfAbsent(node.kind(), k -> new ArrayList<>()).add(node);
        }
        for (GraphEdge edge : graph.getEdges()) {
            forward.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
            reverse.computeIfAbsent(edge.getTo(), k -> new ArrayList<>()).add(edge.getFrom());
        }
    }

    public static GraphIndex build(Graph graph) {
        return new GraphIndex(GraphContractException.requireNonNull(graph, "Graph"));
    }

    public Graph graph() {
        return graph;
    }

    /** Node with the given id, or null. */
    public GraphNode node(String id) {
        return byId.get(id);
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /** Distinct node ids in first-seen order. */
    public List<String> nodeIds() {
        return List.copyOf(byId.keySet());
    }

    /** Nodes of one kind in graph order; empty when none. */
    public List<GraphNode> nodesOf(NodeKind kind) {
        List<GraphNode> nodes = byKind.get(kind);
        return nodes != null ? Collections.unmodifiableList(nodes) : List.of();
    }

    /** First node of one kind in graph order, or null. */
    public GraphNode first(NodeKind kind) {
        List<GraphNode> nodes = byKind.get(kind);
        return nodes != null && !nodes.isEmpty() ? nodes.get(0) : null;
    }

    /** Edge targets of {@code id} in edge order, duplicates kept. */
    public List<String> successors(String id) {
        List<String> out = forward.get(id);
        return out != null ? Collections.unmodifiableList(out) : List.of();
    }

    /** Edge sources into {@code id} in edge order, duplicates kept. */
    public List<String> predecessors(String id) {
        List<String> in = reverse.get(id);
        return in != null ? Collections.unmodifiableList(in) : List.of();
    }

    /** Kind of the node with the given id, or null when the id is unknown. */
    public NodeKind kindOf(String id) {
        GraphNode node = byId.get(id);
        return node != null ? node.kind() : null;
    }
}

package com.cee.graph.model;

import com.cee.graph.GraphContractException;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/** {@link GraphFieldWriter} bound to one graph's node and edge instances (identity, not equality). */
final class OwnedGraphFieldWriter implements GraphFieldWriter {

    private final Set<GraphNode> nodes = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<GraphEdge> edges = Collections.newSetFromMap(new IdentityHashMap<>());

    OwnedGraphFieldWriter(List<GraphNode> nodes, List<GraphEdge> edges) {
        this.nodes.addAll(nodes);
        this.edges.addAll(edges);
    }

    @Override
    public void setFactorCategory(GraphNode node, FactorCategory category) {
        requireFactor(node).setCategory(category != null ? category.toValue() : null);
    }

    @Override
    public void setFactorType(GraphNode node, FactorType factorType) {
        GraphNode factor = requireFactor(node);
        if (factorType == null && factor.factorData() == null) return;
        dataOf(factor).setFactorType(factorType != null ? factorType.toValue() : null);
    }

    @Override
    public void setExtractionType(GraphNode node, ExtractionType extractionType) {
        GraphNode factor = requireFactor(node);
        if (extractionType == null && factor.factorData() == null) return;
        dataOf(factor).setExtractionType(extractionType != null ? extractionType.toValue() : null);
    }

    @Override
    public void setUncertaintyDrivers(GraphNode node, List<String> drivers) {
        GraphNode factor = requireFactor(node);
        if (drivers == null && factor.factorData() == null) return;
        dataOf(factor).setUncertaintyDrivers(drivers);
    }

    @Override
    public void setEffectDirection(GraphEdge edge, EffectDirection direction) {
        if (edge == null || !edges.contains(edge)) {
            throw new GraphContractException("Edge " + edge + " does not belong to this graph");
        }
        edge.setEffectDirection(direction != null ? direction.toValue() : null);
    }

    private GraphNode requireFactor(GraphNode node) {
        if (node == null || !nodes.contains(node)) {
            throw new GraphContractException("Node " + node + " does not belong to this graph");
        }
        if (node.kind() != NodeKind.FACTOR) {
            throw new GraphContractException("Node " + node.getId() + " is not a factor");
        }
        return node;
    }

    private static FactorData dataOf(GraphNode factor) {
        try {
            return factor.ensureFactorData();
        } catch (IllegalStateException e) {
            throw new GraphContractException(e.getMessage());
        }
    }
}

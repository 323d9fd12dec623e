package com.cee.graph.model;

import java.util.List;

/**
 * Restricted write access to a {@link Graph}. Each method changes exactly one metadata field;
 * nothing here can add, remove or rewire a node or edge. Passing null clears the field.
 * Every method throws {@link com.cee.graph.GraphContractException} when the node or edge
 * is not owned by the graph that issued the writer, or when a factor setter targets a non-factor node.
 */
public interface GraphFieldWriter {

    void setFactorCategory(GraphNode node, FactorCategory category);

    void setFactorType(GraphNode node, FactorType factorType);

    void setExtractionType(GraphNode node, ExtractionType extractionType);

    void setUncertaintyDrivers(GraphNode node, List<String> drivers);

    void setEffectDirection(GraphEdge edge, EffectDirection direction);
}

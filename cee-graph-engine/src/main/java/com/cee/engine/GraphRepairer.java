package com.cee.engine;

import com.cee.graph.model.Graph;

/**
 * Repair step between reconciliation and validation. Implementations may patch node and edge fields of the
 * graph they receive and return it, or return a different graph to validate instead.
 */
@FunctionalInterface
public interface GraphRepairer {

    /** Repairer that leaves the graph untouched. */
    GraphRepairer NONE = graph -> graph;

    /**
     * @param graph reconciled graph
     * @return graph to validate; never null
     */
    Graph repair(Graph graph);
}

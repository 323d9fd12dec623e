package com.cee.validation.index;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.Graph;

import java.util.Map;

/**
 * Index plus inferred factor categories for one graph, shared by every validation tier
 * and by reconciliation. Computed once per pass; never mutates the graph.
 */
public final class GraphAnalysis {

    private final GraphIndex index;
    private final Map<String, FactorCategoryInfo> categories;

    private GraphAnalysis(GraphIndex index) {
        this.index = index;
        this.categories = FactorCategoryInferencer.infer(index);
    }

    public static GraphAnalysis of(Graph graph) {
        return new GraphAnalysis(GraphIndex.build(graph));
    }

    public Graph graph() {
        return index.graph();
    }

    public GraphIndex index() {
        return index;
    }

    /** Inferred categories keyed by factor id, in graph order. */
    public Map<String, FactorCategoryInfo> categories() {
        return categories;
    }

    /** Category info for a factor id, or null for non-factors and unknown ids. */
    public FactorCategoryInfo category(String nodeId) {
        return categories.get(nodeId);
    }

    /** True when {@code nodeId} is a factor inferred as {@code category}. */
    public boolean isFactorOf(String nodeId, FactorCategory category) {
        FactorCategoryInfo info = categories.get(nodeId);
        return info != null && info.category() == category;
    }
}

package com.cee.validation.index;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.FactorData;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Infers each factor's category from structure: an incoming option edge makes it controllable,
 * otherwise a present {@code data.value} makes it observable, otherwise it is external.
 * The declared category never influences the result.
 */
public final class FactorCategoryInferencer {

    private FactorCategoryInferencer() {
    }

    /** Categories keyed by factor id, in graph order. */
    public static Map<String, FactorCategoryInfo> infer(GraphIndex index) {
        Set<String> optionIds = new HashSet<>();
        for (GraphNode option : index.nodesOf(NodeKind.OPTION)) {
            optionIds.add(option.getId());
        }
        Set<String> factorsWithOptionEdge = new HashSet<>();
        for (GraphEdge edge : index.graph().getEdges()) {
            if (optionIds.contains(edge.getFrom())) {
                factorsWithOptionEdge.add(edge.getTo());
            }
        }

        Map<String, FactorCategoryInfo> categories = new LinkedHashMap<>();
        for (GraphNode factor : index.nodesOf(NodeKind.FACTOR)) {
            boolean hasOptionEdge = factorsWithOptionEdge.contains(factor.getId());
            FactorData data = factor.factorData();
            boolean hasValue = data != null && data.hasValue();
            FactorCategory category;
            if (hasOptionEdge) {
                category = FactorCategory.CONTROLLABLE;
            } else if (hasValue) {
                category = FactorCategory.OBSERVABLE;
            } else {
                category = FactorCategory.EXTERNAL;
            }
            categories.put(factor.getId(), new FactorCategoryInfo(
                    factor.getId(), category, hasOptionEdge, hasValue, factor.getCategory()));
        }
        return Collections.unmodifiableMap(categories);
    }
}

package com.cee.validation.index;

import com.cee.graph.model.FactorCategory;

/**
 * Structural category of one factor node, derived from topology and data presence.
 *
 * @param nodeId           factor id
 * @param category         inferred category; authoritative over the declared one
 * @param hasOptionEdge    true when any option node has an edge into this factor
 * @param hasValue         true when {@code data.value} is present
 * @param explicitCategory category string declared on the node, possibly invalid or contradicting {@code category}
 */
public record FactorCategoryInfo(String nodeId,
                                 FactorCategory category,
                                 boolean hasOptionEdge,
                                 boolean hasValue,
                                 String explicitCategory) {

    /** True when a non-empty declared category differs from the inferred one. */
    public boolean isMismatched() {
        return explicitCategory != null && !explicitCategory.isEmpty()
                && !explicitCategory.equals(category.toValue());
    }

    /** Human-readable basis of the inference. */
    public String basis() {
        if (hasOptionEdge) return "has option edge -> controllable";
        if (hasValue) return "has value -> observable";
        return "no option edge, no value -> external";
    }
}

package com.cee.validation.tier;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.NodeKind;

/**
 * Permitted (fromKind, toKind) pairs, refined by the target factor's inferred category where it matters:
 * <ul>
 *   <li>decision → option</li>
 *   <li>option → factor (controllable target)</li>
 *   <li>factor → factor (observable or external target)</li>
 *   <li>factor → outcome, factor → risk</li>
 *   <li>outcome → goal, risk → goal</li>
 * </ul>
 */
public final class AllowedEdgeMatrix {

    private AllowedEdgeMatrix() {
    }

    /**
     * @param toCategory inferred category of the target when it is a factor, else null
     */
    public static boolean isAllowed(NodeKind from, NodeKind to, FactorCategory toCategory) {
        return switch (from) {
            case DECISION -> to == NodeKind.OPTION;
            case OPTION -> to == NodeKind.FACTOR && toCategory == FactorCategory.CONTROLLABLE;
            case FACTOR -> switch (to) {
                case FACTOR -> toCategory == FactorCategory.OBSERVABLE || toCategory == FactorCategory.EXTERNAL;
                case OUTCOME, RISK -> true;
                case GOAL, DECISION, OPTION, ACTION, UNKNOWN -> false;
            };
            case OUTCOME, RISK -> to == NodeKind.GOAL;
            case GOAL, ACTION, UNKNOWN -> false;
        };
    }

    /** Decision → option and option → factor edges encode membership, not a causal estimate. */
    public static boolean isStructural(NodeKind from, NodeKind to) {
        return (from == NodeKind.DECISION && to == NodeKind.OPTION)
                || (from == NodeKind.OPTION && to == NodeKind.FACTOR);
    }
}

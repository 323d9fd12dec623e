package com.cee.validation;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.index.Reachability;

import java.util.List;

/**
 * Counts outcome and risk nodes by whether a controllable factor appears among their ancestors.
 * Outcomes are walked first, then risks; each walk stops at the first controllable factor.
 */
public final class ControllabilityAnalyzer {

    private ControllabilityAnalyzer() {
    }

    public static ControllabilitySummary summarize(GraphAnalysis analysis, List<String> exemptNodeIds) {
        int with = 0;
        int without = 0;
        for (NodeKind kind : List.of(NodeKind.OUTCOME, NodeKind.RISK)) {
            for (GraphNode node : analysis.index().nodesOf(kind)) {
                boolean controlled = Reachability.hasAncestorMatching(analysis.index(), node.getId(),
                        id -> analysis.isFactorOf(id, FactorCategory.CONTROLLABLE));
                if (controlled) {
                    with++;
                } else {
                    without++;
                }
            }
        }
        return new ControllabilitySummary(with, without, exemptNodeIds);
    }
}

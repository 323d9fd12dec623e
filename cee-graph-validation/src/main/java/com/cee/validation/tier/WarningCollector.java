package com.cee.validation.tier;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.FactorData;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.index.GraphIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory checks that never affect validity. Edges with an unknown endpoint are skipped.
 */
public final class WarningCollector {

    public static final double LOW_CONFIDENCE_THRESHOLD = 0.3;
    public static final double MIN_NON_STRUCTURAL_STD = 0.05;

    public List<ValidationIssue> collect(GraphAnalysis analysis) {
        GraphIndex index = analysis.index();
        List<ValidationIssue> warnings = new ArrayList<>();

        List<GraphEdge> edges = analysis.graph().getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            NodeKind from = index.kindOf(edge.getFrom());
            NodeKind to = index.kindOf(edge.getTo());
            if (from == null || to == null) continue;
            String path = IssuePaths.edge(i);
            Double mean = edge.getStrengthMean();
            Double belief = edge.getBeliefExists();

            if (mean != null && (mean < -1 || mean > 1)) {
                warnings.add(ValidationIssue.warn(IssueCode.STRENGTH_OUT_OF_RANGE,
                                "Edge strength_mean " + mean + " outside [-1, +1]")
                        .path(path)
                        .context("value", mean)
                        .build());
            }
            if (belief != null && (belief < 0 || belief > 1)) {
                warnings.add(ValidationIssue.warn(IssueCode.PROBABILITY_OUT_OF_RANGE,
                                "Edge belief_exists " + belief + " outside [0, 1]")
                        .path(path)
                        .context("value", belief)
                        .build());
            }
            if (from == NodeKind.OUTCOME && to == NodeKind.GOAL && mean != null && mean < 0) {
                warnings.add(ValidationIssue.warn(IssueCode.OUTCOME_NEGATIVE_POLARITY,
                                "Outcome->goal edge has negative strength_mean (" + mean + ")")
                        .path(path)
                        .context("from", edge.getFrom())
                        .context("to", edge.getTo())
                        .context("value", mean)
                        .build());
            }
            if (from == NodeKind.RISK && to == NodeKind.GOAL && mean != null && mean > 0) {
                warnings.add(ValidationIssue.warn(IssueCode.RISK_POSITIVE_POLARITY,
                                "Risk->goal edge has positive strength_mean (" + mean + ")")
                        .path(path)
                        .context("from", edge.getFrom())
                        .context("to", edge.getTo())
                        .context("value", mean)
                        .build());
            }
            if (belief != null && belief < LOW_CONFIDENCE_THRESHOLD) {
                warnings.add(ValidationIssue.warn(IssueCode.LOW_EDGE_CONFIDENCE,
                                "Edge has low confidence (belief_exists: " + belief + ")")
                        .path(path)
                        .context("value", belief)
                        .build());
            }

            if (AllowedEdgeMatrix.isStructural(from, to)) {
                if (!CanonicalEdge.isTolerant(edge)) {
                    warnings.add(ValidationIssue.warn(IssueCode.STRUCTURAL_EDGE_NOT_CANONICAL,
                                    "Structural edge " + from.toValue() + "->" + to.toValue() + " is not canonical")
                            .path(path)
                            .context("expected", CanonicalEdge.expected(true))
                            .context("actual", CanonicalEdge.actual(edge))
                            .build());
                }
            } else {
                Double std = edge.getStrengthStd();
                if (std != null && std < MIN_NON_STRUCTURAL_STD) {
                    warnings.add(ValidationIssue.warn(IssueCode.LOW_STD_NON_STRUCTURAL,
                                    "Non-structural edge has low std (" + std + "); causal edges should have std >= "
                                            + MIN_NON_STRUCTURAL_STD)
                            .path(path)
                            .context("from", edge.getFrom())
                            .context("to", edge.getTo())
                            .context("std", std)
                            .context("threshold", MIN_NON_STRUCTURAL_STD)
                            .build());
                }
            }
        }

        for (GraphNode factor : index.nodesOf(NodeKind.FACTOR)) {
            if (!analysis.isFactorOf(factor.getId(), FactorCategory.CONTROLLABLE)) continue;
            FactorData data = factor.factorData();
            if (data != null && data.getUncertaintyDrivers() != null && data.getUncertaintyDrivers().isEmpty()) {
                warnings.add(ValidationIssue.warn(IssueCode.EMPTY_UNCERTAINTY_DRIVERS,
                                "Controllable factor \"" + factor.getId() + "\" has empty uncertainty_drivers")
                        .path(IssuePaths.nodeData(factor.getId(), "uncertainty_drivers"))
                        .build());
            }
        }
        return warnings;
    }
}

package com.cee.validation.tier;

import com.cee.graph.model.FactorData;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.OptionData;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.GraphAnalysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tier 6: every numeric field the engine reads is finite. One issue per offending field.
 */
public final class NumericTier implements ValidationTier {

    @Override
    public String name() {
        return "numeric";
    }

    @Override
    public List<ValidationIssue> check(GraphAnalysis analysis) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (GraphNode node : analysis.graph().getNodes()) {
            switch (node.kind()) {
                case FACTOR -> checkFactor(node, issues);
                case OPTION -> checkOption(node, issues);
                case GOAL, DECISION, OUTCOME, RISK, ACTION, UNKNOWN -> {
                }
            }
        }

        List<GraphEdge> edges = analysis.graph().getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            checkEdgeField(i, "strength_mean", edge.getStrengthMean(), issues);
            checkEdgeField(i, "strength_std", edge.getStrengthStd(), issues);
            checkEdgeField(i, "belief_exists", edge.getBeliefExists(), issues);
        }
        return issues;
    }

    private static void checkFactor(GraphNode node, List<ValidationIssue> issues) {
        FactorData data = node.factorData();
        if (data == null) return;
        if (isNonFinite(data.getValue())) {
            issues.add(ValidationIssue.error(IssueCode.NAN_VALUE,
                            "Factor \"" + node.getId() + "\" has invalid numeric value: " + data.getValue())
                    .path(IssuePaths.nodeData(node.getId(), "value"))
                    .context("value", data.getValue())
                    .build());
        }
        if (isNonFinite(data.getBaseline())) {
            issues.add(ValidationIssue.error(IssueCode.NAN_VALUE,
                            "Factor \"" + node.getId() + "\" has invalid baseline: " + data.getBaseline())
                    .path(IssuePaths.nodeData(node.getId(), "baseline"))
                    .context("value", data.getBaseline())
                    .build());
        }
    }

    private static void checkOption(GraphNode node, List<ValidationIssue> issues) {
        OptionData data = node.optionData();
        if (data == null || data.getInterventions() == null) return;
        for (Map.Entry<String, Double> entry : data.getInterventions().entrySet()) {
            if (isNonFinite(entry.getValue())) {
                issues.add(ValidationIssue.error(IssueCode.NAN_VALUE,
                                "Option \"" + node.getId() + "\" has invalid intervention value for "
                                        + entry.getKey() + ": " + entry.getValue())
                        .path(IssuePaths.nodeData(node.getId(), "interventions." + entry.getKey()))
                        .context("factorId", entry.getKey())
                        .context("value", entry.getValue())
                        .build());
            }
        }
    }

    private static void checkEdgeField(int edgeIndex, String field, Double value, List<ValidationIssue> issues) {
        if (isNonFinite(value)) {
            issues.add(ValidationIssue.error(IssueCode.NAN_VALUE, "Edge has invalid " + field + ": " + value)
                    .path(IssuePaths.edge(edgeIndex))
                    .context("field", field)
                    .context("value", value)
                    .build());
        }
    }

    static boolean isNonFinite(Double value) {
        return value != null && !Double.isFinite(value);
    }
}

package com.cee.validation.tier;

import com.cee.graph.model.Graph;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.validation.GraphLimits;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.index.GraphIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tier 1: node-kind cardinalities, size ceilings and referential integrity of edge endpoints.
 */
public final class StructuralTier implements ValidationTier {

    private final GraphLimits limits;

    public StructuralTier(GraphLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    @Override
    public String name() {
        return "structural";
    }

    @Override
    public List<ValidationIssue> check(GraphAnalysis analysis) {
        GraphIndex index = analysis.index();
        Graph graph = analysis.graph();
        List<ValidationIssue> issues = new ArrayList<>();

        List<GraphNode> goals = index.nodesOf(NodeKind.GOAL);
        if (goals.isEmpty()) {
            issues.add(ValidationIssue.error(IssueCode.MISSING_GOAL, "Graph must have exactly 1 goal node")
                    .context("goalCount", 0)
                    .build());
        } else if (goals.size() > 1) {
            issues.add(ValidationIssue.error(IssueCode.MISSING_GOAL,
                            "Graph must have exactly 1 goal node, found " + goals.size())
                    .context("goalCount", goals.size())
                    .context("goalIds", ids(goals))
                    .build());
        }

        List<GraphNode> decisions = index.nodesOf(NodeKind.DECISION);
        if (decisions.isEmpty()) {
            issues.add(ValidationIssue.error(IssueCode.MISSING_DECISION, "Graph must have exactly 1 decision node")
                    .context("decisionCount", 0)
                    .build());
        } else if (decisions.size() > 1) {
            issues.add(ValidationIssue.error(IssueCode.MISSING_DECISION,
                            "Graph must have exactly 1 decision node, found " + decisions.size())
                    .context("decisionCount", decisions.size())
                    .context("decisionIds", ids(decisions))
                    .build());
        }

        int optionCount = index.nodesOf(NodeKind.OPTION).size();
        if (optionCount < limits.getMinOptions()) {
            issues.add(ValidationIssue.error(IssueCode.INSUFFICIENT_OPTIONS,
                            "Graph must have at least " + limits.getMinOptions() + " options, found " + optionCount)
                    .context("optionCount", optionCount)
                    .context("min", limits.getMinOptions())
                    .build());
        } else if (optionCount > limits.getMaxOptions()) {
            issues.add(ValidationIssue.error(IssueCode.INSUFFICIENT_OPTIONS,
                            "Graph must have at most " + limits.getMaxOptions() + " options, found " + optionCount)
                    .context("optionCount", optionCount)
                    .context("max", limits.getMaxOptions())
                    .build());
        }

        if (index.nodesOf(NodeKind.OUTCOME).isEmpty() && index.nodesOf(NodeKind.RISK).isEmpty()) {
            issues.add(ValidationIssue.error(IssueCode.MISSING_BRIDGE, "Graph must have at least 1 outcome or risk node")
                    .context("outcomeCount", 0)
                    .context("riskCount", 0)
                    .build());
        }

        int nodeCount = graph.getNodes().size();
        if (nodeCount > limits.getNodeLimit()) {
            issues.add(ValidationIssue.error(IssueCode.NODE_LIMIT_EXCEEDED,
                            "Graph exceeds node limit of " + limits.getNodeLimit() + ", found " + nodeCount)
                    .context("nodeCount", nodeCount)
                    .context("limit", limits.getNodeLimit())
                    .build());
        }

        int edgeCount = graph.getEdges().size();
        if (edgeCount > limits.getEdgeLimit()) {
            issues.add(ValidationIssue.error(IssueCode.EDGE_LIMIT_EXCEEDED,
                            "Graph exceeds edge limit of " + limits.getEdgeLimit() + ", found " + edgeCount)
                    .context("edgeCount", edgeCount)
                    .context("limit", limits.getEdgeLimit())
                    .build());
        }

        List<GraphEdge> edges = graph.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            if (!index.contains(edge.getFrom())) {
                issues.add(danglingEndpoint(i, "from", edge.getFrom()));
            }
            if (!index.contains(edge.getTo())) {
                issues.add(danglingEndpoint(i, "to", edge.getTo()));
            }
        }
        return issues;
    }

    private static ValidationIssue danglingEndpoint(int edgeIndex, String field, String nodeId) {
        return ValidationIssue.error(IssueCode.INVALID_EDGE_REF, "Edge references non-existent node: " + nodeId)
                .path(IssuePaths.edge(edgeIndex))
                .context("field", field)
                .context("nodeId", nodeId)
                .build();
    }

    private static List<String> ids(List<GraphNode> nodes) {
        return nodes.stream().map(GraphNode::getId).toList();
    }
}

package com.cee.validation.tier;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.FactorCategoryInfo;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.index.GraphIndex;
import com.cee.validation.index.Reachability;

import java.util.ArrayList;
import java.util.List;

/**
 * Tier 2: goal is a sink, decision is a source, every edge type is in {@link AllowedEdgeMatrix},
 * and the graph is acyclic.
 */
public final class TopologyTier implements ValidationTier {

    @Override
    public String name() {
        return "topology";
    }

    @Override
    public List<ValidationIssue> check(GraphAnalysis analysis) {
        GraphIndex index = analysis.index();
        List<ValidationIssue> issues = new ArrayList<>();

        for (GraphNode goal : index.nodesOf(NodeKind.GOAL)) {
            List<String> outgoing = index.successors(goal.getId());
            if (!outgoing.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCode.GOAL_HAS_OUTGOING,
                                "Goal node \"" + goal.getId() + "\" must not have outgoing edges")
                        .path(IssuePaths.node(goal.getId()))
                        .context("outgoingTo", List.copyOf(outgoing))
                        .build());
            }
        }

        for (GraphNode decision : index.nodesOf(NodeKind.DECISION)) {
            List<String> incoming = index.predecessors(decision.getId());
            if (!incoming.isEmpty()) {
                issues.add(ValidationIssue.error(IssueCode.DECISION_HAS_INCOMING,
                                "Decision node \"" + decision.getId() + "\" must not have incoming edges")
                        .path(IssuePaths.node(decision.getId()))
                        .context("incomingFrom", List.copyOf(incoming))
                        .build());
            }
        }

        List<GraphEdge> edges = analysis.graph().getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            GraphNode from = index.node(edge.getFrom());
            GraphNode to = index.node(edge.getTo());
            // dangling endpoints are the structural tier's concern
            if (from == null || to == null) continue;

            FactorCategory fromCategory = categoryOf(analysis, edge.getFrom());
            FactorCategory toCategory = categoryOf(analysis, edge.getTo());
            if (!AllowedEdgeMatrix.isAllowed(from.kind(), to.kind(), toCategory)) {
                issues.add(ValidationIssue.error(IssueCode.INVALID_EDGE_TYPE,
                                "Invalid edge from " + from.getKind() + " to " + to.getKind())
                        .path(IssuePaths.edge(i))
                        .context("fromKind", from.getKind())
                        .context("toKind", to.getKind())
                        .context("fromId", edge.getFrom())
                        .context("toId", edge.getTo())
                        .context("fromFactorCategory", fromCategory != null ? fromCategory.toValue() : null)
                        .context("toFactorCategory", toCategory != null ? toCategory.toValue() : null)
                        .build());
            }
        }

        if (Reachability.hasCycle(index)) {
            issues.add(ValidationIssue.error(IssueCode.CYCLE_DETECTED, "Graph contains a cycle; must be a DAG").build());
        }
        return issues;
    }

    private static FactorCategory categoryOf(GraphAnalysis analysis, String nodeId) {
        FactorCategoryInfo info = analysis.category(nodeId);
        return info != null ? info.category() : null;
    }
}

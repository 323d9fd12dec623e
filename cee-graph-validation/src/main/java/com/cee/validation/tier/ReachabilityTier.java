package com.cee.validation.tier;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.index.GraphIndex;
import com.cee.validation.index.Reachability;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tier 3: every node other than the decision and goal is reachable from the decision, and every node
 * other than the decision can reach the goal. Runs only when a decision and a goal exist; the first of each is used.
 * <p>
 * Unreachable nodes that can still reach the goal are exempt in two cases: observable or external factors
 * (exogenous roots, no issue) and outcome/risk nodes (an info issue with reason {@code exogenous} when the node
 * has parents, {@code isolated} otherwise). Failing to reach the goal is never exempt.
 */
public final class ReachabilityTier implements ValidationTier {

    public static final String REASON_EXOGENOUS = "exogenous";
    public static final String REASON_ISOLATED = "isolated";

    @Override
    public String name() {
        return "reachability";
    }

    @Override
    public List<ValidationIssue> check(GraphAnalysis analysis) {
        GraphIndex index = analysis.index();
        List<ValidationIssue> issues = new ArrayList<>();
        GraphNode decision = index.first(NodeKind.DECISION);
        GraphNode goal = index.first(NodeKind.GOAL);
        if (decision == null || goal == null) {
            return issues;
        }

        Set<String> reachable = Reachability.forward(index, decision.getId());
        Set<String> canReachGoal = Reachability.reverse(index, goal.getId());

        for (GraphNode node : analysis.graph().getNodes()) {
            if (reachable.contains(node.getId())) continue;
            boolean reachesGoal = canReachGoal.contains(node.getId());
            switch (node.kind()) {
                case DECISION, GOAL -> {
                }
                case FACTOR -> {
                    boolean exogenous = analysis.isFactorOf(node.getId(), FactorCategory.OBSERVABLE)
                            || analysis.isFactorOf(node.getId(), FactorCategory.EXTERNAL);
                    if (!(exogenous && reachesGoal)) {
                        issues.add(unreachable(node));
                    }
                }
                case OUTCOME, RISK -> {
                    if (reachesGoal) {
                        issues.add(exemptOutcomeOrRisk(index, node));
                    } else {
                        issues.add(unreachable(node));
                    }
                }
                case OPTION, ACTION, UNKNOWN -> issues.add(unreachable(node));
            }
        }

        for (GraphNode node : analysis.graph().getNodes()) {
            if (node.kind() == NodeKind.DECISION) continue;
            if (!canReachGoal.contains(node.getId())) {
                issues.add(ValidationIssue.error(IssueCode.NO_PATH_TO_GOAL,
                                "Node \"" + node.getId() + "\" has no path to goal")
                        .path(IssuePaths.node(node.getId()))
                        .context("kind", node.getKind())
                        .build());
            }
        }
        return issues;
    }

    private static ValidationIssue unreachable(GraphNode node) {
        return ValidationIssue.error(IssueCode.UNREACHABLE_FROM_DECISION,
                        "Node \"" + node.getId() + "\" is not reachable from decision")
                .path(IssuePaths.node(node.getId()))
                .context("kind", node.getKind())
                .build();
    }

    private static ValidationIssue exemptOutcomeOrRisk(GraphIndex index, GraphNode node) {
        String reason = index.predecessors(node.getId()).isEmpty() ? REASON_ISOLATED : REASON_EXOGENOUS;
        String name = node.getLabel() != null ? node.getLabel() : node.getId();
        return ValidationIssue.info(IssueCode.EXEMPT_UNREACHABLE_OUTCOME_RISK,
                        "Outcome/risk \"" + name + "\" has no controllable path from decision; decision influence is limited")
                .path(IssuePaths.node(node.getId()))
                .context("kind", node.getKind())
                .context("nodeId", node.getId())
                .context("reason", reason)
                .build();
    }
}

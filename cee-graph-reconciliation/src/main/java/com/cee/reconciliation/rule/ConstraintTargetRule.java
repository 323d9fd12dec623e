package com.cee.reconciliation.rule;

import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.GraphNode;
import com.cee.reconciliation.ConstraintNormalisationResult;
import com.cee.reconciliation.ConstraintTargetNormaliser;
import com.cee.reconciliation.MutationCode;
import com.cee.reconciliation.MutationSeverity;
import com.cee.reconciliation.StrpMutation;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalises goal-constraint targets against the graph's node ids and records each remap or drop.
 * Does nothing when no constraints were supplied. Constraints are replaced, never edited in place.
 */
public final class ConstraintTargetRule implements ReconciliationRule {

    public static final String NAME = "constraint_target";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<StrpMutation> apply(ReconciliationContext context) {
        List<GoalConstraint> constraints = context.options().getGoalConstraints();
        if (constraints == null || constraints.isEmpty()) {
            return List.of();
        }
        List<String> nodeIds = context.graph().getNodes().stream().map(GraphNode::getId).toList();
        ConstraintNormalisationResult result = ConstraintTargetNormaliser.normalise(constraints, nodeIds,
                context.options().getRequestId());
        context.recordConstraintResult(result);

        List<StrpMutation> mutations = new ArrayList<>();
        for (ValidationIssue issue : result.getIssues()) {
            String constraintId = (String) issue.getContext().get("constraint_id");
            Object original = issue.getContext().get("original_node_id");
            if (issue.getCode() == IssueCode.CONSTRAINT_NODE_REMAPPED) {
                mutations.add(StrpMutation.onConstraint(NAME, MutationCode.CONSTRAINT_REMAPPED, constraintId,
                        "node_id", original, issue.getContext().get("remapped_node_id"), issue.getMessage(),
                        MutationSeverity.INFO));
            } else if (issue.getCode() == IssueCode.CONSTRAINT_DROPPED_NO_TARGET) {
                mutations.add(StrpMutation.onConstraint(NAME, MutationCode.CONSTRAINT_DROPPED, constraintId,
                        "node_id", original, null, issue.getMessage(), MutationSeverity.INFO));
            }
        }
        return mutations;
    }
}

package com.cee.reconciliation;

import com.cee.graph.model.GoalConstraint;
import com.cee.validation.ValidationIssue;

import java.util.List;

/**
 * Outcome of constraint target normalisation: kept and remapped constraints in input order,
 * one info issue per remap or drop, and the counts {@code total = valid + remapped + dropped}.
 */
public final class ConstraintNormalisationResult {

    private final List<GoalConstraint> constraints;
    private final List<ValidationIssue> issues;
    private final int total;
    private final int valid;
    private final int remapped;
    private final int dropped;

    ConstraintNormalisationResult(List<GoalConstraint> constraints, List<ValidationIssue> issues,
                                  int valid, int remapped, int dropped) {
        this.constraints = List.copyOf(constraints);
        this.issues = List.copyOf(issues);
        this.valid = valid;
        this.remapped = remapped;
        this.dropped = dropped;
        this.total = valid + remapped + dropped;
    }

    static ConstraintNormalisationResult empty() {
        return new ConstraintNormalisationResult(List.of(), List.of(), 0, 0, 0);
    }

    public List<GoalConstraint> getConstraints() {
        return constraints;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public int getTotal() {
        return total;
    }

    public int getValid() {
        return valid;
    }

    public int getRemapped() {
        return remapped;
    }

    public int getDropped() {
        return dropped;
    }
}

package com.cee.reconciliation;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.GoalConstraint;

import java.util.List;

/**
 * Options for one reconciliation pass.
 * <ul>
 *   <li>{@code goalConstraints}: external constraints whose node ids are normalised; null when none</li>
 *   <li>{@code fillControllableData}: enables the late-pipeline data completeness rule</li>
 *   <li>{@code requestId}: correlation id for logs only</li>
 * </ul>
 * {@link Builder#build()} throws {@link GraphContractException} when the constraint list holds a null element.
 */
public final class ReconcileOptions {

    private static final ReconcileOptions DEFAULTS = builder().build();

    private final List<GoalConstraint> goalConstraints;
    private final boolean fillControllableData;
    private final String requestId;

    private ReconcileOptions(Builder b) {
        this.goalConstraints = b.goalConstraints != null ? copyConstraints(b.goalConstraints) : null;
        this.fillControllableData = b.fillControllableData;
        this.requestId = b.requestId;
    }

    private static List<GoalConstraint> copyConstraints(List<GoalConstraint> constraints) {
        for (int i = 0; i < constraints.size(); i++) {
            if (constraints.get(i) == null) {
                throw new GraphContractException("Goal constraints[" + i + "] is null");
            }
        }
        return List.copyOf(constraints);
    }

    public static ReconcileOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<GoalConstraint> getGoalConstraints() {
        return goalConstraints;
    }

    public boolean isFillControllableData() {
        return fillControllableData;
    }

    public String getRequestId() {
        return requestId;
    }

    public static final class Builder {
        private List<GoalConstraint> goalConstraints;
        private boolean fillControllableData;
        private String requestId;

        public Builder goalConstraints(List<GoalConstraint> goalConstraints) {
            this.goalConstraints = goalConstraints;
            return this;
        }

        public Builder fillControllableData(boolean fillControllableData) {
            this.fillControllableData = fillControllableData;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public ReconcileOptions build() {
            return new ReconcileOptions(this);
        }
    }
}

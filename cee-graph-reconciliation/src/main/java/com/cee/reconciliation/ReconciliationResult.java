package com.cee.reconciliation;

import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one reconciliation pass: the same graph instance, updated in place, plus the ordered
 * mutation log. {@code goalConstraints} is null when no constraints were supplied.
 */
@JsonPropertyOrder({"mutations", "goal_constraints"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReconciliationResult {

    private final Graph graph;
    private final List<StrpMutation> mutations;
    private final List<GoalConstraint> goalConstraints;
    private final ConstraintNormalisationResult constraintResult;
    private final List<String> ruleNames;

    ReconciliationResult(Graph graph, List<StrpMutation> mutations, List<GoalConstraint> goalConstraints,
                         ConstraintNormalisationResult constraintResult, List<String> ruleNames) {
        this.graph = graph;
        this.mutations = List.copyOf(mutations);
        this.goalConstraints = goalConstraints != null ? List.copyOf(goalConstraints) : null;
        this.constraintResult = constraintResult != null ? constraintResult : ConstraintNormalisationResult.empty();
        this.ruleNames = List.copyOf(ruleNames);
    }

    @JsonIgnore
    public Graph getGraph() {
        return graph;
    }

    @JsonProperty("mutations")
    public List<StrpMutation> getMutations() {
        return mutations;
    }

    @JsonProperty("goal_constraints")
    public List<GoalConstraint> getGoalConstraints() {
        return goalConstraints;
    }

    /** Mutations recorded by one rule, in application order. */
    public List<StrpMutation> mutationsOf(String rule) {
        return mutations.stream().filter(m -> m.getRule().equals(rule)).toList();
    }

    /**
     * Counts for the telemetry sink: {@code mutation_count}, one {@code rule.<name>} entry per rule
     * (zero when it did not fire) and the constraint counts.
     */
    public Map<String, Number> telemetryCounts() {
        Map<String, Number> counts = new LinkedHashMap<>();
        counts.put("mutation_count", mutations.size());
        for (String rule : ruleNames) {
            counts.put("rule." + rule, mutationsOf(rule).size());
        }
        counts.put("constraints_total", constraintResult.getTotal());
        counts.put("constraints_valid", constraintResult.getValid());
        counts.put("constraints_remapped", constraintResult.getRemapped());
        counts.put("constraints_dropped", constraintResult.getDropped());
        return Collections.unmodifiableMap(counts);
    }
}

package com.cee.reconciliation;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.cee.reconciliation.rule.CategoryOverrideRule;
import com.cee.reconciliation.rule.ConstraintTargetRule;
import com.cee.reconciliation.rule.ControllableDataCompletenessRule;
import com.cee.reconciliation.rule.EnumValidationRule;
import com.cee.reconciliation.rule.ReconciliationContext;
import com.cee.reconciliation.rule.ReconciliationRule;
import com.cee.reconciliation.rule.SignReconciliationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural truth reconciliation: corrects declared metadata that contradicts the structure of the graph.
 * Rules run in a fixed order:
 * <ol>
 *   <li>{@link CategoryOverrideRule}</li>
 *   <li>{@link EnumValidationRule}</li>
 *   <li>{@link ConstraintTargetRule} (only with goal constraints)</li>
 *   <li>{@link SignReconciliationRule}</li>
 *   <li>{@link ControllableDataCompletenessRule} (only with {@code fillControllableData})</li>
 * </ol>
 * The graph is updated in place through its {@link com.cee.graph.model.GraphFieldWriter}; no node or edge is
 * added or removed. Running the pass on its own output records no mutations.
 */
public final class StructuralReconciler {

    private static final Logger log = LoggerFactory.getLogger(StructuralReconciler.class);

    private final List<ReconciliationRule> rules = List.of(
            new CategoryOverrideRule(),
            new EnumValidationRule(),
            new ConstraintTargetRule(),
            new SignReconciliationRule(),
            new ControllableDataCompletenessRule());

    public ReconciliationResult reconcile(Graph graph) {
        return reconcile(graph, ReconcileOptions.defaults());
    }

    /**
     * @throws GraphContractException when {@code graph} or {@code options} is null
     */
    public ReconciliationResult reconcile(Graph graph, ReconcileOptions options) {
        GraphContractException.requireNonNull(graph, "Graph");
        GraphContractException.requireNonNull(options, "Reconcile options");
        ReconciliationContext context = new ReconciliationContext(graph, options);

        List<StrpMutation> mutations = new ArrayList<>();
        for (ReconciliationRule rule : rules) {
            mutations.addAll(rule.apply(context));
        }

        List<GoalConstraint> constraints = context.constraintResult() != null
                ? context.constraintResult().getConstraints()
                : options.getGoalConstraints();
        List<String> ruleNames = rules.stream().map(ReconciliationRule::name).toList();
        ReconciliationResult result = new ReconciliationResult(graph, mutations, constraints,
                context.constraintResult(), ruleNames);

        if (!mutations.isEmpty()) {
            Set<String> triggered = new LinkedHashSet<>();
            mutations.forEach(m -> triggered.add(m.getRule()));
            log.info("STRP mutations applied | requestId={} | mutations={} | rules={}",
                    options.getRequestId(), mutations.size(), triggered);
        } else {
            log.debug("STRP no mutations | requestId={}", options.getRequestId());
        }
        return result;
    }
}

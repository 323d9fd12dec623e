package com.cee.reconciliation.rule;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.FactorData;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.reconciliation.MutationCode;
import com.cee.reconciliation.MutationSeverity;
import com.cee.reconciliation.StrpMutation;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills {@code factor_type} and {@code uncertainty_drivers} on every controllable factor still missing them.
 * Runs only when {@link com.cee.reconciliation.ReconcileOptions#isFillControllableData()} is set, i.e. in the
 * late pass after enrichment and repair have stopped writing factor data.
 */
public final class ControllableDataCompletenessRule implements ReconciliationRule {

    public static final String NAME = "controllable_data_completeness";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<StrpMutation> apply(ReconciliationContext context) {
        if (!context.options().isFillControllableData()) {
            return List.of();
        }
        List<StrpMutation> mutations = new ArrayList<>();
        for (GraphNode node : context.analysis().index().nodesOf(NodeKind.FACTOR)) {
            if (!context.analysis().isFactorOf(node.getId(), FactorCategory.CONTROLLABLE)) continue;
            FactorData data = node.factorData();

            String factorType = data != null ? data.getFactorType() : null;
            if (ControllableDefaults.isBlank(factorType)) {
                context.writer().setFactorType(node, ControllableDefaults.FACTOR_TYPE);
                mutations.add(StrpMutation.onNode(NAME, MutationCode.CONTROLLABLE_DATA_FILLED, node.getId(),
                        "data.factor_type", factorType, ControllableDefaults.FACTOR_TYPE.toValue(),
                        "Controllable factor missing required factor_type; filled with default",
                        MutationSeverity.INFO));
            }
            if (data == null || data.getUncertaintyDrivers() == null) {
                context.writer().setUncertaintyDrivers(node, ControllableDefaults.UNCERTAINTY_DRIVERS);
                mutations.add(StrpMutation.onNode(NAME, MutationCode.CONTROLLABLE_DATA_FILLED, node.getId(),
                        "data.uncertainty_drivers", null, ControllableDefaults.UNCERTAINTY_DRIVERS,
                        "Controllable factor missing required uncertainty_drivers; filled with default",
                        MutationSeverity.INFO));
            }
        }
        return mutations;
    }
}

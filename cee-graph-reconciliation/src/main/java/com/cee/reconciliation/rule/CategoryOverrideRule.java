package com.cee.reconciliation.rule;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.FactorData;
import com.cee.graph.model.GraphFieldWriter;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.reconciliation.MutationCode;
import com.cee.reconciliation.MutationSeverity;
import com.cee.reconciliation.StrpMutation;
import com.cee.validation.index.FactorCategoryInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces a declared factor category that disagrees with the inferred one. A factor that becomes
 * controllable gets default {@code factor_type} and {@code uncertainty_drivers} where missing; any other
 * factor loses both fields. One mutation for the category and one per data field touched.
 */
public final class CategoryOverrideRule implements ReconciliationRule {

    public static final String NAME = "category_override";

    private static final Logger log = LoggerFactory.getLogger(CategoryOverrideRule.class);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<StrpMutation> apply(ReconciliationContext context) {
        List<StrpMutation> mutations = new ArrayList<>();
        GraphFieldWriter writer = context.writer();

        for (GraphNode node : context.analysis().index().nodesOf(NodeKind.FACTOR)) {
            FactorCategoryInfo info = context.analysis().category(node.getId());
            if (info == null) continue;
            String declared = node.getCategory();
            FactorCategory inferred = info.category();
            if (declared == null || declared.isEmpty() || declared.equals(inferred.toValue())) continue;

            String reason = "Structural inference: " + info.basis();
            writer.setFactorCategory(node, inferred);
            mutations.add(mutation(node, "category", declared, inferred.toValue(), reason));
            log.info("Category override | nodeId={} | declared={} | inferred={}", node.getId(), declared,
                    inferred.toValue());

            FactorData data = node.factorData();
            String factorType = data != null ? data.getFactorType() : null;
            List<String> drivers = data != null ? data.getUncertaintyDrivers() : null;
            if (inferred == FactorCategory.CONTROLLABLE) {
                if (ControllableDefaults.isBlank(factorType)) {
                    writer.setFactorType(node, ControllableDefaults.FACTOR_TYPE);
                    mutations.add(mutation(node, "data.factor_type", factorType,
                            ControllableDefaults.FACTOR_TYPE.toValue(), reason));
                }
                if (drivers == null) {
                    writer.setUncertaintyDrivers(node, ControllableDefaults.UNCERTAINTY_DRIVERS);
                    mutations.add(mutation(node, "data.uncertainty_drivers", null,
                            ControllableDefaults.UNCERTAINTY_DRIVERS, reason));
                }
            } else {
                if (factorType != null) {
                    writer.setFactorType(node, null);
                    mutations.add(mutation(node, "data.factor_type", factorType, null, reason));
                }
                if (drivers != null) {
                    writer.setUncertaintyDrivers(node, null);
                    mutations.add(mutation(node, "data.uncertainty_drivers", drivers, null, reason));
                }
            }
        }
        return mutations;
    }

    private static StrpMutation mutation(GraphNode node, String field, Object before, Object after, String reason) {
        return StrpMutation.onNode(NAME, MutationCode.CATEGORY_OVERRIDE, node.getId(), field, before, after,
                reason, MutationSeverity.INFO);
    }
}

package com.cee.reconciliation.rule;

import com.cee.graph.model.EffectDirection;
import com.cee.graph.model.ExtractionType;
import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.FactorData;
import com.cee.graph.model.FactorType;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphFieldWriter;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.reconciliation.MutationCode;
import com.cee.reconciliation.MutationSeverity;
import com.cee.reconciliation.StrpMutation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resets enum-valued fields outside their valid set: {@code factor_type} to {@code other},
 * {@code extractionType} to {@code inferred}, {@code effect_direction} to {@code positive}.
 * An invalid factor category is removed so inference decides it.
 */
public final class EnumValidationRule implements ReconciliationRule {

    public static final String NAME = "enum_validation";

    static final FactorType FACTOR_TYPE_DEFAULT = FactorType.OTHER;
    static final ExtractionType EXTRACTION_TYPE_DEFAULT = ExtractionType.INFERRED;
    static final EffectDirection EFFECT_DIRECTION_DEFAULT = EffectDirection.POSITIVE;

    private static final String VALID_FACTOR_TYPES = validValues(FactorType.values(), FactorType::toValue);
    private static final String VALID_EXTRACTION_TYPES =
            validValues(ExtractionType.values(), ExtractionType::toValue);
    private static final String VALID_CATEGORIES = validValues(FactorCategory.values(), FactorCategory::toValue);
    private static final String VALID_DIRECTIONS = validValues(EffectDirection.values(), EffectDirection::toValue);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<StrpMutation> apply(ReconciliationContext context) {
        List<StrpMutation> mutations = new ArrayList<>();
        GraphFieldWriter writer = context.writer();

        for (GraphNode node : context.graph().getNodes()) {
            if (node.kind() != NodeKind.FACTOR) continue;
            FactorData data = node.factorData();
            if (data != null) {
                String factorType = data.getFactorType();
                if (factorType != null && !FactorType.isValid(factorType)) {
                    writer.setFactorType(node, FACTOR_TYPE_DEFAULT);
                    mutations.add(onNode(node, "data.factor_type", factorType, FACTOR_TYPE_DEFAULT.toValue(),
                            "Invalid factor_type \"" + factorType + "\"; valid: " + VALID_FACTOR_TYPES));
                }
                String extractionType = data.getExtractionType();
                if (extractionType != null && !ExtractionType.isValid(extractionType)) {
                    writer.setExtractionType(node, EXTRACTION_TYPE_DEFAULT);
                    mutations.add(onNode(node, "data.extractionType", extractionType,
                            EXTRACTION_TYPE_DEFAULT.toValue(),
                            "Invalid extractionType \"" + extractionType + "\"; valid: " + VALID_EXTRACTION_TYPES));
                }
            }
            String category = node.getCategory();
            if (category != null && !FactorCategory.isValid(category)) {
                writer.setFactorCategory(node, null);
                mutations.add(onNode(node, "category", category, null,
                        "Invalid category \"" + category + "\"; valid: " + VALID_CATEGORIES
                                + "; stripped for structural inference"));
            }
        }

        for (GraphEdge edge : context.graph().getEdges()) {
            String direction = edge.getEffectDirection();
            if (direction != null && !EffectDirection.isValid(direction)) {
                writer.setEffectDirection(edge, EFFECT_DIRECTION_DEFAULT);
                mutations.add(StrpMutation.onEdge(NAME, MutationCode.ENUM_VALUE_CORRECTED, edge.edgeId(),
                        "effect_direction", direction, EFFECT_DIRECTION_DEFAULT.toValue(),
                        "Invalid effect_direction \"" + direction + "\"; valid: " + VALID_DIRECTIONS,
                        MutationSeverity.WARN));
            }
        }
        return mutations;
    }

    private static StrpMutation onNode(GraphNode node, String field, Object before, Object after, String reason) {
        return StrpMutation.onNode(NAME, MutationCode.ENUM_VALUE_CORRECTED, node.getId(), field, before, after,
                reason, MutationSeverity.WARN);
    }

    private static <E> String validValues(E[] values, Function<E, String> toValue) {
        return Arrays.stream(values).map(toValue).collect(Collectors.joining(", "));
    }
}

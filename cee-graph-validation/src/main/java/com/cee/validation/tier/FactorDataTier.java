package com.cee.validation.tier;

import com.cee.graph.model.FactorData;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.FactorCategoryInfo;
import com.cee.validation.index.GraphAnalysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Tier 4: each factor carries exactly the data its inferred category calls for, and any declared
 * category agrees with the inferred one.
 * <ul>
 *   <li>controllable: value, extractionType, factor_type and uncertainty_drivers required</li>
 *   <li>observable: value and extractionType required; factor_type and uncertainty_drivers forbidden</li>
 *   <li>external: value, factor_type and uncertainty_drivers forbidden</li>
 * </ul>
 * Empty strings count as missing for extractionType and factor_type; an empty drivers list is present.
 */
public final class FactorDataTier implements ValidationTier {

    @Override
    public String name() {
        return "factor_data";
    }

    @Override
    public List<ValidationIssue> check(GraphAnalysis analysis) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (GraphNode factor : analysis.index().nodesOf(NodeKind.FACTOR)) {
            FactorCategoryInfo info = analysis.category(factor.getId());
            if (info == null) continue;
            FactorData data = factor.factorData();
            String id = factor.getId();

            switch (info.category()) {
                case CONTROLLABLE -> {
                    List<String> missing = new ArrayList<>();
                    if (!hasValue(data)) missing.add("value");
                    if (!hasExtractionType(data)) missing.add("extractionType");
                    if (!hasFactorType(data)) missing.add("factor_type");
                    if (!hasDrivers(data)) missing.add("uncertainty_drivers");
                    if (!missing.isEmpty()) {
                        issues.add(missing(IssueCode.CONTROLLABLE_MISSING_DATA, "Controllable", id, missing));
                    }
                }
                case OBSERVABLE -> {
                    List<String> missing = new ArrayList<>();
                    if (!hasValue(data)) missing.add("value");
                    if (!hasExtractionType(data)) missing.add("extractionType");
                    if (!missing.isEmpty()) {
                        issues.add(missing(IssueCode.OBSERVABLE_MISSING_DATA, "Observable", id, missing));
                    }
                    List<String> extra = new ArrayList<>();
                    if (hasFactorType(data)) extra.add("factor_type");
                    if (hasDrivers(data)) extra.add("uncertainty_drivers");
                    if (!extra.isEmpty()) {
                        issues.add(extra(IssueCode.OBSERVABLE_EXTRA_DATA, "Observable", id, extra));
                    }
                }
                case EXTERNAL -> {
                    List<String> extra = new ArrayList<>();
                    if (hasValue(data)) extra.add("value");
                    if (hasFactorType(data)) extra.add("factor_type");
                    if (hasDrivers(data)) extra.add("uncertainty_drivers");
                    if (!extra.isEmpty()) {
                        issues.add(extra(IssueCode.EXTERNAL_HAS_DATA, "External", id, extra));
                    }
                }
            }

            if (info.isMismatched()) {
                issues.add(ValidationIssue.error(IssueCode.CATEGORY_MISMATCH,
                                "Factor \"" + id + "\" declares category \"" + info.explicitCategory()
                                        + "\" but structure indicates \"" + info.category().toValue() + "\"")
                        .path(IssuePaths.node(id))
                        .context("explicit", info.explicitCategory())
                        .context("inferred", info.category().toValue())
                        .build());
            }
        }
        return issues;
    }

    private static ValidationIssue missing(IssueCode code, String label, String id, List<String> fields) {
        return ValidationIssue.error(code,
                        label + " factor \"" + id + "\" missing required data: " + String.join(", ", fields))
                .path(IssuePaths.node(id))
                .context("missing", List.copyOf(fields))
                .build();
    }

    private static ValidationIssue extra(IssueCode code, String label, String id, List<String> fields) {
        return ValidationIssue.error(code,
                        label + " factor \"" + id + "\" should not have: " + String.join(", ", fields))
                .path(IssuePaths.node(id))
                .context("extra", List.copyOf(fields))
                .build();
    }

    private static boolean hasValue(FactorData data) {
        return data != null && data.hasValue();
    }

    private static boolean hasExtractionType(FactorData data) {
        return data != null && data.getExtractionType() != null && !data.getExtractionType().isEmpty();
    }

    private static boolean hasFactorType(FactorData data) {
        return data != null && data.getFactorType() != null && !data.getFactorType().isEmpty();
    }

    private static boolean hasDrivers(FactorData data) {
        return data != null && data.getUncertaintyDrivers() != null;
    }
}

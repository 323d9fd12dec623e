package com.cee.validation.tier;

import com.cee.graph.model.FactorCategory;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.graph.model.OptionData;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.FactorCategoryInfo;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.index.GraphIndex;
import com.cee.validation.index.Reachability;
import com.cee.validation.label.GoalNumberLabelDetector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tier 5: options have an effect path and distinct interventions, interventions point at factors,
 * factor labels are causes rather than goal targets, and option→factor edges are strictly canonical.
 * The effect-path check needs a goal and is skipped without one; the other checks always run.
 */
public final class SemanticTier implements ValidationTier {

    private final GoalNumberLabelDetector labelDetector;

    public SemanticTier(GoalNumberLabelDetector labelDetector) {
        this.labelDetector = Objects.requireNonNull(labelDetector, "labelDetector");
    }

    @Override
    public String name() {
        return "semantic";
    }

    @Override
    public List<ValidationIssue> check(GraphAnalysis analysis) {
        List<ValidationIssue> issues = new ArrayList<>();
        checkEffectPaths(analysis, issues);
        checkIdenticalOptions(analysis, issues);
        checkInterventionRefs(analysis, issues);
        checkGoalNumberLabels(analysis, issues);
        checkCanonicalOptionEdges(analysis, issues);
        return issues;
    }

    private static void checkEffectPaths(GraphAnalysis analysis, List<ValidationIssue> issues) {
        GraphIndex index = analysis.index();
        GraphNode goal = index.first(NodeKind.GOAL);
        if (goal == null) return;
        Set<String> canReachGoal = Reachability.reverse(index, goal.getId());

        for (GraphNode option : index.nodesOf(NodeKind.OPTION)) {
            List<String> targets = index.successors(option.getId());
            boolean hasEffect = targets.stream().anyMatch(target ->
                    analysis.isFactorOf(target, FactorCategory.CONTROLLABLE) && canReachGoal.contains(target));
            if (!hasEffect) {
                issues.add(ValidationIssue.error(IssueCode.NO_EFFECT_PATH,
                                "Option \"" + option.getId() + "\" has no controllable factors with path to goal")
                        .path(IssuePaths.node(option.getId()))
                        .context("targets", List.copyOf(targets))
                        .build());
            }
        }
    }

    private static void checkIdenticalOptions(GraphAnalysis analysis, List<ValidationIssue> issues) {
        Map<String, List<String>> bySignature = new LinkedHashMap<>();
        for (GraphNode option : analysis.index().nodesOf(NodeKind.OPTION)) {
            OptionData data = option.optionData();
            if (data == null || data.getInterventions() == null) continue;
            String signature = InterventionSignature.of(data.getInterventions());
            bySignature.computeIfAbsent(signature, k -> new ArrayList<>()).add(option.getId());
        }
        bySignature.forEach((signature, optionIds) -> {
            if (optionIds.size() > 1) {
                issues.add(ValidationIssue.error(IssueCode.OPTIONS_IDENTICAL,
                                "Options have identical intervention signatures: " + String.join(", ", optionIds))
                        .context("optionIds", List.copyOf(optionIds))
                        .context("signature", signature)
                        .build());
            }
        });
    }

    private static void checkInterventionRefs(GraphAnalysis analysis, List<ValidationIssue> issues) {
        GraphIndex index = analysis.index();
        for (GraphNode option : index.nodesOf(NodeKind.OPTION)) {
            OptionData data = option.optionData();
            if (data == null || data.getInterventions() == null) continue;
            String path = IssuePaths.nodeData(option.getId(), "interventions");
            for (String factorId : data.getInterventions().keySet()) {
                GraphNode target = index.node(factorId);
                if (target == null) {
                    issues.add(ValidationIssue.error(IssueCode.INVALID_INTERVENTION_REF,
                                    "Option \"" + option.getId() + "\" references non-existent node: " + factorId)
                            .path(path)
                            .context("factorId", factorId)
                            .build());
                } else if (target.kind() != NodeKind.FACTOR) {
                    issues.add(ValidationIssue.error(IssueCode.INVALID_INTERVENTION_REF,
                                    "Option \"" + option.getId() + "\" intervention references non-factor node: "
                                            + factorId + " (kind: " + target.getKind() + ")")
                            .path(path)
                            .context("factorId", factorId)
                            .context("actualKind", target.getKind())
                            .build());
                }
            }
        }
    }

    private void checkGoalNumberLabels(GraphAnalysis analysis, List<ValidationIssue> issues) {
        for (GraphNode factor : analysis.index().nodesOf(NodeKind.FACTOR)) {
            String label = factor.getLabel() != null ? factor.getLabel() : factor.getId();
            if (!labelDetector.looksLikeGoalNumber(label)) continue;

            FactorCategoryInfo info = analysis.category(factor.getId());
            boolean hasOptionEdge = info != null && info.hasOptionEdge();
            boolean declaredControllable = FactorCategory.CONTROLLABLE.toValue().equals(factor.getCategory());
            if (hasOptionEdge || declaredControllable) continue;

            issues.add(ValidationIssue.error(IssueCode.GOAL_NUMBER_AS_FACTOR,
                            "Factor \"" + label + "\" appears to be a goal target value, not a causal factor")
                    .path(IssuePaths.node(factor.getId()))
                    .context("label", label)
                    .context("factorId", factor.getId())
                    .context("hasOptionEdge", hasOptionEdge)
                    .context("category", factor.getCategory())
                    .build());
        }
    }

    private static void checkCanonicalOptionEdges(GraphAnalysis analysis, List<ValidationIssue> issues) {
        GraphIndex index = analysis.index();
        List<GraphEdge> edges = analysis.graph().getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            if (index.kindOf(edge.getFrom()) != NodeKind.OPTION || index.kindOf(edge.getTo()) != NodeKind.FACTOR) {
                continue;
            }
            if (!CanonicalEdge.isStrict(edge)) {
                issues.add(ValidationIssue.error(IssueCode.STRUCTURAL_EDGE_NOT_CANONICAL_ERROR,
                                "Option→factor structural edge must have canonical values "
                                        + "(mean=1.0, std=0.01, prob=1.0, direction=\"positive\")")
                        .path(IssuePaths.edge(i))
                        .context("from", edge.getFrom())
                        .context("to", edge.getTo())
                        .context("expected", CanonicalEdge.expected(false))
                        .context("actual", CanonicalEdge.actual(edge))
                        .build());
            }
        }
    }
}

package com.cee.validation;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.Graph;
import com.cee.validation.index.GraphAnalysis;
import com.cee.validation.label.GoalNumberLabelDetector;
import com.cee.validation.label.RegexGoalNumberLabelDetector;
import com.cee.validation.tier.FactorDataTier;
import com.cee.validation.tier.NumericTier;
import com.cee.validation.tier.ReachabilityTier;
import com.cee.validation.tier.SemanticTier;
import com.cee.validation.tier.StructuralTier;
import com.cee.validation.tier.TopologyTier;
import com.cee.validation.tier.ValidationTier;
import com.cee.validation.tier.WarningCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates a decision graph through six tiers plus advisory warnings.
 * Every tier runs regardless of earlier findings so one call reports the full issue set.
 * Never mutates the graph. Stateless and safe to share across threads.
 */
public final class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    private final List<ValidationTier> tiers;
    private final WarningCollector warningCollector = new WarningCollector();

    public GraphValidator() {
        this(GraphLimits.DEFAULT, RegexGoalNumberLabelDetector.DEFAULT);
    }

    public GraphValidator(GraphLimits limits) {
        this(limits, RegexGoalNumberLabelDetector.DEFAULT);
    }

    public GraphValidator(GraphLimits limits, GoalNumberLabelDetector labelDetector) {
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(labelDetector, "labelDetector");
        this.tiers = List.of(
                new StructuralTier(limits),
                new TopologyTier(),
                new ReachabilityTier(),
                new FactorDataTier(),
                new SemanticTier(labelDetector),
                new NumericTier());
    }

    /**
     * Validates the graph. Errors are listed in tier order; warnings hold the advisory warnings
     * followed by info-level exemptions.
     *
     * @throws GraphContractException when {@code graph} is null
     */
    public GraphValidationResult validate(Graph graph) {
        GraphContractException.requireNonNull(graph, "Graph");
        log.debug("Graph validation started | nodes={} | edges={}", graph.getNodes().size(), graph.getEdges().size());

        GraphAnalysis analysis = GraphAnalysis.of(graph);
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> infos = new ArrayList<>();
        for (ValidationTier tier : tiers) {
            List<ValidationIssue> issues = tier.check(analysis);
            for (ValidationIssue issue : issues) {
                if (issue.isError()) {
                    errors.add(issue);
                } else {
                    infos.add(issue);
                }
            }
            log.debug("Tier complete | tier={} | issues={}", tier.name(), issues.size());
        }

        List<ValidationIssue> warnings = new ArrayList<>(warningCollector.collect(analysis));
        warnings.addAll(infos);

        List<String> exemptIds = new ArrayList<>();
        for (ValidationIssue info : infos) {
            if (info.getCode() == IssueCode.EXEMPT_UNREACHABLE_OUTCOME_RISK) {
                Object nodeId = info.getContext().get("nodeId");
                if (nodeId != null) exemptIds.add(nodeId.toString());
            }
        }
        ControllabilitySummary summary = ControllabilityAnalyzer.summarize(analysis, exemptIds);

        GraphValidationResult result = GraphValidationResult.of(errors, warnings, summary);
        log.info("Graph validation completed | valid={} | errors={} | warnings={}",
                result.isValid(), errors.size(), warnings.size());
        return result;
    }

    /**
     * Validates and throws {@link GraphRejectedException} when the graph has errors.
     */
    public GraphValidationResult validateOrThrow(Graph graph) {
        GraphValidationResult result = validate(graph);
        if (!result.isValid()) {
            throw new GraphRejectedException(result);
        }
        return result;
    }
}

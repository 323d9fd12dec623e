package com.cee.engine;

import com.cee.config.EngineConfig;
import com.cee.graph.GraphContractException;
import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.cee.reconciliation.ReconcileOptions;
import com.cee.reconciliation.ReconciliationResult;
import com.cee.reconciliation.StructuralReconciler;
import com.cee.telemetry.TelemetryEmitter;
import com.cee.validation.GraphLimits;
import com.cee.validation.GraphValidationResult;
import com.cee.validation.GraphValidator;
import com.cee.validation.PostNormalisationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs {@code reconcile -> repair -> validate} over one graph and reports counts to the telemetry sink.
 * <p>
 * Events emitted:
 * <ul>
 *   <li>{@code strp.complete} after reconciliation</li>
 *   <li>{@code graph_validator.complete} after validation</li>
 *   <li>{@code graph_validator.post_norm} from {@link #checkAfterClamping(Graph)}</li>
 * </ul>
 * Instances hold no per-graph state and may be shared across threads.
 */
public final class GraphCheckPipeline {

    public static final String EVENT_STRP_COMPLETE = "strp.complete";
    public static final String EVENT_VALIDATION_COMPLETE = "graph_validator.complete";
    public static final String EVENT_POST_NORM = "graph_validator.post_norm";

    private static final Logger log = LoggerFactory.getLogger(GraphCheckPipeline.class);

    private final StructuralReconciler reconciler;
    private final GraphRepairer repairer;
    private final GraphValidator validator;
    private final PostNormalisationValidator postNormalisationValidator;
    private final TelemetryEmitter telemetry;
    private final boolean fillControllableDataByDefault;

    public GraphCheckPipeline(GraphLimits limits, GraphRepairer repairer, TelemetryEmitter telemetry,
                              boolean fillControllableDataByDefault) {
        this.reconciler = new StructuralReconciler();
        this.repairer = repairer != null ? repairer : GraphRepairer.NONE;
        this.validator = new GraphValidator(limits != null ? limits : GraphLimits.DEFAULT);
        this.postNormalisationValidator = new PostNormalisationValidator();
        this.telemetry = telemetry != null ? telemetry : new TelemetryEmitter(null);
        this.fillControllableDataByDefault = fillControllableDataByDefault;
    }

    /** Pipeline configured from {@code config}, with no repair step. */
    public static GraphCheckPipeline fromConfig(EngineConfig config) {
        return fromConfig(config, GraphRepairer.NONE);
    }

    public static GraphCheckPipeline fromConfig(EngineConfig config, GraphRepairer repairer) {
        EngineConfig effective = config != null ? config : EngineConfig.defaults();
        return new GraphCheckPipeline(GraphLimits.from(effective), repairer,
                TelemetryEmitter.fromConfig(effective), effective.isFillControllableData());
    }

    /** Runs the pipeline with the configured defaults and no goal constraints. */
    public PipelineReport run(Graph graph) {
        return run(graph, defaultOptions(null));
    }

    /** Runs the pipeline with the configured defaults and the given goal constraints. */
    public PipelineReport run(Graph graph, List<GoalConstraint> goalConstraints) {
        return run(graph, defaultOptions(goalConstraints));
    }

    /**
     * @throws GraphContractException when {@code graph} or {@code options} is null, or the repair step
     *                                returns null
     */
    public PipelineReport run(Graph graph, ReconcileOptions options) {
        GraphContractException.requireNonNull(graph, "Graph");
        GraphContractException.requireNonNull(options, "Reconcile options");

        ReconciliationResult reconciliation = reconciler.reconcile(graph, options);
        telemetry.emit(EVENT_STRP_COMPLETE, reconciliation.telemetryCounts());

        Graph repaired = repairer.repair(reconciliation.getGraph());
        GraphContractException.requireNonNull(repaired, "Repaired graph");

        GraphValidationResult validation = validator.validate(repaired);
        telemetry.emit(EVENT_VALIDATION_COMPLETE, validation.telemetryCounts());

        log.debug("Graph check pipeline completed | requestId={} | mutations={} | valid={}",
                options.getRequestId(), reconciliation.getMutations().size(), validation.isValid());
        return new PipelineReport(repaired, reconciliation, validation, null);
    }

    /**
     * Sign agreement check for a graph whose edge strengths were clamped or rescaled after validation.
     */
    public GraphValidationResult checkAfterClamping(Graph graph) {
        GraphValidationResult result = postNormalisationValidator.validate(graph);
        telemetry.emit(EVENT_POST_NORM, result.telemetryCounts());
        return result;
    }

    private ReconcileOptions defaultOptions(List<GoalConstraint> goalConstraints) {
        return ReconcileOptions.builder()
                .goalConstraints(goalConstraints)
                .fillControllableData(fillControllableDataByDefault)
                .build();
    }
}

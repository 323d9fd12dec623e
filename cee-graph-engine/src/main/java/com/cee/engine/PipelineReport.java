package com.cee.engine;

import com.cee.graph.model.Graph;
import com.cee.reconciliation.ReconciliationResult;
import com.cee.validation.GraphValidationResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of one pipeline run: the graph as validated, the reconciliation log and the validation result.
 * {@code post_normalisation} is present only when the post-normalisation check was requested.
 */
@JsonPropertyOrder({"valid", "graph", "reconciliation", "validation", "post_normalisation"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PipelineReport {

    private final Graph graph;
    private final ReconciliationResult reconciliation;
    private final GraphValidationResult validation;
    private final GraphValidationResult postNormalisation;

    PipelineReport(Graph graph, ReconciliationResult reconciliation, GraphValidationResult validation,
                   GraphValidationResult postNormalisation) {
        this.graph = graph;
        this.reconciliation = reconciliation;
        this.validation = validation;
        this.postNormalisation = postNormalisation;
    }

    /** Copy of this report with the post-normalisation result attached. */
    public PipelineReport withPostNormalisation(GraphValidationResult result) {
        return new PipelineReport(graph, reconciliation, validation, result);
    }

    /** True when validation passed and, if it ran, the post-normalisation check passed too. */
    @JsonProperty("valid")
    public boolean isValid() {
        return validation.isValid() && (postNormalisation == null || postNormalisation.isValid());
    }

    @JsonProperty("graph")
    public Graph getGraph() {
        return graph;
    }

    @JsonProperty("reconciliation")
    public ReconciliationResult getReconciliation() {
        return reconciliation;
    }

    @JsonProperty("validation")
    public GraphValidationResult getValidation() {
        return validation;
    }

    @JsonProperty("post_normalisation")
    public GraphValidationResult getPostNormalisation() {
        return postNormalisation;
    }

    @JsonIgnore
    public int getMutationCount() {
        return reconciliation.getMutations().size();
    }
}

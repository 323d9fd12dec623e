package com.cee.reconciliation.rule;

import com.cee.graph.model.Graph;
import com.cee.graph.model.GraphFieldWriter;
import com.cee.reconciliation.ConstraintNormalisationResult;
import com.cee.reconciliation.ReconcileOptions;
import com.cee.validation.index.GraphAnalysis;

/**
 * State shared by the rules of one pass. Categories are inferred once, before any rule runs;
 * rules never change topology so the inference stays valid throughout.
 */
public final class ReconciliationContext {

    private final GraphAnalysis analysis;
    private final GraphFieldWriter writer;
    private final ReconcileOptions options;
    private ConstraintNormalisationResult constraintResult;

    public ReconciliationContext(Graph graph, ReconcileOptions options) {
        this.analysis = GraphAnalysis.of(graph);
        this.writer = graph.fieldWriter();
        this.options = options;
    }

    public Graph graph() {
        return analysis.graph();
    }

    public GraphAnalysis analysis() {
        return analysis;
    }

    public GraphFieldWriter writer() {
        return writer;
    }

    public ReconcileOptions options() {
        return options;
    }

    /** Result of constraint normalisation, or null when no constraints were normalised. */
    public ConstraintNormalisationResult constraintResult() {
        return constraintResult;
    }

    void recordConstraintResult(ConstraintNormalisationResult constraintResult) {
        this.constraintResult = constraintResult;
    }
}

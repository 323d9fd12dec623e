package com.cee.validation;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.Graph;
import com.cee.graph.model.GraphEdge;
import com.cee.validation.tier.IssuePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only check run after numeric clamping: reports {@link IssueCode#SIGN_MISMATCH} for every edge whose
 * direction contradicts the sign of its mean. The result carries errors only.
 */
public final class PostNormalisationValidator {

    private static final Logger log = LoggerFactory.getLogger(PostNormalisationValidator.class);

    public GraphValidationResult validate(Graph graph) {
        GraphContractException.requireNonNull(graph, "Graph");
        List<ValidationIssue> errors = new ArrayList<>();
        List<GraphEdge> edges = graph.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            if (SignAgreement.contradicts(edge)) {
                errors.add(ValidationIssue.error(IssueCode.SIGN_MISMATCH,
                                "Edge effect_direction \"" + edge.getEffectDirection()
                                        + "\" contradicts strength_mean sign (" + edge.getStrengthMean() + ")")
                        .path(IssuePaths.edge(i))
                        .context("effect_direction", edge.getEffectDirection())
                        .context("strength_mean", edge.getStrengthMean())
                        .build());
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Post-normalisation validation found issues | issueCount={}", errors.size());
        }
        return GraphValidationResult.postNormalisation(errors);
    }
}

package com.cee.validation;

import com.cee.graph.model.EffectDirection;
import com.cee.graph.model.GraphEdge;

/**
 * Whether an edge's declared direction disagrees with the sign of its {@code strength_mean}.
 * Edges without a valid direction or without a finite non-zero mean make no claim; {@code mixed} never disagrees.
 * Only the canonical mean is read, never the legacy {@code weight}.
 */
public final class SignAgreement {

    private SignAgreement() {
    }

    public static boolean contradicts(GraphEdge edge) {
        EffectDirection direction = edge.direction();
        Double mean = edge.getStrengthMean();
        return direction != null && mean != null && direction.contradicts(mean);
    }
}

package com.cee.reconciliation.rule;

import com.cee.graph.model.EffectDirection;
import com.cee.graph.model.GraphEdge;
import com.cee.reconciliation.MutationCode;
import com.cee.reconciliation.MutationSeverity;
import com.cee.reconciliation.StrpMutation;
import com.cee.validation.SignAgreement;

import java.util.ArrayList;
import java.util.List;

/**
 * Aligns {@code effect_direction} with the sign of {@code strength_mean} wherever they disagree.
 * The corrective counterpart of the post-normalisation sign check.
 */
public final class SignReconciliationRule implements ReconciliationRule {

    public static final String NAME = "sign_reconciliation";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<StrpMutation> apply(ReconciliationContext context) {
        List<StrpMutation> mutations = new ArrayList<>();
        for (GraphEdge edge : context.graph().getEdges()) {
            if (!SignAgreement.contradicts(edge)) continue;
            String before = edge.getEffectDirection();
            double mean = edge.getStrengthMean();
            EffectDirection after = EffectDirection.ofSign(mean);
            context.writer().setEffectDirection(edge, after);
            mutations.add(StrpMutation.onEdge(NAME, MutationCode.SIGN_CORRECTED, edge.edgeId(), "effect_direction",
                    before, after.toValue(),
                    "effect_direction \"" + before + "\" contradicts strength_mean sign (" + mean + ")",
                    MutationSeverity.WARN));
        }
        return mutations;
    }
}

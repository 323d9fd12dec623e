package com.cee.validation.label;

/**
 * Decides whether a factor label reads like a literal goal target ("£20k MRR") rather than a causal factor.
 * Heuristic by nature; implementations may be swapped without touching the semantic tier.
 */
@FunctionalInterface
public interface GoalNumberLabelDetector {

    boolean looksLikeGoalNumber(String label);
}

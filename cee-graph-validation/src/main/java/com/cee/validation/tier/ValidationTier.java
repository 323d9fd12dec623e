package com.cee.validation.tier;

import com.cee.validation.ValidationIssue;
import com.cee.validation.index.GraphAnalysis;

import java.util.List;

/**
 * One validation pass over a graph. Implementations are pure: they read the analysis,
 * never mutate the graph, and return their own issues. Every tier runs regardless of what earlier tiers found.
 */
public interface ValidationTier {

    /** Short name used in logs. */
    String name();

    List<ValidationIssue> check(GraphAnalysis analysis);
}

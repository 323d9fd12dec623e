package com.cee.validation.label;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Best-effort heuristic: these cases pin the curated phrasing, not a correctness guarantee
 * for arbitrary labels.
 */
class RegexGoalNumberLabelDetectorTest {

    private final GoalNumberLabelDetector detector = RegexGoalNumberLabelDetector.DEFAULT;

    @Test
    void looksLikeGoalNumber_targetPhrasing() {
        assertTrue(detector.looksLikeGoalNumber("£20k MRR"));
        assertTrue(detector.looksLikeGoalNumber("$50k"));
        assertTrue(detector.looksLikeGoalNumber("Goal of reaching £20k"));
        assertTrue(detector.looksLikeGoalNumber("Revenue target of 100k"));
        assertTrue(detector.looksLikeGoalNumber("100k ARR target"));
    }

    @Test
    void looksLikeGoalNumber_referencesToTargetAreExcluded() {
        assertFalse(detector.looksLikeGoalNumber("Share of £20k target"));
        assertFalse(detector.looksLikeGoalNumber("Progress toward £20k"));
        assertFalse(detector.looksLikeGoalNumber("Revenue (0-1, share of £20k target)"));
        assertFalse(detector.looksLikeGoalNumber("MRR relative to £20k goal"));
    }

    @Test
    void looksLikeGoalNumber_ordinaryFactorLabels() {
        assertFalse(detector.looksLikeGoalNumber("Price"));
        assertFalse(detector.looksLikeGoalNumber("Target 5 segments"));
        assertFalse(detector.looksLikeGoalNumber("Marketing spend per month"));
        assertFalse(detector.looksLikeGoalNumber(""));
        assertFalse(detector.looksLikeGoalNumber(null));
    }

    @Test
    void customPatterns_replaceTheDefaults() {
        GoalNumberLabelDetector custom = new RegexGoalNumberLabelDetector(
                List.of(Pattern.compile("^\\d+ users$")), List.of());

        assertTrue(custom.looksLikeGoalNumber("10000 users"));
        assertFalse(custom.looksLikeGoalNumber("£20k MRR"));
    }
}

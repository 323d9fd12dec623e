package com.cee.validation.label;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pattern-based {@link GoalNumberLabelDetector}. A label is a goal number when it matches one of the
 * target patterns and none of the reference exclusions ("share of £20k target" refers to a target, it is not one).
 * Patterns need a currency symbol or a financial keyword so generic labels such as "target customer segments" pass.
 */
public final class RegexGoalNumberLabelDetector implements GoalNumberLabelDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    static final List<Pattern> GOAL_NUMBER_PATTERNS = List.of(
            // "goal of reaching £20k", "goal of $1M"
            Pattern.compile("goal of (?:reaching |achieving )?[£$€]?[\\d,]+[kKmM]?", FLAGS),
            // "target of £100k"; currency required so "target 5 segments" passes
            Pattern.compile("target (?:of )?[£$€][\\d,]+[kKmM]?", FLAGS),
            Pattern.compile("(?:revenue|sales|MRR|ARR)\\s*target\\s*(?:of\\s*)?[\\d,]+[kKmM]?", FLAGS),
            Pattern.compile("target\\s*(?:of\\s*)?[\\d,]+[kKmM]?\\s*(?:revenue|sales|MRR|ARR)", FLAGS),
            // whole label is an amount: "£20k MRR", "$50k"
            Pattern.compile("^[£$€][\\d,]+[kKmM]?\\s*(?:MRR|ARR|revenue|sales)?$", FLAGS),
            Pattern.compile("^\\d+[kKmM]\\s*(?:MRR|ARR|revenue|sales|target|goal)", FLAGS),
            Pattern.compile("[£$€]\\d+[kKmM]?\\s*(?:revenue|sales)?\\s*target", FLAGS)
    );

    static final List<Pattern> REFERENCE_EXCLUSIONS = List.of(
            Pattern.compile("(?:share|fraction|portion|percentage|%)\\s+of\\s+[£$€]?[\\d,]+[kKmM]?\\s*(?:target|goal)?", FLAGS),
            Pattern.compile("progress\\s+(?:toward|towards|to)\\s+[£$€]?[\\d,]+[kKmM]?", FLAGS),
            // "(0-1, share of £20k target)"
            Pattern.compile("\\([\\d.]+[-–][\\d.]+,?\\s*(?:share|fraction|portion)\\s+of\\s+[£$€]?[\\d,]+[kKmM]?\\s*(?:target|goal)?\\)", FLAGS),
            Pattern.compile("(?:relative|compared)\\s+to\\s+[£$€]?[\\d,]+[kKmM]?\\s*(?:target|goal)?", FLAGS),
            Pattern.compile("as\\s+(?:%|percent|percentage|fraction|share)\\s+of\\s+[£$€]?[\\d,]+[kKmM]?", FLAGS)
    );

    public static final RegexGoalNumberLabelDetector DEFAULT =
            new RegexGoalNumberLabelDetector(GOAL_NUMBER_PATTERNS, REFERENCE_EXCLUSIONS);

    private final List<Pattern> patterns;
    private final List<Pattern> exclusions;

    public RegexGoalNumberLabelDetector(List<Pattern> patterns, List<Pattern> exclusions) {
        this.patterns = patterns != null ? List.copyOf(patterns) : List.of();
        this.exclusions = exclusions != null ? List.copyOf(exclusions) : List.of();
    }

    @Override
    public boolean looksLikeGoalNumber(String label) {
        if (label == null || label.isEmpty()) return false;
        for (Pattern exclusion : exclusions) {
            if (exclusion.matcher(label).find()) return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(label).find()) return true;
        }
        return false;
    }
}

package com.cee.validation;

/** Stable machine-readable codes of validation issues; repair steps key on these names. */
public enum IssueCode {
    // structural
    MISSING_GOAL,
    MISSING_DECISION,
    INSUFFICIENT_OPTIONS,
    MISSING_BRIDGE,
    NODE_LIMIT_EXCEEDED,
    EDGE_LIMIT_EXCEEDED,
    INVALID_EDGE_REF,
    // topology
    GOAL_HAS_OUTGOING,
    DECISION_HAS_INCOMING,
    INVALID_EDGE_TYPE,
    CYCLE_DETECTED,
    // reachability
    UNREACHABLE_FROM_DECISION,
    NO_PATH_TO_GOAL,
    EXEMPT_UNREACHABLE_OUTCOME_RISK,
    // factor data
    CONTROLLABLE_MISSING_DATA,
    OBSERVABLE_MISSING_DATA,
    OBSERVABLE_EXTRA_DATA,
    EXTERNAL_HAS_DATA,
    CATEGORY_MISMATCH,
    // semantic
    NO_EFFECT_PATH,
    OPTIONS_IDENTICAL,
    INVALID_INTERVENTION_REF,
    GOAL_NUMBER_AS_FACTOR,
    STRUCTURAL_EDGE_NOT_CANONICAL_ERROR,
    // numeric
    NAN_VALUE,
    // warnings
    STRENGTH_OUT_OF_RANGE,
    PROBABILITY_OUT_OF_RANGE,
    OUTCOME_NEGATIVE_POLARITY,
    RISK_POSITIVE_POLARITY,
    LOW_EDGE_CONFIDENCE,
    STRUCTURAL_EDGE_NOT_CANONICAL,
    LOW_STD_NON_STRUCTURAL,
    EMPTY_UNCERTAINTY_DRIVERS,
    // post-normalisation
    SIGN_MISMATCH,
    // constraint targets
    CONSTRAINT_NODE_REMAPPED,
    CONSTRAINT_DROPPED_NO_TARGET
}

package com.cee.reconciliation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Severity of a reconciliation mutation. Mutations never block acceptance. */
public enum MutationSeverity {
    INFO,
    WARN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

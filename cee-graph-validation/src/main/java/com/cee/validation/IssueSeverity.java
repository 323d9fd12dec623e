package com.cee.validation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Severity of a {@link ValidationIssue}. Only {@link #ERROR} blocks acceptance. */
public enum IssueSeverity {
    ERROR,
    WARN,
    /** Observability only; used for exemptions and audit entries. */
    INFO;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

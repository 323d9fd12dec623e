package com.cee.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One finding of a validation pass. {@code path} locates the element ({@code edges[3]},
 * {@code nodesById.fac_price.data.value}); {@code context} carries structured diagnostics
 * in insertion order. Null context values are dropped.
 */
@JsonPropertyOrder({"code", "severity", "message", "path", "context"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ValidationIssue {

    private final IssueCode code;
    private final IssueSeverity severity;
    private final String message;
    private final String path;
    private final Map<String, Object> context;

    private ValidationIssue(Builder b) {
        this.code = Objects.requireNonNull(b.code, "code");
        this.severity = Objects.requireNonNull(b.severity, "severity");
        this.message = Objects.requireNonNull(b.message, "message");
        this.path = b.path;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(b.context));
    }

    public static Builder error(IssueCode code, String message) {
        return new Builder(code, IssueSeverity.ERROR, message);
    }

    public static Builder warn(IssueCode code, String message) {
        return new Builder(code, IssueSeverity.WARN, message);
    }

    public static Builder info(IssueCode code, String message) {
        return new Builder(code, IssueSeverity.INFO, message);
    }

    @JsonProperty("code")
    public IssueCode getCode() {
        return code;
    }

    @JsonProperty("severity")
    public IssueSeverity getSeverity() {
        return severity;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("context")
    public Map<String, Object> getContext() {
        return context;
    }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    @Override
    public String toString() {
        return code + "(" + severity.toValue() + (path != null ? " @ " + path : "") + "): " + message;
    }

    public static final class Builder {
        private final IssueCode code;
        private final IssueSeverity severity;
        private final String message;
        private String path;
        private final Map<String, Object> context = new LinkedHashMap<>();

        private Builder(IssueCode code, IssueSeverity severity, String message) {
            this.code = code;
            this.severity = severity;
            this.message = message;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder context(String key, Object value) {
            if (value != null) {
                context.put(key, value);
            }
            return this;
        }

        public ValidationIssue build() {
            return new ValidationIssue(this);
        }
    }
}

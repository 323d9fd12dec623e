package com.cee.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Result of graph validation. {@code valid} is true iff there are no errors.
 * {@code warnings} holds warn- and info-level issues. The controllability summary is null for
 * post-normalisation results.
 */
@JsonPropertyOrder({"valid", "errors", "warnings", "controllability_summary"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphValidationResult {

    private final boolean valid;
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;
    private final ControllabilitySummary controllabilitySummary;

    private GraphValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings,
                                  ControllabilitySummary controllabilitySummary) {
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.valid = this.errors.isEmpty();
        this.controllabilitySummary = controllabilitySummary;
    }

    /** Full validation result. */
    public static GraphValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings,
                                           ControllabilitySummary controllabilitySummary) {
        return new GraphValidationResult(errors, warnings, controllabilitySummary);
    }

    /** Post-normalisation result: errors only, no warnings and no summary. */
    public static GraphValidationResult postNormalisation(List<ValidationIssue> errors) {
        return new GraphValidationResult(errors, List.of(), null);
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return valid;
    }

    @JsonProperty("errors")
    public List<ValidationIssue> getErrors() {
        return errors;
    }

    @JsonProperty("warnings")
    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    @JsonProperty("controllability_summary")
    public ControllabilitySummary getControllabilitySummary() {
        return controllabilitySummary;
    }

    /** Issues of any severity with the given code, errors first. */
    public List<ValidationIssue> issuesWithCode(IssueCode code) {
        return Stream.concat(errors.stream(), warnings.stream())
                .filter(i -> i.getCode() == code)
                .toList();
    }

    @JsonIgnore
    public int getWarnCount() {
        return (int) warnings.stream().filter(i -> i.getSeverity() == IssueSeverity.WARN).count();
    }

    @JsonIgnore
    public int getInfoCount() {
        return (int) warnings.stream().filter(i -> i.getSeverity() == IssueSeverity.INFO).count();
    }

    /**
     * Counts for the telemetry sink. Always {@code valid} (1/0) and {@code error_count}; full results add
     * {@code warning_count} (warn severity only), {@code info_count} and the controllability figures.
     */
    public Map<String, Number> telemetryCounts() {
        Map<String, Number> counts = new LinkedHashMap<>();
        counts.put("valid", valid ? 1 : 0);
        counts.put("error_count", errors.size());
        if (controllabilitySummary != null) {
            counts.put("warning_count", getWarnCount());
            counts.put("info_count", getInfoCount());
            counts.put("total_outcome_risk_nodes", controllabilitySummary.getTotalOutcomeRiskNodes());
            counts.put("with_controllable_ancestry", controllabilitySummary.getWithControllableAncestry());
            counts.put("without_controllable_ancestry", controllabilitySummary.getWithoutControllableAncestry());
            counts.put("exempt_count", controllabilitySummary.getExemptCount());
        }
        return Collections.unmodifiableMap(counts);
    }
}

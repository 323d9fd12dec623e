package com.cee.reconciliation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One field change made by the reconciliation pass. Exactly one of {@code node_id}, {@code edge_id}
 * and {@code constraint_id} identifies the target; {@code before}/{@code after} are null when the field
 * was absent before or removed after.
 */
@JsonPropertyOrder({"rule", "code", "node_id", "edge_id", "constraint_id", "field", "before", "after",
        "reason", "severity"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StrpMutation {

    private final String rule;
    private final MutationCode code;
    private final String nodeId;
    private final String edgeId;
    private final String constraintId;
    private final String field;
    private final Object before;
    private final Object after;
    private final String reason;
    private final MutationSeverity severity;

    private StrpMutation(String rule, MutationCode code, String nodeId, String edgeId, String constraintId,
                         String field, Object before, Object after, String reason, MutationSeverity severity) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.code = Objects.requireNonNull(code, "code");
        this.nodeId = nodeId;
        this.edgeId = edgeId;
        this.constraintId = constraintId;
        this.field = Objects.requireNonNull(field, "field");
        this.before = before;
        this.after = after;
        this.reason = Objects.requireNonNull(reason, "reason");
        this.severity = Objects.requireNonNull(severity, "severity");
    }

    public static StrpMutation onNode(String rule, MutationCode code, String nodeId, String field,
                                      Object before, Object after, String reason, MutationSeverity severity) {
        return new StrpMutation(rule, code, nodeId, null, null, field, before, after, reason, severity);
    }

    public static StrpMutation onEdge(String rule, MutationCode code, String edgeId, String field,
                                      Object before, Object after, String reason, MutationSeverity severity) {
        return new StrpMutation(rule, code, null, edgeId, null, field, before, after, reason, severity);
    }

    public static StrpMutation onConstraint(String rule, MutationCode code, String constraintId, String field,
                                            Object before, Object after, String reason,
                                            MutationSeverity severity) {
        return new StrpMutation(rule, code, null, null, constraintId, field, before, after, reason, severity);
    }

    @JsonProperty("rule")
    public String getRule() {
        return rule;
    }

    @JsonProperty("code")
    public MutationCode getCode() {
        return code;
    }

    @JsonProperty("node_id")
    public String getNodeId() {
        return nodeId;
    }

    @JsonProperty("edge_id")
    public String getEdgeId() {
        return edgeId;
    }

    @JsonProperty("constraint_id")
    public String getConstraintId() {
        return constraintId;
    }

    @JsonProperty("field")
    public String getField() {
        return field;
    }

    @JsonProperty("before")
    public Object getBefore() {
        return before;
    }

    @JsonProperty("after")
    public Object getAfter() {
        return after;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @JsonProperty("severity")
    public MutationSeverity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        String target = nodeId != null ? nodeId : edgeId != null ? edgeId : constraintId;
        return rule + ":" + code + "(" + target + "." + field + ": " + before + " -> " + after + ")";
    }
}

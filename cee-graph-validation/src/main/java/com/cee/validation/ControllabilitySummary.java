package com.cee.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * How many outcome and risk nodes have a controllable factor among their ancestors.
 * {@code total = with + without}; the exempt ids are the unreachable outcome/risk nodes
 * that reachability reported at info level instead of as errors.
 */
@JsonPropertyOrder({"total_outcome_risk_nodes", "with_controllable_ancestry", "without_controllable_ancestry",
        "exempt_count", "exempt_node_ids"})
public final class ControllabilitySummary {

    private final int totalOutcomeRiskNodes;
    private final int withControllableAncestry;
    private final int withoutControllableAncestry;
    private final List<String> exemptNodeIds;

    public ControllabilitySummary(int withControllableAncestry, int withoutControllableAncestry,
                                  List<String> exemptNodeIds) {
        this.withControllableAncestry = withControllableAncestry;
        this.withoutControllableAncestry = withoutControllableAncestry;
        this.totalOutcomeRiskNodes = withControllableAncestry + withoutControllableAncestry;
        this.exemptNodeIds = exemptNodeIds != null ? List.copyOf(exemptNodeIds) : List.of();
    }

    @JsonProperty("total_outcome_risk_nodes")
    public int getTotalOutcomeRiskNodes() {
        return totalOutcomeRiskNodes;
    }

    @JsonProperty("with_controllable_ancestry")
    public int getWithControllableAncestry() {
        return withControllableAncestry;
    }

    @JsonProperty("without_controllable_ancestry")
    public int getWithoutControllableAncestry() {
        return withoutControllableAncestry;
    }

    @JsonProperty("exempt_count")
    public int getExemptCount() {
        return exemptNodeIds.size();
    }

    @JsonProperty("exempt_node_ids")
    public List<String> getExemptNodeIds() {
        return exemptNodeIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControllabilitySummary that = (ControllabilitySummary) o;
        return withControllableAncestry == that.withControllableAncestry
                && withoutControllableAncestry == that.withoutControllableAncestry
                && exemptNodeIds.equals(that.exemptNodeIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(withControllableAncestry, withoutControllableAncestry, exemptNodeIds);
    }

    @Override
    public String toString() {
        return "ControllabilitySummary{total=" + totalOutcomeRiskNodes + ", with=" + withControllableAncestry
                + ", without=" + withoutControllableAncestry + ", exempt=" + exemptNodeIds + "}";
    }
}

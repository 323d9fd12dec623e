package com.cee.graph.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directed edge between two node ids. Endpoints are not required to exist in the graph.
 * Numeric fields are null when absent and may hold NaN or infinities as supplied.
 * {@code weight} and {@code belief} are legacy aliases of {@code strength_mean} and {@code belief_exists}.
 * Only {@code effect_direction} can change after construction, through {@link GraphFieldWriter}.
 */
@JsonPropertyOrder({"from", "to", "strength_mean", "strength_std", "belief_exists", "weight", "belief", "effect_direction"})
public final class GraphEdge {

    private final String from;
    private final String to;
    private final Double strengthMean;
    private final Double strengthStd;
    private final Double beliefExists;
    private final Double weight;
    private final Double belief;
    private String effectDirection;
    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    @JsonCreator
    public GraphEdge(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("strength_mean") Double strengthMean,
            @JsonProperty("strength_std") Double strengthStd,
            @JsonProperty("belief_exists") Double beliefExists,
            @JsonProperty("weight") Double weight,
            @JsonProperty("belief") Double belief,
            @JsonProperty("effect_direction") String effectDirection) {
        this.from = from;
        this.to = to;
        this.strengthMean = strengthMean;
        this.strengthStd = strengthStd;
        this.beliefExists = beliefExists;
        this.weight = weight;
        this.belief = belief;
        this.effectDirection = effectDirection;
    }

    /** Edge with canonical field names only. */
    public static GraphEdge of(String from, String to, Double strengthMean, Double strengthStd,
                               Double beliefExists, String effectDirection) {
        return new GraphEdge(from, to, strengthMean, strengthStd, beliefExists, null, null, effectDirection);
    }

    @JsonProperty("from")
    public String getFrom() {
        return from;
    }

    @JsonProperty("to")
    public String getTo() {
        return to;
    }

    @JsonProperty("strength_mean")
    public Double getStrengthMean() {
        return strengthMean;
    }

    @JsonProperty("strength_std")
    public Double getStrengthStd() {
        return strengthStd;
    }

    @JsonProperty("belief_exists")
    public Double getBeliefExists() {
        return beliefExists;
    }

    @JsonProperty("weight")
    public Double getWeight() {
        return weight;
    }

    @JsonProperty("belief")
    public Double getBelief() {
        return belief;
    }

    /** Raw direction string; may be outside the valid set. */
    @JsonProperty("effect_direction")
    public String getEffectDirection() {
        return effectDirection;
    }

    /** Direction resolved against the valid set; null when absent or invalid. */
    @JsonIgnore
    public EffectDirection direction() {
        return EffectDirection.fromValue(effectDirection);
    }

    /** {@code strength_mean}, falling back to the legacy {@code weight}. */
    @JsonIgnore
    public Double effectiveMean() {
        return strengthMean != null ? strengthMean : weight;
    }

    /** {@code belief_exists}, falling back to the legacy {@code belief}. */
    @JsonIgnore
    public Double effectiveBelief() {
        return beliefExists != null ? beliefExists : belief;
    }

    /** Stable identifier {@code from::to} used in mutation records. */
    @JsonIgnore
    public String edgeId() {
        return from + "::" + to;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    @JsonAnySetter
    void putExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    void setEffectDirection(String effectDirection) {
        this.effectDirection = effectDirection;
    }

    @Override
    public String toString() {
        return "GraphEdge{" + edgeId() + "}";
    }
}

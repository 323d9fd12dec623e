package com.cee.graph.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Data of a factor node: {@code value}, {@code baseline}, {@code factor_type}, {@code uncertainty_drivers}
 * and {@code extractionType}. Enum-valued fields are kept as raw strings so out-of-set values survive parsing.
 * A null field means the property is absent; an empty {@code uncertainty_drivers} list is present.
 * Only {@link GraphFieldWriter} can change the three descriptive fields after construction.
 */
@JsonPropertyOrder({"value", "baseline", "factor_type", "uncertainty_drivers", "extractionType"})
public final class FactorData implements NodeData {

    private final Double value;
    private final Double baseline;
    private String factorType;
    private List<String> uncertaintyDrivers;
    private String extractionType;
    private final Map<String, JsonNode> extras;

    public FactorData(Double value, Double baseline, String factorType,
                      List<String> uncertaintyDrivers, String extractionType) {
        this(value, baseline, factorType, uncertaintyDrivers, extractionType, Map.of());
    }

    private FactorData(Double value, Double baseline, String factorType,
                       List<String> uncertaintyDrivers, String extractionType, Map<String, JsonNode> extras) {
        this.value = value;
        this.baseline = baseline;
        this.factorType = factorType;
        this.uncertaintyDrivers = uncertaintyDrivers != null ? List.copyOf(uncertaintyDrivers) : null;
        this.extractionType = extractionType;
        this.extras = new LinkedHashMap<>(extras);
    }

    /** Empty data attached to a factor that had none, before a writer fills it. */
    static FactorData empty() {
        return new FactorData(null, null, null, null, null);
    }

    static FactorData fromJson(JsonNode object) {
        Double value = JsonFields.number(object.get("value"));
        Double baseline = JsonFields.number(object.get("baseline"));
        String factorType = JsonFields.text(object.get("factor_type"));
        List<String> drivers = JsonFields.textList(object.get("uncertainty_drivers"));
        String extractionType = JsonFields.text(object.get("extractionType"));
        Map<String, Boolean> known = new LinkedHashMap<>();
        known.put("value", value != null);
        known.put("baseline", baseline != null);
        known.put("factor_type", factorType != null);
        known.put("uncertainty_drivers", drivers != null);
        known.put("extractionType", extractionType != null);
        return new FactorData(value, baseline, factorType, drivers, extractionType,
                JsonFields.extras(object, known));
    }

    @JsonProperty("value")
    public Double getValue() {
        return value;
    }

    @JsonProperty("baseline")
    public Double getBaseline() {
        return baseline;
    }

    @JsonProperty("factor_type")
    public String getFactorType() {
        return factorType;
    }

    @JsonProperty("uncertainty_drivers")
    public List<String> getUncertaintyDrivers() {
        return uncertaintyDrivers;
    }

    @JsonProperty("extractionType")
    public String getExtractionType() {
        return extractionType;
    }

    /** Properties outside the known set (e.g. {@code unit}, {@code raw_value}), in input order. */
    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    public boolean hasValue() {
        return value != null;
    }

    void setFactorType(String factorType) {
        this.factorType = factorType;
    }

    void setUncertaintyDrivers(List<String> uncertaintyDrivers) {
        this.uncertaintyDrivers = uncertaintyDrivers != null ? List.copyOf(uncertaintyDrivers) : null;
    }

    void setExtractionType(String extractionType) {
        this.extractionType = extractionType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FactorData that = (FactorData) o;
        return Objects.equals(value, that.value)
                && Objects.equals(baseline, that.baseline)
                && Objects.equals(factorType, that.factorType)
                && Objects.equals(uncertaintyDrivers, that.uncertaintyDrivers)
                && Objects.equals(extractionType, that.extractionType)
                && extras.equals(that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, baseline, factorType, uncertaintyDrivers, extractionType, extras);
    }
}

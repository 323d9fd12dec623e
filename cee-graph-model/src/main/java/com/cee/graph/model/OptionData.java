package com.cee.graph.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Data of an option node: {@code interventions} maps a factor id to the value the option sets it to.
 * Insertion order is kept. A null map means the property is absent.
 */
public final class OptionData implements NodeData {

    private final Map<String, Double> interventions;
    private final Map<String, JsonNode> extras;

    public OptionData(Map<String, Double> interventions) {
        this(interventions, Map.of());
    }

    private OptionData(Map<String, Double> interventions, Map<String, JsonNode> extras) {
        this.interventions = interventions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(interventions))
                : null;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    static OptionData fromJson(JsonNode object) {
        JsonNode raw = object.get("interventions");
        Map<String, Double> interventions = null;
        boolean consumed = false;
        if (raw != null && raw.isObject()) {
            interventions = new LinkedHashMap<>();
            consumed = true;
            Iterator<Map.Entry<String, JsonNode>> it = raw.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                Double v = JsonFields.number(e.getValue());
                if (v == null) {
                    // keep the whole map verbatim rather than dropping a non-numeric entry
                    interventions = null;
                    consumed = false;
                    break;
                }
                interventions.put(e.getKey(), v);
            }
        }
        Map<String, Boolean> known = new LinkedHashMap<>();
        known.put("interventions", consumed);
        return new OptionData(interventions, JsonFields.extras(object, known));
    }

    /** Factor id to intervention value, or null when the option declares no interventions. */
    @JsonProperty("interventions")
    public Map<String, Double> getInterventions() {
        return interventions;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return extras;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OptionData that = (OptionData) o;
        return Objects.equals(interventions, that.interventions) && extras.equals(that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interventions, extras);
    }
}

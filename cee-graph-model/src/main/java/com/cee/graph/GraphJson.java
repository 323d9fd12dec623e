package com.cee.graph;

import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Serialization and deserialization of decision graphs and goal constraints.
 * Reading accepts {@code NaN} and {@code Infinity} literals so numeric checks can report them;
 * writing excludes null values.
 */
public final class GraphJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private static final TypeReference<List<GoalConstraint>> CONSTRAINTS_TYPE = new TypeReference<>() {};

    private GraphJson() {
    }

    /**
     * Deserializes a graph from a JSON string.
     *
     * @param json the JSON document (object with {@code nodes} and {@code edges})
     * @return the parsed {@link Graph}
     * @throws GraphContractException when the document is {@code null} or lacks {@code nodes} or {@code edges}
     * @throws UncheckedIOException on any other parse failure
     */
    public static Graph fromJson(String json) {
        GraphContractException.requireNonNull(json, "Graph JSON");
        Graph graph = read(json, MAPPER.getTypeFactory().constructType(Graph.class));
        if (graph == null) {
            throw new GraphContractException("Graph document is null");
        }
        return graph;
    }

    /**
     * Deserializes a JSON array of goal constraints.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static List<GoalConstraint> constraintsFromJson(String json) {
        GraphContractException.requireNonNull(json, "Constraints JSON");
        List<GoalConstraint> constraints = read(json, MAPPER.getTypeFactory().constructType(CONSTRAINTS_TYPE));
        return constraints != null ? constraints : List.of();
    }

    private static <T> T read(String json, JavaType type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (ValueInstantiationException e) {
            if (e.getCause() instanceof GraphContractException contract) throw contract;
            throw new UncheckedIOException(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a graph, result or report object to compact JSON (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes to pretty-printed JSON (nulls excluded). */
    public static String toJsonPretty(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}

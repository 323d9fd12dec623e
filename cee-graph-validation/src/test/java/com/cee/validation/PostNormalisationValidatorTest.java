package com.cee.validation;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.GraphEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostNormalisationValidatorTest {

    private final PostNormalisationValidator validator = new PostNormalisationValidator();

    @Test
    void validate_agreeingSignsAreValid() {
        GraphValidationResult result = validator.validate(TestGraphs.valid());

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().isEmpty());
        assertNull(result.getControllabilitySummary());
    }

    @Test
    void validate_reportsEachContradictingEdge() {
        List<GraphEdge> edges = TestGraphs.validEdges();
        edges.set(4, GraphEdge.of("f1", "out1", 0.6, 0.1, 0.9, "negative"));
        edges.set(5, GraphEdge.of("f2", "out1", -0.4, 0.1, 0.8, "positive"));

        GraphValidationResult result = validator.validate(TestGraphs.graph(TestGraphs.validNodes(), edges));

        assertFalse(result.isValid());
        assertEquals(2, result.getErrors().size());
        ValidationIssue first = result.getErrors().get(0);
        assertEquals(IssueCode.SIGN_MISMATCH, first.getCode());
        assertEquals("edges[4]", first.getPath());
        assertEquals(Map.of("effect_direction", "negative", "strength_mean", 0.6), first.getContext());
        assertEquals("edges[5]", result.getErrors().get(1).getPath());
    }

    @Test
    void validate_ignoresMixedZeroAndMissingValues() {
        List<GraphEdge> edges = TestGraphs.validEdges();
        edges.set(4, GraphEdge.of("f1", "out1", -0.6, 0.1, 0.9, "mixed"));
        edges.set(5, GraphEdge.of("f2", "out1", 0.0, 0.1, 0.8, "negative"));
        edges.set(6, GraphEdge.of("out1", "g1", null, 0.1, 1.0, "negative"));
        edges.add(new GraphEdge("f1", "out1", null, null, null, -0.5, null, "positive"));

        GraphValidationResult result = validator.validate(TestGraphs.graph(TestGraphs.validNodes(), edges));

        assertTrue(result.isValid(), () -> "unexpected errors: " + result.getErrors());
    }

    @Test
    void telemetryCounts_validAndErrorCountOnly() {
        GraphValidationResult result = validator.validate(TestGraphs.valid());

        assertEquals(List.of("valid", "error_count"), List.copyOf(result.telemetryCounts().keySet()));
    }

    @Test
    void validate_nullGraphIsContractViolation() {
        assertThrows(GraphContractException.class, () -> validator.validate(null));
    }
}

package com.cee.reconciliation.rule;

import com.cee.graph.GraphJson;
import com.cee.graph.model.Graph;
import com.cee.reconciliation.ReconcileOptions;
import com.cee.reconciliation.StrpMutation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationRuleTest {

    private static final String GRAPH_JSON = """
            {
              "nodes": [
                { "id": "o1", "kind": "option" },
                { "id": "f1", "kind": "factor", "category": "observable", "data": { "value": 3 } },
                { "id": "f2", "kind": "factor", "data": { "value": 1, "extractionType": "Explicit" } },
                { "id": "out1", "kind": "outcome" }
              ],
              "edges": [
                { "from": "o1", "to": "f1" },
                { "from": "f1", "to": "out1", "strength_mean": -0.7, "effect_direction": "Positive" },
                { "from": "f2", "to": "out1", "weight": -0.4, "effect_direction": "positive" }
              ]
            }
            """;

    private static ReconciliationContext context(Graph graph, ReconcileOptions options) {
        return new ReconciliationContext(graph, options);
    }

    @Test
    void signRule_aloneSkipsInvalidDirectionsAndLegacyWeight() {
        Graph graph = GraphJson.fromJson(GRAPH_JSON);

        List<StrpMutation> mutations = new SignReconciliationRule().apply(context(graph, ReconcileOptions.defaults()));

        assertTrue(mutations.isEmpty());
        assertEquals("Positive", graph.getEdges().get(1).getEffectDirection());
    }

    @Test
    void enumThenSignRule_recordBothChangesToOneField() {
        Graph graph = GraphJson.fromJson(GRAPH_JSON);
        ReconciliationContext context = context(graph, ReconcileOptions.defaults());

        List<StrpMutation> enumFixes = new EnumValidationRule().apply(context);
        List<StrpMutation> signFixes = new SignReconciliationRule().apply(context);

        assertEquals(2, enumFixes.size());
        assertEquals("data.extractionType", enumFixes.get(0).getField());
        assertEquals("Explicit", enumFixes.get(0).getBefore());
        assertEquals("f1::out1", enumFixes.get(1).getEdgeId());
        assertEquals(1, signFixes.size());
        assertEquals("positive", signFixes.get(0).getBefore());
        assertEquals("negative", graph.getEdges().get(1).getEffectDirection());
    }

    @Test
    void categoryRule_usesInferenceTakenBeforeAnyRule() {
        Graph graph = GraphJson.fromJson(GRAPH_JSON);
        ReconciliationContext context = context(graph, ReconcileOptions.defaults());

        List<StrpMutation> mutations = new CategoryOverrideRule().apply(context);

        assertEquals(3, mutations.size());
        assertEquals("observable", mutations.get(0).getBefore());
        assertEquals("controllable", graph.getNodes().get(1).getCategory());
        assertNull(mutations.get(1).getBefore());
        assertTrue(new CategoryOverrideRule().apply(context).isEmpty());
    }

    @Test
    void constraintRule_withoutConstraintsRecordsNoResult() {
        ReconciliationContext context = context(GraphJson.fromJson(GRAPH_JSON), ReconcileOptions.defaults());

        assertTrue(new ConstraintTargetRule().apply(context).isEmpty());
        assertNull(context.constraintResult());
    }
}

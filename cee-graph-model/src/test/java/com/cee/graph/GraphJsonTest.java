package com.cee.graph;

import com.cee.graph.model.FactorData;
import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.graph.model.NodeKind;
import com.cee.graph.model.OptionData;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphJsonTest {

    private static final String SAMPLE_GRAPH_JSON = """
            {
              "version": "1",
              "default_seed": 42,
              "nodes": [
                { "id": "decision_1", "kind": "decision", "label": "Pricing decision" },
                { "id": "opt_a", "kind": "option", "label": "Raise price",
                  "data": { "interventions": { "fac_price": 100 } } },
                { "id": "fac_price", "kind": "factor", "label": "Price", "category": "controllable",
                  "data": { "value": 150, "extractionType": "explicit", "factor_type": "price",
                            "uncertainty_drivers": ["market volatility"], "unit": "GBP" } },
                { "id": "outcome_1", "kind": "outcome", "label": "Revenue" },
                { "id": "goal_1", "kind": "goal", "label": "Grow revenue", "data": { "target": "up" } }
              ],
              "edges": [
                { "from": "decision_1", "to": "opt_a", "strength_mean": 1, "belief_exists": 1 },
                { "from": "opt_a", "to": "fac_price", "strength_mean": 1, "strength_std": 0.01,
                  "belief_exists": 1, "effect_direction": "positive", "provenance": "brief" },
                { "from": "fac_price", "to": "outcome_1", "weight": 0.8, "belief": 0.9 },
                { "from": "outcome_1", "to": "goal_1", "strength_mean": NaN, "belief_exists": 1 }
              ]
            }
            """;

    @Test
    void fromJson_parsesNodesEdgesAndData() {
        Graph graph = GraphJson.fromJson(SAMPLE_GRAPH_JSON);

        assertEquals(5, graph.getNodes().size());
        assertEquals(4, graph.getEdges().size());

        GraphNode factor = graph.getNodes().get(2);
        assertEquals(NodeKind.FACTOR, factor.kind());
        FactorData data = factor.factorData();
        assertNotNull(data);
        assertEquals(150.0, data.getValue());
        assertEquals("price", data.getFactorType());
        assertEquals(List.of("market volatility"), data.getUncertaintyDrivers());
        assertEquals("GBP", data.getExtras().get("unit").asText());

        OptionData option = graph.getNodes().get(1).optionData();
        assertNotNull(option);
        assertEquals(100.0, option.getInterventions().get("fac_price"));

        assertNull(graph.getNodes().get(4).factorData());
        assertNotNull(graph.getNodes().get(4).getData());
    }

    @Test
    void fromJson_resolvesLegacyEdgeAliases() {
        Graph graph = GraphJson.fromJson(SAMPLE_GRAPH_JSON);
        GraphEdge legacy = graph.getEdges().get(2);

        assertNull(legacy.getStrengthMean());
        assertEquals(0.8, legacy.effectiveMean());
        assertEquals(0.9, legacy.effectiveBelief());
        assertEquals("fac_price::outcome_1", legacy.edgeId());
    }

    @Test
    void fromJson_acceptsNonFiniteNumbers() {
        Graph graph = GraphJson.fromJson(SAMPLE_GRAPH_JSON);
        assertTrue(Double.isNaN(graph.getEdges().get(3).getStrengthMean()));
    }

    @Test
    void toJson_preservesUnknownProperties() {
        Graph graph = GraphJson.fromJson(SAMPLE_GRAPH_JSON);
        String json = GraphJson.toJson(graph);
        Graph reparsed = GraphJson.fromJson(json);

        assertEquals("1", reparsed.getExtras().get("version").asText());
        assertEquals(42, reparsed.getExtras().get("default_seed").asInt());
        assertEquals("brief", reparsed.getEdges().get(1).getExtras().get("provenance").asText());
        assertTrue(GraphJson.toJson(reparsed.getNodes().get(4)).contains("\"target\":\"up\""));
        assertEquals(graph.getNodes().get(2).factorData(), reparsed.getNodes().get(2).factorData());
        assertTrue(json.contains("\"weight\":0.8"));
    }

    @Test
    void toJson_omitsAbsentFields() {
        Graph graph = GraphJson.fromJson(SAMPLE_GRAPH_JSON);
        String json = GraphJson.toJson(graph.getNodes().get(0));
        assertEquals("{\"id\":\"decision_1\",\"kind\":\"decision\",\"label\":\"Pricing decision\"}", json);
    }

    @Test
    void fromJson_missingEdges_throwsContractException() {
        GraphContractException e = assertThrows(GraphContractException.class,
                () -> GraphJson.fromJson("{ \"nodes\": [] }"));
        assertTrue(e.getMessage().contains("edges"));
    }

    @Test
    void fromJson_missingNodes_throwsContractException() {
        assertThrows(GraphContractException.class, () -> GraphJson.fromJson("{ \"edges\": [] }"));
    }

    @Test
    void fromJson_nullDocument_throwsContractException() {
        assertThrows(GraphContractException.class, () -> GraphJson.fromJson("null"));
        assertThrows(GraphContractException.class, () -> GraphJson.fromJson(null));
    }

    @Test
    void fromJson_malformed_throwsUncheckedIo() {
        assertThrows(UncheckedIOException.class, () -> GraphJson.fromJson("{ \"nodes\": [ "));
    }

    @Test
    void constraintsFromJson_keepsOpaqueProperties() {
        List<GoalConstraint> constraints = GraphJson.constraintsFromJson("""
                [
                  { "constraint_id": "c1", "node_id": "fac_pricing", "operator": "<=", "value": 120 },
                  { "node_id": "fac_xyz" }
                ]
                """);

        assertEquals(2, constraints.size());
        GoalConstraint first = constraints.get(0);
        assertEquals("c1", first.getConstraintId());
        GoalConstraint remapped = first.withNodeId("fac_price");
        assertEquals("fac_price", remapped.getNodeId());
        assertEquals("fac_pricing", first.getNodeId());
        assertEquals("<=", remapped.getExtras().get("operator").asText());
        assertNull(constraints.get(1).getConstraintId());
    }

    @Test
    void modelDoesNotPullInLogging() {
        assertThrows(ClassNotFoundException.class, () -> Class.forName("org.slf4j.Logger"));
    }
}

package com.cee.reconciliation;

import com.cee.graph.GraphContractException;
import com.cee.graph.GraphJson;
import com.cee.graph.model.FactorData;
import com.cee.graph.model.GoalConstraint;
import com.cee.graph.model.Graph;
import com.cee.graph.model.GraphEdge;
import com.cee.graph.model.GraphNode;
import com.cee.reconciliation.rule.CategoryOverrideRule;
import com.cee.reconciliation.rule.ConstraintTargetRule;
import com.cee.reconciliation.rule.ControllableDataCompletenessRule;
import com.cee.reconciliation.rule.EnumValidationRule;
import com.cee.reconciliation.rule.SignReconciliationRule;
import com.cee.validation.GraphValidationResult;
import com.cee.validation.GraphValidator;
import com.cee.validation.IssueCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuralReconcilerTest {

    private static final String CLEAN_GRAPH_JSON = """
            {
              "nodes": [
                { "id": "goal_1", "kind": "goal", "label": "Reach profitability" },
                { "id": "dec_1", "kind": "decision", "label": "Pricing" },
                { "id": "opt_a", "kind": "option", "data": { "interventions": { "fac_price": 59 } } },
                { "id": "opt_b", "kind": "option", "data": { "interventions": { "fac_ads": 2000 } } },
                { "id": "fac_price", "kind": "factor", "label": "Price", "category": "controllable",
                  "data": { "value": 49, "extractionType": "explicit", "factor_type": "price",
                            "uncertainty_drivers": ["churn"] } },
                { "id": "fac_ads", "kind": "factor", "label": "Ad budget", "category": "controllable",
                  "data": { "value": 1000, "extractionType": "explicit", "factor_type": "cost",
                            "uncertainty_drivers": ["CPC"] } },
                { "id": "out_revenue", "kind": "outcome", "label": "Revenue" }
              ],
              "edges": [
                { "from": "dec_1", "to": "opt_a", "strength_mean": 1, "strength_std": 0.01, "belief_exists": 1, "effect_direction": "positive" },
                { "from": "dec_1", "to": "opt_b", "strength_mean": 1, "strength_std": 0.01, "belief_exists": 1, "effect_direction": "positive" },
                { "from": "opt_a", "to": "fac_price", "strength_mean": 1, "strength_std": 0.01, "belief_exists": 1, "effect_direction": "positive" },
                { "from": "opt_b", "to": "fac_ads", "strength_mean": 1, "strength_std": 0.01, "belief_exists": 1, "effect_direction": "positive" },
                { "from": "fac_price", "to": "out_revenue", "strength_mean": 0.5, "strength_std": 0.1, "belief_exists": 0.9, "effect_direction": "positive" },
                { "from": "fac_ads", "to": "out_revenue", "strength_mean": 0.3, "strength_std": 0.1, "belief_exists": 0.8, "effect_direction": "positive" },
                { "from": "out_revenue", "to": "goal_1", "strength_mean": 0.8, "strength_std": 0.1, "belief_exists": 1, "effect_direction": "positive" }
              ]
            }
            """;

    private static final String MESSY_GRAPH_JSON = """
            {
              "nodes": [
                { "id": "goal_1", "kind": "goal" },
                { "id": "dec_1", "kind": "decision" },
                { "id": "opt_a", "kind": "option" },
                { "id": "opt_b", "kind": "option" },
                { "id": "fac_price", "kind": "factor", "category": "external",
                  "data": { "value": 49, "extractionType": "guessed" } },
                { "id": "fac_ads", "kind": "factor", "category": "",
                  "data": { "value": 1000, "extractionType": "explicit", "factor_type": "marketing",
                            "uncertainty_drivers": ["CPC"] } },
                { "id": "fac_season", "kind": "factor", "category": "controllable",
                  "data": { "value": 0.2, "extractionType": "observed", "factor_type": "time",
                            "uncertainty_drivers": ["weather"] } },
                { "id": "fac_rival", "kind": "factor", "category": "bogus" },
                { "id": "out_revenue", "kind": "outcome" }
              ],
              "edges": [
                { "from": "dec_1", "to": "opt_a" },
                { "from": "dec_1", "to": "opt_b" },
                { "from": "opt_a", "to": "fac_price" },
                { "from": "opt_b", "to": "fac_ads" },
                { "from": "fac_price", "to": "out_revenue", "strength_mean": -0.5, "effect_direction": "positive" },
                { "from": "fac_ads", "to": "out_revenue", "strength_mean": 0.3, "effect_direction": "upward" },
                { "from": "fac_season", "to": "out_revenue", "strength_mean": -0.2, "effect_direction": "mixed" },
                { "from": "fac_rival", "to": "out_revenue", "strength_mean": 0, "effect_direction": "negative" },
                { "from": "out_revenue", "to": "goal_1", "strength_mean": 0.8, "effect_direction": "negative" }
              ]
            }
            """;

    private final StructuralReconciler reconciler = new StructuralReconciler();

    private static GraphNode node(Graph graph, String id) {
        return graph.getNodes().stream().filter(n -> n.getId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void reconcile_cleanGraphRecordsNothing() {
        Graph graph = GraphJson.fromJson(CLEAN_GRAPH_JSON);
        String before = GraphJson.toJson(graph);

        ReconciliationResult result = reconciler.reconcile(graph);

        assertTrue(result.getMutations().isEmpty());
        assertNull(result.getGoalConstraints());
        assertSame(graph, result.getGraph());
        assertEquals(before, GraphJson.toJson(graph));
    }

    @Test
    void reconcile_categoryMismatchIsCorrectedAndValidatesClean() {
        Graph graph = GraphJson.fromJson(CLEAN_GRAPH_JSON);
        GraphNode price = node(graph, "fac_price");
        Graph drifted = new Graph(graph.getNodes().stream()
                .map(n -> n == price
                        ? new GraphNode("fac_price", "factor", "Price", "external",
                                new FactorData(49.0, null, null, null, "explicit"))
                        : n)
                .toList(), graph.getEdges());
        GraphValidator validator = new GraphValidator();
        assertEquals(1, validator.validate(drifted).issuesWithCode(IssueCode.CATEGORY_MISMATCH).size());

        ReconciliationResult result = reconciler.reconcile(drifted);

        GraphNode fixed = node(drifted, "fac_price");
        assertEquals("controllable", fixed.getCategory());
        assertEquals("other", fixed.factorData().getFactorType());
        assertEquals(List.of("Estimation uncertainty"), fixed.factorData().getUncertaintyDrivers());
        List<StrpMutation> overrides = result.mutationsOf(CategoryOverrideRule.NAME);
        assertEquals(List.of("category", "data.factor_type", "data.uncertainty_drivers"),
                overrides.stream().map(StrpMutation::getField).toList());
        assertEquals("external", overrides.get(0).getBefore());
        assertEquals("Structural inference: has option edge -> controllable", overrides.get(0).getReason());

        GraphValidationResult after = validator.validate(drifted);
        assertTrue(after.issuesWithCode(IssueCode.CATEGORY_MISMATCH).isEmpty());
        assertTrue(after.isValid(), () -> "unexpected errors: " + after.getErrors());
    }

    @Test
    void reconcile_messyGraphAppliesRulesInOrder() {
        Graph graph = GraphJson.fromJson(MESSY_GRAPH_JSON);

        ReconciliationResult result = reconciler.reconcile(graph);

        List<String> rules = result.getMutations().stream().map(StrpMutation::getRule).distinct().toList();
        assertEquals(List.of(CategoryOverrideRule.NAME, EnumValidationRule.NAME, SignReconciliationRule.NAME), rules);
    }

    @Test
    void reconcile_reclassifiedFactorLosesControllableFields() {
        Graph graph = GraphJson.fromJson(MESSY_GRAPH_JSON);

        ReconciliationResult result = reconciler.reconcile(graph);

        GraphNode season = node(graph, "fac_season");
        assertEquals("observable", season.getCategory());
        assertNull(season.factorData().getFactorType());
        assertNull(season.factorData().getUncertaintyDrivers());
        assertEquals("observed", season.factorData().getExtractionType());
        List<StrpMutation> seasonMutations = result.getMutations().stream()
                .filter(m -> "fac_season".equals(m.getNodeId()))
                .toList();
        assertEquals(3, seasonMutations.size());
        assertEquals(List.of("weather"), seasonMutations.get(2).getBefore());
        assertNull(seasonMutations.get(2).getAfter());
    }

    @Test
    void reconcile_invalidEnumsResetToDefaults() {
        Graph graph = GraphJson.fromJson(MESSY_GRAPH_JSON);

        ReconciliationResult result = reconciler.reconcile(graph);

        assertEquals("inferred", node(graph, "fac_price").factorData().getExtractionType());
        assertEquals("other", node(graph, "fac_ads").factorData().getFactorType());
        assertNull(node(graph, "fac_ads").getCategory());
        // an invalid declared category is settled by inference before enum validation sees it
        assertEquals("external", node(graph, "fac_rival").getCategory());

        List<StrpMutation> enumFixes = result.mutationsOf(EnumValidationRule.NAME);
        assertEquals(List.of("fac_price:data.extractionType", "fac_ads:data.factor_type", "fac_ads:category",
                        "fac_ads::out_revenue:effect_direction"),
                enumFixes.stream()
                        .map(m -> (m.getNodeId() != null ? m.getNodeId() : m.getEdgeId()) + ":" + m.getField())
                        .toList());
        assertTrue(enumFixes.stream().allMatch(m -> m.getSeverity() == MutationSeverity.WARN));
        assertTrue(enumFixes.get(1).getReason().startsWith("Invalid factor_type \"marketing\"; valid: cost, price"));
    }

    @Test
    void reconcile_directionFollowsSignOfMean() {
        Graph graph = GraphJson.fromJson(MESSY_GRAPH_JSON);
        List<GraphEdge> edges = graph.getEdges();

        ReconciliationResult result = reconciler.reconcile(graph);

        assertEquals("negative", edges.get(4).getEffectDirection());
        assertEquals("positive", edges.get(5).getEffectDirection());
        assertEquals("mixed", edges.get(6).getEffectDirection());
        assertEquals("negative", edges.get(7).getEffectDirection());
        assertEquals("positive", edges.get(8).getEffectDirection());

        List<StrpMutation> signFixes = result.mutationsOf(SignReconciliationRule.NAME);
        assertEquals(List.of("fac_price::out_revenue", "out_revenue::goal_1"),
                signFixes.stream().map(StrpMutation::getEdgeId).toList());
        assertEquals(MutationCode.SIGN_CORRECTED, signFixes.get(0).getCode());
        assertEquals("positive", signFixes.get(0).getBefore());
        assertEquals("negative", signFixes.get(0).getAfter());
    }

    @Test
    void reconcile_isIdempotent() {
        Graph graph = GraphJson.fromJson(MESSY_GRAPH_JSON);
        ReconcileOptions options = ReconcileOptions.builder()
                .fillControllableData(true)
                .goalConstraints(List.of(new GoalConstraint("fac_pricing", "c1")))
                .build();

        ReconciliationResult first = reconciler.reconcile(graph, options);
        String afterFirst = GraphJson.toJson(graph);
        ReconciliationResult second = reconciler.reconcile(graph,
                ReconcileOptions.builder().fillControllableData(true).goalConstraints(first.getGoalConstraints()).build());

        assertFalse(first.getMutations().isEmpty());
        assertTrue(second.getMutations().isEmpty(), () -> "second pass: " + second.getMutations());
        assertEquals(afterFirst, GraphJson.toJson(graph));
    }

    @Test
    void reconcile_neverChangesTopology() {
        Graph graph = GraphJson.fromJson(MESSY_GRAPH_JSON);
        List<GraphNode> nodes = List.copyOf(graph.getNodes());
        List<GraphEdge> edges = List.copyOf(graph.getEdges());

        reconciler.reconcile(graph, ReconcileOptions.builder().fillControllableData(true).build());

        assertEquals(nodes.size(), graph.getNodes().size());
        assertEquals(edges.size(), graph.getEdges().size());
        for (int i = 0; i < nodes.size(); i++) {
            assertSame(nodes.get(i), graph.getNodes().get(i));
        }
        for (int i = 0; i < edges.size(); i++) {
            assertSame(edges.get(i), graph.getEdges().get(i));
            assertEquals(edges.get(i).getFrom(), graph.getEdges().get(i).getFrom());
            assertEquals(edges.get(i).getTo(), graph.getEdges().get(i).getTo());
        }
    }

    private static final String UNDECLARED_GRAPH_JSON = """
            {
              "nodes": [
                { "id": "opt_a", "kind": "option" },
                { "id": "fac_price", "kind": "factor", "data": { "value": 10, "extractionType": "explicit" } },
                { "id": "fac_bare", "kind": "factor" }
              ],
              "edges": [ { "from": "opt_a", "to": "fac_price" }, { "from": "opt_a", "to": "fac_bare" } ]
            }
            """;

    @Test
    void reconcile_skipsDataCompletenessByDefault() {
        Graph graph = GraphJson.fromJson(UNDECLARED_GRAPH_JSON);

        ReconciliationResult result = reconciler.reconcile(graph);

        assertTrue(result.getMutations().isEmpty());
        assertNull(node(graph, "fac_price").factorData().getFactorType());
        assertNull(node(graph, "fac_bare").factorData());
    }

    @Test
    void reconcile_fillsControllableDataWhenRequested() {
        Graph graph = GraphJson.fromJson(UNDECLARED_GRAPH_JSON);

        ReconciliationResult result = reconciler.reconcile(graph,
                ReconcileOptions.builder().fillControllableData(true).build());

        List<StrpMutation> filled = result.mutationsOf(ControllableDataCompletenessRule.NAME);
        assertEquals(List.of("fac_price:data.factor_type", "fac_price:data.uncertainty_drivers",
                        "fac_bare:data.factor_type", "fac_bare:data.uncertainty_drivers"),
                filled.stream().map(m -> m.getNodeId() + ":" + m.getField()).toList());
        assertNull(filled.get(0).getBefore());
        assertEquals(MutationCode.CONTROLLABLE_DATA_FILLED, filled.get(0).getCode());
        assertEquals(10.0, node(graph, "fac_price").factorData().getValue());
        GraphNode bare = node(graph, "fac_bare");
        assertEquals("other", bare.factorData().getFactorType());
        assertEquals(List.of("Estimation uncertainty"), bare.factorData().getUncertaintyDrivers());
        assertNull(bare.getCategory());
    }

    @Test
    void reconcile_constraintTargetsRemappedOrDropped() {
        Graph graph = GraphJson.fromJson(CLEAN_GRAPH_JSON);
        List<GoalConstraint> constraints = GraphJson.constraintsFromJson("""
                [
                  { "constraint_id": "c1", "node_id": "fac_price", "operator": "<=", "value": 60 },
                  { "constraint_id": "c2", "node_id": "fac_pricing", "operator": ">=", "value": 40 },
                  { "constraint_id": "c3", "node_id": "fac_xyz", "operator": "<=", "value": 1 }
                ]
                """);

        ReconciliationResult result = reconciler.reconcile(graph,
                ReconcileOptions.builder().goalConstraints(constraints).requestId("req-1").build());

        List<GoalConstraint> normalised = result.getGoalConstraints();
        assertEquals(2, normalised.size());
        assertEquals("fac_price", normalised.get(1).getNodeId());
        assertEquals("c2", normalised.get(1).getConstraintId());
        assertEquals(">=", normalised.get(1).getExtras().get("operator").asText());
        assertEquals("fac_pricing", constraints.get(1).getNodeId());

        List<StrpMutation> mutations = result.mutationsOf(ConstraintTargetRule.NAME);
        assertEquals(2, mutations.size());
        StrpMutation remap = mutations.get(0);
        assertEquals(MutationCode.CONSTRAINT_REMAPPED, remap.getCode());
        assertEquals("c2", remap.getConstraintId());
        assertEquals("node_id", remap.getField());
        assertEquals("fac_pricing", remap.getBefore());
        assertEquals("fac_price", remap.getAfter());
        assertEquals(MutationSeverity.INFO, remap.getSeverity());
        StrpMutation drop = mutations.get(1);
        assertEquals(MutationCode.CONSTRAINT_DROPPED, drop.getCode());
        assertEquals("fac_xyz", drop.getBefore());
        assertNull(drop.getAfter());
    }

    @Test
    void reconcile_emptyConstraintListIsReturnedUnchanged() {
        ReconciliationResult result = reconciler.reconcile(GraphJson.fromJson(CLEAN_GRAPH_JSON),
                ReconcileOptions.builder().goalConstraints(List.of()).build());

        assertEquals(List.of(), result.getGoalConstraints());
        assertEquals(0, result.telemetryCounts().get("constraints_total"));
    }

    @Test
    void telemetryCounts_listEveryRule() {
        ReconciliationResult result = reconciler.reconcile(GraphJson.fromJson(MESSY_GRAPH_JSON));

        Map<String, Number> counts = result.telemetryCounts();

        assertEquals(List.of("mutation_count", "rule.category_override", "rule.enum_validation",
                        "rule.constraint_target", "rule.sign_reconciliation", "rule.controllable_data_completeness",
                        "constraints_total", "constraints_valid", "constraints_remapped", "constraints_dropped"),
                List.copyOf(counts.keySet()));
        assertEquals(result.getMutations().size(), counts.get("mutation_count"));
        assertEquals(0, counts.get("rule.controllable_data_completeness"));
        assertEquals(2, counts.get("rule.sign_reconciliation"));
    }

    @Test
    void mutation_serialisesWithSnakeCaseFields() {
        ReconciliationResult result = reconciler.reconcile(GraphJson.fromJson(MESSY_GRAPH_JSON));

        String json = GraphJson.toJson(result.mutationsOf(SignReconciliationRule.NAME).get(0));

        assertEquals("{\"rule\":\"sign_reconciliation\",\"code\":\"SIGN_CORRECTED\","
                + "\"edge_id\":\"fac_price::out_revenue\",\"field\":\"effect_direction\","
                + "\"before\":\"positive\",\"after\":\"negative\","
                + "\"reason\":\"effect_direction \\\"positive\\\" contradicts strength_mean sign (-0.5)\","
                + "\"severity\":\"warn\"}", json);
    }

    @Test
    void reconcile_nullArgumentsAreContractViolations() {
        assertThrows(GraphContractException.class, () -> reconciler.reconcile(null));
        assertThrows(GraphContractException.class,
                () -> reconciler.reconcile(GraphJson.fromJson(CLEAN_GRAPH_JSON), null));
    }
}

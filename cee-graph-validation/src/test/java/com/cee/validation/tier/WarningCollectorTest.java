package com.cee.validation.tier;

import com.cee.graph.GraphJson;
import com.cee.validation.IssueCode;
import com.cee.validation.IssueSeverity;
import com.cee.validation.ValidationIssue;
import com.cee.validation.index.GraphAnalysis;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WarningCollectorTest {

    private static final String GRAPH_JSON = """
            {
              "nodes": [
                { "id": "g1", "kind": "goal" },
                { "id": "d1", "kind": "decision" },
                { "id": "o1", "kind": "option" },
                { "id": "f1", "kind": "factor",
                  "data": { "value": 1, "extractionType": "explicit", "factor_type": "cost", "uncertainty_drivers": [] } },
                { "id": "out1", "kind": "outcome" },
                { "id": "r1", "kind": "risk" }
              ],
              "edges": [
                { "from": "d1", "to": "o1", "weight": 1, "belief": 1, "strength_std": 0.04 },
                { "from": "o1", "to": "f1", "strength_mean": 1, "strength_std": 0.2, "belief_exists": 1 },
                { "from": "f1", "to": "out1", "strength_mean": 1.4, "strength_std": 0.01, "belief_exists": 0.2 },
                { "from": "f1", "to": "r1", "strength_mean": 0.3, "strength_std": 0.1, "belief_exists": 1.2 },
                { "from": "out1", "to": "g1", "strength_mean": -0.5, "strength_std": 0.1, "belief_exists": 0.9 },
                { "from": "r1", "to": "g1", "strength_mean": 0.5, "strength_std": 0.1, "belief_exists": 0.9 },
                { "from": "r1", "to": "missing", "strength_mean": 9, "belief_exists": -1 }
              ]
            }
            """;

    private static List<ValidationIssue> collect() {
        return new WarningCollector().collect(GraphAnalysis.of(GraphJson.fromJson(GRAPH_JSON)));
    }

    @Test
    void collect_reportsAdvisoriesInEdgeOrder() {
        List<ValidationIssue> warnings = collect();

        List<String> summary = warnings.stream().map(w -> w.getCode() + "@" + w.getPath()).toList();
        assertEquals(List.of(
                "STRUCTURAL_EDGE_NOT_CANONICAL@edges[1]",
                "STRENGTH_OUT_OF_RANGE@edges[2]",
                "LOW_EDGE_CONFIDENCE@edges[2]",
                "LOW_STD_NON_STRUCTURAL@edges[2]",
                "PROBABILITY_OUT_OF_RANGE@edges[3]",
                "OUTCOME_NEGATIVE_POLARITY@edges[4]",
                "RISK_POSITIVE_POLARITY@edges[5]",
                "EMPTY_UNCERTAINTY_DRIVERS@nodesById.f1.data.uncertainty_drivers"), summary);
        assertTrue(warnings.stream().allMatch(w -> w.getSeverity() == IssueSeverity.WARN));
    }

    @Test
    void collect_legacyAliasesSatisfyTolerantCanonicalCheck() {
        assertTrue(collect().stream().noneMatch(w -> "edges[0]".equals(w.getPath())));
    }

    @Test
    void collect_structuralContextCarriesTolerance() {
        ValidationIssue structural = collect().get(0);

        assertEquals(IssueCode.STRUCTURAL_EDGE_NOT_CANONICAL, structural.getCode());
        @SuppressWarnings("unchecked")
        Map<String, Object> expected = (Map<String, Object>) structural.getContext().get("expected");
        assertEquals(0.05, expected.get("stdMax"));
        assertEquals(Map.of("mean", 1.0, "std", 0.2, "prob", 1.0), structural.getContext().get("actual"));
    }

    @Test
    void collect_lowStdContext() {
        ValidationIssue lowStd = collect().stream()
                .filter(w -> w.getCode() == IssueCode.LOW_STD_NON_STRUCTURAL)
                .findFirst()
                .orElseThrow();

        assertEquals(Map.of("from", "f1", "to", "out1", "std", 0.01, "threshold", 0.05), lowStd.getContext());
    }
}

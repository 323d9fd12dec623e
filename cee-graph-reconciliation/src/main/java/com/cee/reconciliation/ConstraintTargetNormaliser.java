package com.cee.reconciliation;

import com.cee.graph.GraphContractException;
import com.cee.graph.model.GoalConstraint;
import com.cee.validation.IssueCode;
import com.cee.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Aligns goal-constraint {@code node_id}s with the node ids of a graph.
 * <p>
 * An exact id is kept. Otherwise the known prefix ({@code fac_}, {@code out_}, {@code risk_}) is stripped
 * and the stem compared case-insensitively against every node stem by containment in either direction,
 * then again after removing one common English suffix. Exactly one candidate remaps the constraint;
 * none or several drop it. Stems shorter than {@value #MIN_FUZZY_STEM_LENGTH} never match, and ids with
 * different known prefixes are never compared.
 */
public final class ConstraintTargetNormaliser {

    private static final Logger log = LoggerFactory.getLogger(ConstraintTargetNormaliser.class);

    static final List<String> NODE_PREFIXES = List.of("fac_", "out_", "risk_");
    static final int MIN_FUZZY_STEM_LENGTH = 4;
    private static final List<String> SUFFIXES = List.of("ing", "ed", "es", "s", "e");
    private static final String ISSUE_PATH = "goal_constraints[].node_id";

    private ConstraintTargetNormaliser() {
    }

    public static ConstraintNormalisationResult normalise(List<GoalConstraint> constraints, List<String> nodeIds) {
        return normalise(constraints, nodeIds, null);
    }

    public static ConstraintNormalisationResult normalise(List<GoalConstraint> constraints, List<String> nodeIds,
                                                          String requestId) {
        GraphContractException.requireNonNull(constraints, "Goal constraints");
        GraphContractException.requireNonNull(nodeIds, "Node ids");
        Set<String> known = new HashSet<>(nodeIds);
        List<GoalConstraint> kept = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        int valid = 0;
        int remapped = 0;
        int dropped = 0;

        for (GoalConstraint constraint : constraints) {
            String original = constraint.getNodeId();
            if (original != null && known.contains(original)) {
                kept.add(constraint);
                valid++;
                continue;
            }
            String match = original != null ? fuzzyMatch(original, nodeIds) : null;
            if (match != null) {
                kept.add(constraint.withNodeId(match));
                remapped++;
                issues.add(ValidationIssue.info(IssueCode.CONSTRAINT_NODE_REMAPPED,
                                "Constraint node_id \"" + original + "\" remapped to \"" + match + "\"")
                        .path(ISSUE_PATH)
                        .context("original_node_id", original)
                        .context("remapped_node_id", match)
                        .context("constraint_id", constraint.getConstraintId())
                        .build());
            } else {
                dropped++;
                issues.add(ValidationIssue.info(IssueCode.CONSTRAINT_DROPPED_NO_TARGET,
                                "Constraint with node_id \"" + original + "\" dropped; no matching node found")
                        .path(ISSUE_PATH)
                        .context("original_node_id", original)
                        .context("constraint_id", constraint.getConstraintId())
                        .build());
            }
        }

        if (!issues.isEmpty()) {
            log.info("Constraint normalisation | requestId={} | total={} | valid={} | remapped={} | dropped={}",
                    requestId, constraints.size(), valid, remapped, dropped);
        }
        return new ConstraintNormalisationResult(kept, issues, valid, remapped, dropped);
    }

    /** The single node id whose stem resembles the constraint's, or null. */
    static String fuzzyMatch(String constraintNodeId, List<String> nodeIds) {
        String prefix = prefixOf(constraintNodeId);
        String stem = constraintNodeId.substring(prefix.length()).toLowerCase(Locale.ROOT);
        if (stem.length() < MIN_FUZZY_STEM_LENGTH) return null;

        List<String> matches = new ArrayList<>();
        for (String nodeId : nodeIds) {
            if (nodeId == null || matches.contains(nodeId)) continue;
            String nodePrefix = prefixOf(nodeId);
            if (!prefix.isEmpty() && !nodePrefix.isEmpty() && !prefix.equals(nodePrefix)) continue;
            String nodeStem = nodeId.substring(nodePrefix.length()).toLowerCase(Locale.ROOT);
            if (nodeStem.length() < MIN_FUZZY_STEM_LENGTH) continue;

            if (overlaps(stem, nodeStem) || overlaps(stemmed(stem), stemmed(nodeStem))) {
                matches.add(nodeId);
            }
        }
        return matches.size() == 1 ? matches.get(0) : null;
    }

    private static boolean overlaps(String a, String b) {
        return a.contains(b) || b.contains(a);
    }

    private static String prefixOf(String id) {
        for (String prefix : NODE_PREFIXES) {
            if (id.startsWith(prefix)) return prefix;
        }
        return "";
    }

    /** Drops the first matching suffix when the remainder keeps the minimum stem length. */
    static String stemmed(String stem) {
        for (String suffix : SUFFIXES) {
            if (stem.endsWith(suffix) && stem.length() - suffix.length() >= MIN_FUZZY_STEM_LENGTH) {
                return stem.substring(0, stem.length() - suffix.length());
            }
        }
        return stem;
    }
}

package com.cee.validation.index;

import com.cee.graph.model.GraphEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Breadth-first traversals over a {@link GraphIndex} and cycle detection.
 * All methods are stateless and terminate on cyclic input.
 */
public final class Reachability {

    private Reachability() {
    }

    /** Ids reachable from {@code start} along edges, including {@code start}. */
    public static Set<String> forward(GraphIndex index, String start) {
        return bfs(index, start, true);
    }

    /** Ids that can reach {@code target} along edges, including {@code target}. */
    public static Set<String> reverse(GraphIndex index, String target) {
        return bfs(index, target, false);
    }

    private static Set<String> bfs(GraphIndex index, String start, boolean forward) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) continue;
            List<String> next = forward ? index.successors(current) : index.predecessors(current);
            for (String id : next) {
                if (id != null && !visited.contains(id)) {
                    queue.add(id);
                }
            }
        }
        return visited;
    }

    /**
     * Walks backwards from {@code start} (itself included) and returns true as soon as a visited id
     * satisfies {@code match}.
     */
    public static boolean hasAncestorMatching(GraphIndex index, String start, Predicate<String> match) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) continue;
            if (match.test(current)) return true;
            for (String parent : index.predecessors(current)) {
                if (parent != null && !visited.contains(parent)) {
                    queue.add(parent);
                }
            }
        }
        return false;
    }

    /**
     * Kahn's algorithm over the graph's distinct node ids: seed with in-degree zero, remove and decrement,
     * report a cycle when fewer ids were dequeued than exist. Edges with an unknown endpoint are ignored.
     */
    public static boolean hasCycle(GraphIndex index) {
        List<String> ids = index.nodeIds();
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : ids) {
            inDegree.put(id, 0);
        }
        Map<String, List<String>> adjacency = new HashMap<>();
        for (GraphEdge edge : index.graph().getEdges()) {
            if (!index.contains(edge.getFrom()) || !index.contains(edge.getTo())) continue;
            adjacency.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
            inDegree.merge(edge.getTo(), 1, Integer::sum);
        }

        Deque<String> queue = new ArrayDeque<>();
        for (String id : ids) {
            if (inDegree.get(id) == 0) queue.add(id);
        }
        int processed = 0;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            processed++;
            for (String next : adjacency.getOrDefault(current, List.of())) {
                int degree = inDegree.merge(next, -1, Integer::sum);
                if (degree == 0) queue.add(next);
            }
        }
        return processed != ids.size();
    }
}

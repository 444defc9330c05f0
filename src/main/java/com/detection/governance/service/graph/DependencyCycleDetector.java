package com.detection.governance.service.graph;

import com.detection.governance.dto.graph.DependencyCycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * DFS-based cycle detection over the content dependency graph.
 *
 * Two uses:
 * 1. Guard: before adding edge X -> Y, check whether X is already reachable from Y.
 * 2. Audit: list every distinct cycle in a full adjacency map.
 */
@Component
@Slf4j
public class DependencyCycleDetector {

    /**
     * Path the edge {@code from -> to} would close into a cycle, if any.
     *
     * @param dependenciesOf adjacency lookup, item id to the ids it depends on
     * @return the cycle starting and ending at {@code from}, or empty when the edge is safe
     */
    public Optional<List<String>> cycleClosedBy(String from, String to, Function<String, Set<String>> dependenciesOf) {
        if (from.equals(to)) {
            return Optional.of(List.of(from, from));
        }

        List<String> path = new ArrayList<>();
        if (!findPath(to, from, dependenciesOf, new HashSet<>(), path)) {
            return Optional.empty();
        }

        List<String> cycle = new ArrayList<>();
        cycle.add(from);
        cycle.addAll(path);
        return Optional.of(cycle);
    }

    private boolean findPath(String current, String target, Function<String, Set<String>> dependenciesOf,
                             Set<String> visited, List<String> path) {
        path.add(current);
        if (current.equals(target)) {
            return true;
        }
        if (visited.add(current)) {
            for (String next : dependenciesOf.apply(current)) {
                if (findPath(next, target, dependenciesOf, visited, path)) {
                    return true;
                }
            }
        }
        path.remove(path.size() - 1);
        return false;
    }

    // ========================= FULL-GRAPH AUDIT =========================

    /**
     * Find all unique cycles in the graph. Each cycle lists its item ids with the first
     * and last element being the same.
     */
    public List<DependencyCycle> findCycles(Map<String, Set<String>> adjacency) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        Map<String, String> parent = new HashMap<>();
        Set<String> reportedCycles = new HashSet<>();

        for (String node : adjacency.keySet()) {
            if (!visited.contains(node)) {
                dfs(node, adjacency, visited, inStack, parent, cycles, reportedCycles);
            }
        }

        if (!cycles.isEmpty()) {
            log.warn("Found {} dependency cycle(s) across {} items", cycles.size(), adjacency.size());
        }
        return cycles.stream()
                .map(cycle -> DependencyCycle.builder()
                        .description("Circular dependency between content items: " + String.join(" -> ", cycle))
                        .cycle(cycle)
                        .build())
                .toList();
    }

    private void dfs(String node, Map<String, Set<String>> adjacency,
                     Set<String> visited, Set<String> inStack,
                     Map<String, String> parent,
                     List<List<String>> cycles, Set<String> reportedCycles) {
        visited.add(node);
        inStack.add(node);

        for (String neighbor : adjacency.getOrDefault(node, Collections.emptySet())) {
            if (!adjacency.containsKey(neighbor)) continue; // dangling, reported separately

            if (!visited.contains(neighbor)) {
                parent.put(neighbor, node);
                dfs(neighbor, adjacency, visited, inStack, parent, cycles, reportedCycles);
            } else if (inStack.contains(neighbor)) {
                List<String> cycle = reconstructCycle(neighbor, node, parent);
                if (reportedCycles.add(normalizeCycleKey(cycle))) {
                    cycles.add(cycle);
                }
            }
        }

        inStack.remove(node);
    }

    private List<String> reconstructCycle(String start, String end, Map<String, String> parent) {
        List<String> cycle = new ArrayList<>();
        cycle.add(end);

        String current = end;
        while (!current.equals(start)) {
            current = parent.get(current);
            cycle.add(current);
        }

        Collections.reverse(cycle);
        cycle.add(start);
        return cycle;
    }

    /**
     * Same cycle entered from a different node yields the same key.
     */
    private String normalizeCycleKey(List<String> cycle) {
        List<String> core = cycle.subList(0, cycle.size() - 1);
        int minIdx = core.indexOf(Collections.min(core));
        List<String> normalized = new ArrayList<>();
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        return normalized.toString();
    }
}

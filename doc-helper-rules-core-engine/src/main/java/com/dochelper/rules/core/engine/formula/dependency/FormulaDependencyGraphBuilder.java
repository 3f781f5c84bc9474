package com.dochelper.rules.core.engine.formula.dependency;

import com.dochelper.rules.core.engine.formula.parser.CompiledFormula;
import com.dochelper.rules.core.exception.formula.FormulaCycleException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds {@link FormulaDependencyGraph} instances using Kahn's algorithm. Ties
 * between fields that become ready together are broken by field id so the
 * order is deterministic.
 */
@Slf4j
public class FormulaDependencyGraphBuilder {

    /**
     * Builds the graph and rejects any circular dependency.
     */
    public FormulaDependencyGraph build(Map<String, CompiledFormula> formulas) throws FormulaCycleException {
        FormulaDependencyGraph graph = buildLenient(formulas);
        if (graph.hasCycles()) {
            throw new FormulaCycleException(findCyclePath(formulas, graph.getCyclicFields()));
        }
        return graph;
    }

    /**
     * Builds the graph even when cycles exist. Fields that cannot be ordered are
     * reported through {@link FormulaDependencyGraph#getCyclicFields()}.
     */
    public FormulaDependencyGraph buildLenient(Map<String, CompiledFormula> formulas) {
        Map<String, CompiledFormula> ordered = new LinkedHashMap<>(formulas);
        Map<String, Set<String>> dependents = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();

        for (String fieldId : ordered.keySet()) {
            inDegree.put(fieldId, 0);
        }
        for (Map.Entry<String, CompiledFormula> entry : ordered.entrySet()) {
            String fieldId = entry.getKey();
            for (String reference : entry.getValue().fieldReferences()) {
                dependents.computeIfAbsent(reference, key -> new LinkedHashSet<>()).add(fieldId);
                if (ordered.containsKey(reference)) {
                    inDegree.merge(fieldId, 1, Integer::sum);
                }
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((fieldId, degree) -> {
            if (degree == 0) {
                ready.add(fieldId);
            }
        });

        List<String> evaluationOrder = new ArrayList<>();
        while (!ready.isEmpty()) {
            String fieldId = ready.poll();
            evaluationOrder.add(fieldId);
            for (String dependent : dependents.getOrDefault(fieldId, Set.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        Set<String> cyclicFields = new TreeSet<>(ordered.keySet());
        evaluationOrder.forEach(cyclicFields::remove);
        if (!cyclicFields.isEmpty()) {
            log.warn("Formula fields excluded from evaluation order due to circular dependencies: {}", cyclicFields);
        }
        return new FormulaDependencyGraph(ordered, dependents, evaluationOrder, cyclicFields);
    }

    private List<String> findCyclePath(Map<String, CompiledFormula> formulas, Set<String> candidates) {
        Set<String> visited = new LinkedHashSet<>();
        for (String start : new TreeSet<>(candidates)) {
            List<String> path = new ArrayList<>();
            List<String> cycle = depthFirst(start, formulas, visited, path, new LinkedHashSet<>());
            if (cycle != null) {
                return cycle;
            }
        }
        return new ArrayList<>(candidates);
    }

    private List<String> depthFirst(String fieldId,
                                    Map<String, CompiledFormula> formulas,
                                    Set<String> visited,
                                    List<String> path,
                                    Set<String> onPath) {
        if (onPath.contains(fieldId)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(fieldId), path.size()));
            cycle.add(fieldId);
            return cycle;
        }
        if (!visited.add(fieldId)) {
            return null;
        }
        path.add(fieldId);
        onPath.add(fieldId);
        for (String reference : new TreeSet<>(formulas.get(fieldId).fieldReferences())) {
            if (formulas.containsKey(reference)) {
                List<String> cycle = depthFirst(reference, formulas, visited, path, onPath);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(fieldId);
        return null;
    }
}

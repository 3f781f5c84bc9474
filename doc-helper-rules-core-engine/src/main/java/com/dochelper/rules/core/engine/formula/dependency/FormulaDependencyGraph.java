package com.dochelper.rules.core.engine.formula.dependency;

import com.dochelper.rules.core.engine.formula.parser.CompiledFormula;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable dependency graph of the formula fields of one rule set.
 *
 * <p>Edges run from a referenced field to the formula fields that read it.
 * {@link #getEvaluationOrder()} lists every orderable formula field so that
 * each one appears after all formula fields it depends on. Formula fields that
 * sit on or downstream of a cycle are excluded from the order and reported by
 * {@link #getCyclicFields()}.</p>
 */
public class FormulaDependencyGraph {

    private final Map<String, CompiledFormula> formulas;
    private final Map<String, Set<String>> dependents;
    private final List<String> evaluationOrder;
    private final Set<String> cyclicFields;
    private final Map<String, Integer> orderIndex;

    FormulaDependencyGraph(Map<String, CompiledFormula> formulas,
                           Map<String, Set<String>> dependents,
                           List<String> evaluationOrder,
                           Set<String> cyclicFields) {
        this.formulas = Collections.unmodifiableMap(formulas);
        this.dependents = Collections.unmodifiableMap(dependents);
        this.evaluationOrder = List.copyOf(evaluationOrder);
        this.cyclicFields = Collections.unmodifiableSet(new LinkedHashSet<>(cyclicFields));
        this.orderIndex = new HashMap<>();
        for (int i = 0; i < this.evaluationOrder.size(); i++) {
            orderIndex.put(this.evaluationOrder.get(i), i);
        }
    }

    public boolean isFormulaField(String fieldId) {
        return formulas.containsKey(fieldId);
    }

    public CompiledFormula getFormula(String fieldId) {
        return formulas.get(fieldId);
    }

    public Set<String> getFormulaFields() {
        return formulas.keySet();
    }

    public Set<String> getDependencies(String fieldId) {
        CompiledFormula formula = formulas.get(fieldId);
        return formula == null ? Set.of() : formula.fieldReferences();
    }

    public Set<String> getDependents(String fieldId) {
        return dependents.getOrDefault(fieldId, Set.of());
    }

    public List<String> getEvaluationOrder() {
        return evaluationOrder;
    }

    public Set<String> getCyclicFields() {
        return cyclicFields;
    }

    public boolean hasCycles() {
        return !cyclicFields.isEmpty();
    }

    /**
     * Formula fields whose value may change when any of the given fields change:
     * the changed fields themselves when they are formulas, plus every
     * transitive dependent.
     */
    public Set<String> getAffectedFormulaFields(Collection<String> changedFieldIds) {
        Set<String> affected = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(changedFieldIds);
        for (String changed : changedFieldIds) {
            if (isFormulaField(changed)) {
                affected.add(changed);
            }
        }
        while (!pending.isEmpty()) {
            String fieldId = pending.poll();
            for (String dependent : getDependents(fieldId)) {
                if (affected.add(dependent)) {
                    pending.add(dependent);
                }
            }
        }
        return affected;
    }

    /**
     * Orders the given formula fields by evaluation order. Cyclic fields are dropped.
     */
    public List<String> inEvaluationOrder(Collection<String> formulaFieldIds) {
        return formulaFieldIds.stream()
                .filter(orderIndex::containsKey)
                .sorted((left, right) -> Integer.compare(orderIndex.get(left), orderIndex.get(right)))
                .toList();
    }
}

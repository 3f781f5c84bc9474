package com.dochelper.rules.core.engine.formula.scheduler;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per field outcomes of one recompute pass, in evaluation order.
 */
@ToString
public class FormulaRecomputeResult {

    private final Map<String, FormulaFieldOutcome> outcomes;

    FormulaRecomputeResult(Map<String, FormulaFieldOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public static FormulaRecomputeResult empty() {
        return new FormulaRecomputeResult(Map.of());
    }

    public Map<String, FormulaFieldOutcome> getOutcomes() {
        return outcomes;
    }

    public List<String> getEvaluatedFieldIds() {
        return List.copyOf(outcomes.keySet());
    }

    public Set<String> getChangedFieldIds() {
        Set<String> changed = new LinkedHashSet<>();
        outcomes.values().stream()
                .filter(FormulaFieldOutcome::changed)
                .forEach(outcome -> changed.add(outcome.fieldId()));
        return changed;
    }

    public Map<String, FormulaEvaluationError> getErrors() {
        Map<String, FormulaEvaluationError> errors = new LinkedHashMap<>();
        outcomes.values().stream()
                .filter(FormulaFieldOutcome::isFailure)
                .forEach(outcome -> errors.put(outcome.fieldId(), outcome.error()));
        return errors;
    }

    public boolean hasErrors() {
        return outcomes.values().stream().anyMatch(FormulaFieldOutcome::isFailure);
    }
}

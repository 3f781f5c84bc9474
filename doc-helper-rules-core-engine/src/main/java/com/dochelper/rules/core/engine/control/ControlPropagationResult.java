package com.dochelper.rules.core.engine.control;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaRecomputeResult;
import com.dochelper.rules.core.engine.override.OverrideConflict;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effects, errors and formula recomputations of one propagation pass, plus the
 * override conflicts it found. Effects applied before an error stay applied.
 */
@ToString
public class ControlPropagationResult {
    private final List<AppliedControlEffect> appliedEffects = new ArrayList<>();
    private final List<ControlPropagationError> errors = new ArrayList<>();
    private final Map<String, FormulaEvaluationError> formulaErrors = new LinkedHashMap<>();
    private final Set<String> recomputedFormulaFields = new LinkedHashSet<>();
    private final Map<String, OverrideConflict> overrideConflicts = new LinkedHashMap<>();
    @Getter
    private int maxDepthReached;

    void addEffect(AppliedControlEffect effect) {
        appliedEffects.add(effect);
        maxDepthReached = Math.max(maxDepthReached, effect.depth());
    }

    void addError(ControlPropagationError error) {
        errors.add(error);
    }

    void addOverrideConflict(OverrideConflict conflict) {
        overrideConflicts.put(conflict.getFieldId(), conflict);
    }

    void addFormulaResult(FormulaRecomputeResult result) {
        recomputedFormulaFields.addAll(result.getEvaluatedFieldIds());
        result.getOutcomes().values().forEach(outcome -> {
            if (outcome.isFailure()) {
                formulaErrors.put(outcome.fieldId(), outcome.error());
            } else {
                formulaErrors.remove(outcome.fieldId());
            }
        });
    }

    public List<AppliedControlEffect> getAppliedEffects() {
        return Collections.unmodifiableList(appliedEffects);
    }

    public List<ControlPropagationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Map<String, FormulaEvaluationError> getFormulaErrors() {
        return Collections.unmodifiableMap(formulaErrors);
    }

    public Set<String> getRecomputedFormulaFields() {
        return Collections.unmodifiableSet(recomputedFormulaFields);
    }

    /**
     * Conflicts between overrides and control rule values found in this pass,
     * one per field.
     */
    public List<OverrideConflict> getOverrideConflicts() {
        return List.copyOf(overrideConflicts.values());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package com.dochelper.rules.core.engine.formula.scheduler;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;

/**
 * Result of recomputing one formula field. On failure {@code value} is the
 * last valid value the field keeps.
 */
public record FormulaFieldOutcome(String fieldId,
                                  Object previousValue,
                                  Object value,
                                  FormulaEvaluationError error,
                                  boolean changed) {

    public boolean isFailure() {
        return error != null;
    }
}

package com.dochelper.rules.core.engine.formula.evaluator;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of evaluating one formula: either a value (possibly null) or an error.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FormulaEvaluationResult {
    private final boolean success;
    private final Object value;
    private final FormulaEvaluationError error;

    public static FormulaEvaluationResult success(Object value) {
        return new FormulaEvaluationResult(true, value, null);
    }

    public static FormulaEvaluationResult failure(FormulaEvaluationError error) {
        return new FormulaEvaluationResult(false, null, error);
    }

    public boolean isFailure() {
        return !success;
    }
}

package com.dochelper.rules.core.engine.formula.evaluator;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import lombok.Getter;

/**
 * Raised inside an evaluation and converted to a {@link FormulaEvaluationResult}
 * failure by {@link SafeFormulaEvaluator}. Never escapes the evaluator.
 */
@Getter
public class FormulaEvaluationException extends DocHelperRulesRuntimeException {
    private final FormulaEvaluationError error;

    public FormulaEvaluationException(DocHelperRulesErrorCodes errorCode, String message) {
        super(message);
        this.error = FormulaEvaluationError.of(errorCode, message);
    }

    public static FormulaEvaluationException typeMismatch(String operation, Object value) {
        return new FormulaEvaluationException(
                DocHelperRulesErrorCodes.TYPE_MISMATCH,
                String.format("%s expects a number but got %s", operation, describe(value)));
    }

    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName() + " [" + value + "]";
    }
}

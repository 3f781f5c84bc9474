package com.dochelper.rules.core.engine.formula.evaluator;

import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;

/**
 * Structured reason a formula could not produce a value.
 */
public record FormulaEvaluationError(DocHelperRulesErrorCodes errorCode, String message) {

    public static FormulaEvaluationError of(DocHelperRulesErrorCodes errorCode, String message) {
        return new FormulaEvaluationError(errorCode, message);
    }

    @Override
    public String toString() {
        return errorCode.getErrorCode() + " " + errorCode.name() + ": " + message;
    }
}

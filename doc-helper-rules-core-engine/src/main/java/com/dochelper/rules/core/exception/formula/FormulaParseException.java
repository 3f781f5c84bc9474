package com.dochelper.rules.core.exception.formula;

import com.dochelper.rules.core.exception.DocHelperRulesException;
import lombok.Getter;

/**
 * Thrown when formula text is not syntactically valid. Carries the offending
 * expression and the zero based character position where parsing stopped.
 */
@Getter
public class FormulaParseException extends DocHelperRulesException {

    private final String reason;
    private final String expression;
    private final int position;

    public FormulaParseException(String reason, String expression, int position) {
        super(String.format("%s at position %d in formula [%s]", reason, position, expression));
        this.reason = reason;
        this.expression = expression;
        this.position = position;
    }

    public FormulaParseException forField(String fieldId) {
        return new FormulaParseException("Field [" + fieldId + "]: " + reason, expression, position);
    }

    public FormulaParseException forControlRule(String ruleId) {
        return new FormulaParseException("Condition of control rule [" + ruleId + "]: " + reason, expression, position);
    }
}

package com.dochelper.rules.core.engine.formula.parser;

/**
 * Lexical token. {@code value} holds the decoded literal for numbers and strings
 * and the field id for field references.
 */
public record FormulaToken(FormulaTokenType type, String text, Object value, int position) {

    public boolean is(FormulaTokenType expected) {
        return type == expected;
    }
}

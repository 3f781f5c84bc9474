package com.dochelper.rules.core.engine.formula.parser;

public enum FormulaTokenType {
    NUMBER,
    STRING,
    IDENTIFIER,
    FIELD_REFERENCE,
    TRUE,
    FALSE,
    NULL,
    AND,
    OR,
    NOT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    POWER,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    EOF
}

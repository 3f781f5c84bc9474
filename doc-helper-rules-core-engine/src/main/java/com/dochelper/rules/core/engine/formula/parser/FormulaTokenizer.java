package com.dochelper.rules.core.engine.formula.parser;

import com.dochelper.rules.core.exception.formula.FormulaParseException;
import com.dochelper.rules.core.util.CastUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits formula text into tokens. Field references are written either as
 * {@code {{field_id}}} or as a bare identifier.
 */
public class FormulaTokenizer {

    private static final Map<String, FormulaTokenType> KEYWORDS = Map.of(
            "true", FormulaTokenType.TRUE,
            "false", FormulaTokenType.FALSE,
            "null", FormulaTokenType.NULL,
            "and", FormulaTokenType.AND,
            "or", FormulaTokenType.OR,
            "not", FormulaTokenType.NOT
    );

    private final String expression;
    private int position;

    public FormulaTokenizer(String expression) {
        this.expression = expression;
        this.position = 0;
    }

    public List<FormulaToken> tokenize() throws FormulaParseException {
        List<FormulaToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= expression.length()) {
                tokens.add(new FormulaToken(FormulaTokenType.EOF, "", null, position));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private FormulaToken nextToken() throws FormulaParseException {
        char current = expression.charAt(position);
        int start = position;

        if (current == '{' && peek(1) == '{') {
            return readFieldReference();
        }
        if (Character.isDigit(current) || (current == '.' && Character.isDigit(peek(1)))) {
            return readNumber();
        }
        if (current == '"' || current == '\'') {
            return readString(current);
        }
        if (Character.isLetter(current) || current == '_') {
            return readIdentifier();
        }

        switch (current) {
            case '*':
                if (peek(1) == '*') {
                    position += 2;
                    return new FormulaToken(FormulaTokenType.POWER, "**", null, start);
                }
                return single(FormulaTokenType.STAR);
            case '=':
                if (peek(1) == '=') {
                    position += 2;
                    return new FormulaToken(FormulaTokenType.EQUAL, "==", null, start);
                }
                throw new FormulaParseException("Unexpected '=' (use '==' for comparison)", expression, start);
            case '!':
                if (peek(1) == '=') {
                    position += 2;
                    return new FormulaToken(FormulaTokenType.NOT_EQUAL, "!=", null, start);
                }
                throw new FormulaParseException("Unexpected '!' (use 'not')", expression, start);
            case '<':
                if (peek(1) == '=') {
                    position += 2;
                    return new FormulaToken(FormulaTokenType.LESS_THAN_OR_EQUAL, "<=", null, start);
                }
                return single(FormulaTokenType.LESS_THAN);
            case '>':
                if (peek(1) == '=') {
                    position += 2;
                    return new FormulaToken(FormulaTokenType.GREATER_THAN_OR_EQUAL, ">=", null, start);
                }
                return single(FormulaTokenType.GREATER_THAN);
            case '+':
                return single(FormulaTokenType.PLUS);
            case '-':
                return single(FormulaTokenType.MINUS);
            case '/':
                return single(FormulaTokenType.SLASH);
            case '%':
                return single(FormulaTokenType.PERCENT);
            case '(':
                return single(FormulaTokenType.LEFT_PAREN);
            case ')':
                return single(FormulaTokenType.RIGHT_PAREN);
            case ',':
                return single(FormulaTokenType.COMMA);
            default:
                throw new FormulaParseException("Unexpected character '" + current + "'", expression, start);
        }
    }

    private FormulaToken single(FormulaTokenType type) {
        int start = position;
        position++;
        return new FormulaToken(type, expression.substring(start, position), null, start);
    }

    private FormulaToken readFieldReference() throws FormulaParseException {
        int start = position;
        int close = expression.indexOf("}}", position + 2);
        if (close < 0) {
            throw new FormulaParseException("Unterminated field reference", expression, start);
        }
        String fieldId = expression.substring(position + 2, close).trim();
        if (fieldId.isEmpty() || !isIdentifier(fieldId)) {
            throw new FormulaParseException("Invalid field reference '" + fieldId + "'", expression, start);
        }
        position = close + 2;
        return new FormulaToken(FormulaTokenType.FIELD_REFERENCE, expression.substring(start, position), fieldId, start);
    }

    private FormulaToken readNumber() throws FormulaParseException {
        int start = position;
        while (position < expression.length() && Character.isDigit(expression.charAt(position))) {
            position++;
        }
        if (position < expression.length() && expression.charAt(position) == '.') {
            position++;
            while (position < expression.length() && Character.isDigit(expression.charAt(position))) {
                position++;
            }
        }
        if (position < expression.length() && (expression.charAt(position) == 'e' || expression.charAt(position) == 'E')) {
            int exponentStart = position;
            position++;
            if (position < expression.length() && (expression.charAt(position) == '+' || expression.charAt(position) == '-')) {
                position++;
            }
            if (position >= expression.length() || !Character.isDigit(expression.charAt(position))) {
                throw new FormulaParseException("Malformed number exponent", expression, exponentStart);
            }
            while (position < expression.length() && Character.isDigit(expression.charAt(position))) {
                position++;
            }
        }
        String text = expression.substring(start, position);
        BigDecimal value;
        try {
            value = new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Malformed number", expression, start);
        }
        if (!CastUtil.isWithinPlainRange(value)) {
            throw new FormulaParseException("Number out of range", expression, start);
        }
        return new FormulaToken(FormulaTokenType.NUMBER, text, value, start);
    }

    private FormulaToken readString(char quote) throws FormulaParseException {
        int start = position;
        position++;
        StringBuilder value = new StringBuilder();
        while (position < expression.length()) {
            char current = expression.charAt(position);
            if (current == quote) {
                position++;
                return new FormulaToken(FormulaTokenType.STRING, expression.substring(start, position), value.toString(), start);
            }
            if (current == '\\' && position + 1 < expression.length()) {
                char escaped = expression.charAt(position + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
                position += 2;
                continue;
            }
            value.append(current);
            position++;
        }
        throw new FormulaParseException("Unterminated string literal", expression, start);
    }

    private FormulaToken readIdentifier() {
        int start = position;
        while (position < expression.length() && isIdentifierPart(expression.charAt(position))) {
            position++;
        }
        String text = expression.substring(start, position);
        FormulaTokenType keyword = KEYWORDS.get(text);
        if (keyword != null) {
            return new FormulaToken(keyword, text, null, start);
        }
        return new FormulaToken(FormulaTokenType.IDENTIFIER, text, text, start);
    }

    private void skipWhitespace() {
        while (position < expression.length() && Character.isWhitespace(expression.charAt(position))) {
            position++;
        }
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < expression.length() ? expression.charAt(index) : '\0';
    }

    private static boolean isIdentifier(String text) {
        if (!Character.isLetter(text.charAt(0)) && text.charAt(0) != '_') {
            return false;
        }
        return text.chars().allMatch(c -> isIdentifierPart((char) c));
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}

package com.dochelper.rules.core.engine.formula.parser;

import com.dochelper.rules.core.engine.formula.ast.BinaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.BinaryOperator;
import com.dochelper.rules.core.engine.formula.ast.FieldReferenceNode;
import com.dochelper.rules.core.engine.formula.ast.FormulaNode;
import com.dochelper.rules.core.engine.formula.ast.FunctionCallNode;
import com.dochelper.rules.core.engine.formula.ast.LiteralNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperator;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import com.dochelper.rules.core.util.CommonUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for formula expressions.
 *
 * <p>Precedence, lowest first:</p>
 * <ol>
 *   <li>{@code or}</li>
 *   <li>{@code and}</li>
 *   <li>{@code not}</li>
 *   <li>comparison: {@code == != < <= > >=}</li>
 *   <li>additive: {@code + -}</li>
 *   <li>multiplicative: {@code * / %}</li>
 *   <li>power: {@code **} (right associative)</li>
 *   <li>unary: {@code - +}</li>
 *   <li>literals, field references, function calls and parenthesised expressions</li>
 * </ol>
 *
 * <p>The grammar has no assignment, member access or indexing. An identifier
 * followed by {@code (} is a function call, any other identifier is a field
 * reference.</p>
 *
 * <p>Formulas are limited to {@value #MAX_TOKENS} tokens and
 * {@value #MAX_NESTING_DEPTH} levels of nesting, so that evaluating the tree
 * stays within the stack.</p>
 */
public class FormulaParser {

    public static final int MAX_NESTING_DEPTH = 256;
    public static final int MAX_TOKENS = 1024;

    private static final Map<FormulaTokenType, BinaryOperator> COMPARISON_OPERATORS = Map.of(
            FormulaTokenType.EQUAL, BinaryOperator.EQUAL,
            FormulaTokenType.NOT_EQUAL, BinaryOperator.NOT_EQUAL,
            FormulaTokenType.LESS_THAN, BinaryOperator.LESS_THAN,
            FormulaTokenType.LESS_THAN_OR_EQUAL, BinaryOperator.LESS_THAN_OR_EQUAL,
            FormulaTokenType.GREATER_THAN, BinaryOperator.GREATER_THAN,
            FormulaTokenType.GREATER_THAN_OR_EQUAL, BinaryOperator.GREATER_THAN_OR_EQUAL
    );

    private final String expression;
    private List<FormulaToken> tokens;
    private int current;
    private int depth;

    public FormulaParser(String expression) {
        this.expression = expression;
    }

    public FormulaNode parse() throws FormulaParseException {
        if (CommonUtil.isNullOrBlank(expression)) {
            throw new FormulaParseException("Empty formula", String.valueOf(expression), 0);
        }
        this.tokens = new FormulaTokenizer(expression).tokenize();
        if (tokens.size() - 1 > MAX_TOKENS) {
            throw new FormulaParseException("Formula exceeds " + MAX_TOKENS + " tokens", expression, tokens.get(MAX_TOKENS).position());
        }
        this.current = 0;
        this.depth = 0;

        FormulaNode root = parseOr();
        if (!peek().is(FormulaTokenType.EOF)) {
            throw error("Unexpected token '" + peek().text() + "'");
        }
        return root;
    }

    private FormulaNode parseOr() throws FormulaParseException {
        FormulaNode left = parseAnd();
        while (match(FormulaTokenType.OR)) {
            left = new BinaryOperationNode(BinaryOperator.OR, left, parseAnd());
        }
        return left;
    }

    private FormulaNode parseAnd() throws FormulaParseException {
        FormulaNode left = parseNot();
        while (match(FormulaTokenType.AND)) {
            left = new BinaryOperationNode(BinaryOperator.AND, left, parseNot());
        }
        return left;
    }

    private FormulaNode parseNot() throws FormulaParseException {
        if (match(FormulaTokenType.NOT)) {
            return new UnaryOperationNode(UnaryOperator.NOT, nested(this::parseNot));
        }
        return parseComparison();
    }

    private FormulaNode parseComparison() throws FormulaParseException {
        FormulaNode left = parseAdditive();
        while (COMPARISON_OPERATORS.containsKey(peek().type())) {
            BinaryOperator operator = COMPARISON_OPERATORS.get(advance().type());
            left = new BinaryOperationNode(operator, left, parseAdditive());
        }
        return left;
    }

    private FormulaNode parseAdditive() throws FormulaParseException {
        FormulaNode left = parseMultiplicative();
        while (peek().is(FormulaTokenType.PLUS) || peek().is(FormulaTokenType.MINUS)) {
            BinaryOperator operator = advance().is(FormulaTokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = new BinaryOperationNode(operator, left, parseMultiplicative());
        }
        return left;
    }

    private FormulaNode parseMultiplicative() throws FormulaParseException {
        FormulaNode left = parsePower();
        while (peek().is(FormulaTokenType.STAR) || peek().is(FormulaTokenType.SLASH) || peek().is(FormulaTokenType.PERCENT)) {
            FormulaToken token = advance();
            BinaryOperator operator = switch (token.type()) {
                case STAR -> BinaryOperator.MULTIPLY;
                case SLASH -> BinaryOperator.DIVIDE;
                default -> BinaryOperator.MODULO;
            };
            left = new BinaryOperationNode(operator, left, parsePower());
        }
        return left;
    }

    private FormulaNode parsePower() throws FormulaParseException {
        FormulaNode base = parseUnary();
        if (match(FormulaTokenType.POWER)) {
            return new BinaryOperationNode(BinaryOperator.POWER, base, nested(this::parsePower));
        }
        return base;
    }

    private FormulaNode parseUnary() throws FormulaParseException {
        if (match(FormulaTokenType.MINUS)) {
            return new UnaryOperationNode(UnaryOperator.NEGATE, nested(this::parseUnary));
        }
        if (match(FormulaTokenType.PLUS)) {
            return new UnaryOperationNode(UnaryOperator.PLUS, nested(this::parseUnary));
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() throws FormulaParseException {
        FormulaToken token = peek();
        switch (token.type()) {
            case NUMBER:
            case STRING:
                advance();
                return new LiteralNode(token.value());
            case TRUE:
                advance();
                return new LiteralNode(Boolean.TRUE);
            case FALSE:
                advance();
                return new LiteralNode(Boolean.FALSE);
            case NULL:
                advance();
                return new LiteralNode(null);
            case FIELD_REFERENCE:
                advance();
                return new FieldReferenceNode((String) token.value());
            case IDENTIFIER:
                advance();
                if (match(FormulaTokenType.LEFT_PAREN)) {
                    return new FunctionCallNode(token.text(), parseArguments());
                }
                return new FieldReferenceNode(token.text());
            case LEFT_PAREN:
                advance();
                FormulaNode inner = nested(this::parseOr);
                expect(FormulaTokenType.RIGHT_PAREN, "Expected ')'");
                return inner;
            case EOF:
                throw error("Unexpected end of formula");
            default:
                throw error("Unexpected token '" + token.text() + "'");
        }
    }

    private List<FormulaNode> parseArguments() throws FormulaParseException {
        List<FormulaNode> arguments = new ArrayList<>();
        if (match(FormulaTokenType.RIGHT_PAREN)) {
            return arguments;
        }
        do {
            arguments.add(nested(this::parseOr));
        } while (match(FormulaTokenType.COMMA));
        expect(FormulaTokenType.RIGHT_PAREN, "Expected ')' after function arguments");
        return arguments;
    }

    private FormulaNode nested(ParseStep step) throws FormulaParseException {
        if (++depth > MAX_NESTING_DEPTH) {
            throw error("Formula nesting exceeds " + MAX_NESTING_DEPTH + " levels");
        }
        try {
            return step.parse();
        } finally {
            depth--;
        }
    }

    private FormulaToken peek() {
        return tokens.get(current);
    }

    private FormulaToken advance() {
        FormulaToken token = tokens.get(current);
        if (!token.is(FormulaTokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(FormulaTokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(FormulaTokenType type, String message) throws FormulaParseException {
        if (!match(type)) {
            throw error(message);
        }
    }

    private FormulaParseException error(String message) {
        return new FormulaParseException(message, expression, peek().position());
    }

    @FunctionalInterface
    private interface ParseStep {
        FormulaNode parse() throws FormulaParseException;
    }
}

package com.dochelper.rules.core.engine.formula.evaluator;

import com.dochelper.rules.core.engine.formula.ast.BinaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.FieldReferenceNode;
import com.dochelper.rules.core.engine.formula.ast.FormulaNode;
import com.dochelper.rules.core.engine.formula.ast.FunctionCallNode;
import com.dochelper.rules.core.engine.formula.ast.IFormulaNodeVisitor;
import com.dochelper.rules.core.engine.formula.ast.LiteralNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperationNode;
import com.dochelper.rules.core.engine.formula.functions.FormulaFunctionRegistry;
import com.dochelper.rules.core.engine.formula.functions.IFormulaFunction;
import com.dochelper.rules.core.engine.formula.functions.InvalidFormulaFunctionInputException;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.util.CastUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks a parsed formula against a snapshot of field values.
 *
 * <p>Evaluation is pure: the only inputs are the tree, the snapshot and the
 * whitelisted functions of {@link FormulaFunctionRegistry}. Every failure is
 * returned as a {@link FormulaEvaluationResult} and nothing is thrown to the
 * caller.</p>
 */
@Slf4j
public class SafeFormulaEvaluator {

    private final FormulaFunctionRegistry functionRegistry;
    private final MathContext mathContext;

    public SafeFormulaEvaluator(FormulaFunctionRegistry functionRegistry, MathContext mathContext) {
        this.functionRegistry = functionRegistry;
        this.mathContext = mathContext;
    }

    public SafeFormulaEvaluator(MathContext mathContext) {
        this(FormulaFunctionRegistry.getInstance(), mathContext);
    }

    /**
     * @param root     parsed formula
     * @param snapshot field id to value; a referenced id missing from the map is
     *                 reported as {@link DocHelperRulesErrorCodes#FIELD_NOT_FOUND}
     */
    public FormulaEvaluationResult evaluate(FormulaNode root, Map<String, Object> snapshot) {
        try {
            Object value = root.accept(new EvaluatingVisitor(snapshot));
            return FormulaEvaluationResult.success(value);
        } catch (FormulaEvaluationException e) {
            log.debug("Formula evaluation failed: {}", e.getError());
            return FormulaEvaluationResult.failure(e.getError());
        } catch (ArithmeticException e) {
            log.debug("Formula arithmetic failed: {}", e.getMessage());
            return FormulaEvaluationResult.failure(
                    FormulaEvaluationError.of(DocHelperRulesErrorCodes.FUNCTION_EXECUTION_FAILED, e.getMessage()));
        }
    }

    private final class EvaluatingVisitor implements IFormulaNodeVisitor<Object> {
        private final Map<String, Object> snapshot;

        private EvaluatingVisitor(Map<String, Object> snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public Object visitLiteral(LiteralNode node) {
            return node.value();
        }

        @Override
        public Object visitFieldReference(FieldReferenceNode node) {
            if (!snapshot.containsKey(node.fieldId())) {
                throw new FormulaEvaluationException(
                        DocHelperRulesErrorCodes.FIELD_NOT_FOUND,
                        "Unknown field reference [" + node.fieldId() + "]");
            }
            return FormulaValues.normalize(snapshot.get(node.fieldId()));
        }

        @Override
        public Object visitUnaryOperation(UnaryOperationNode node) {
            Object operand = node.operand().accept(this);
            switch (node.operator()) {
                case NOT:
                    return !CastUtil.isTruthy(operand);
                case NEGATE:
                    return FormulaValues.requireNumber("unary -", operand).negate();
                case PLUS:
                default:
                    return FormulaValues.requireNumber("unary +", operand);
            }
        }

        @Override
        public Object visitBinaryOperation(BinaryOperationNode node) {
            switch (node.operator()) {
                case AND:
                    return CastUtil.isTruthy(node.left().accept(this)) && CastUtil.isTruthy(node.right().accept(this));
                case OR:
                    return CastUtil.isTruthy(node.left().accept(this)) || CastUtil.isTruthy(node.right().accept(this));
                default:
                    break;
            }

            Object left = node.left().accept(this);
            Object right = node.right().accept(this);
            String operation = "operator " + node.operator().getSymbol();
            switch (node.operator()) {
                case EQUAL:
                    return FormulaValues.valuesEqual(left, right);
                case NOT_EQUAL:
                    return !FormulaValues.valuesEqual(left, right);
                case LESS_THAN:
                    return FormulaValues.compare(operation, left, right) < 0;
                case LESS_THAN_OR_EQUAL:
                    return FormulaValues.compare(operation, left, right) <= 0;
                case GREATER_THAN:
                    return FormulaValues.compare(operation, left, right) > 0;
                case GREATER_THAN_OR_EQUAL:
                    return FormulaValues.compare(operation, left, right) >= 0;
                case ADD:
                    if (left instanceof String leftText && right instanceof String rightText
                            && !(CastUtil.isNumeric(leftText) && CastUtil.isNumeric(rightText))) {
                        return leftText + rightText;
                    }
                    return FormulaValues.requireWithinRange(operation, number(operation, left).add(number(operation, right), mathContext));
                case SUBTRACT:
                    return FormulaValues.requireWithinRange(operation, number(operation, left).subtract(number(operation, right), mathContext));
                case MULTIPLY:
                    return FormulaValues.requireWithinRange(operation, number(operation, left).multiply(number(operation, right), mathContext));
                case DIVIDE:
                    return FormulaValues.requireWithinRange(operation, FormulaValues.divide(number(operation, left), number(operation, right), mathContext));
                case MODULO:
                    return FormulaValues.modulo(number(operation, left), number(operation, right), mathContext);
                case POWER:
                    return FormulaValues.power(number(operation, left), number(operation, right), mathContext);
                default:
                    throw new FormulaEvaluationException(
                            DocHelperRulesErrorCodes.TYPE_MISMATCH, "Unsupported operator " + node.operator());
            }
        }

        @Override
        public Object visitFunctionCall(FunctionCallNode node) {
            IFormulaFunction function = functionRegistry.findFunction(node.functionName())
                    .orElseThrow(() -> new FormulaEvaluationException(
                            DocHelperRulesErrorCodes.UNKNOWN_FUNCTION,
                            "Unknown function [" + node.functionName() + "]"));

            List<Object> arguments = new ArrayList<>(node.arguments().size());
            for (FormulaNode argument : node.arguments()) {
                arguments.add(argument.accept(this));
            }
            try {
                function.validate(arguments);
            } catch (InvalidFormulaFunctionInputException e) {
                throw new FormulaEvaluationException(DocHelperRulesErrorCodes.INVALID_ARGUMENT_COUNT, e.getMessage());
            }
            return FormulaValues.normalize(function.execute(arguments, mathContext));
        }

        private BigDecimal number(String operation, Object value) {
            return FormulaValues.requireNumber(operation, value);
        }
    }
}

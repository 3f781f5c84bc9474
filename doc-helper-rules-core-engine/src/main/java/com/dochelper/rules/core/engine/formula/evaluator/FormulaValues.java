package com.dochelper.rules.core.engine.formula.evaluator;

import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.util.CastUtil;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Operand coercion and arithmetic shared by the evaluator and the built-in
 * functions. Numbers are BigDecimal; numeric text is accepted where a number is
 * expected.
 */
public final class FormulaValues {

    private static final BigDecimal MAX_INTEGRAL_EXPONENT = BigDecimal.valueOf(999_999_999L);

    private FormulaValues() {
    }

    public static BigDecimal requireNumber(String operation, Object value) {
        if (value instanceof Boolean) {
            throw FormulaEvaluationException.typeMismatch(operation, value);
        }
        BigDecimal decimal = CastUtil.toDecimal(value);
        if (decimal == null) {
            throw FormulaEvaluationException.typeMismatch(operation, value);
        }
        return requireWithinRange(operation, decimal);
    }

    /**
     * Rejects numbers whose decimal exponent exceeds
     * {@link CastUtil#MAX_PLAIN_EXPONENT}.
     */
    public static BigDecimal requireWithinRange(String operation, BigDecimal decimal) {
        if (!CastUtil.isWithinPlainRange(decimal)) {
            throw new FormulaEvaluationException(
                    DocHelperRulesErrorCodes.FUNCTION_EXECUTION_FAILED,
                    String.format("%s produced a number beyond 1E%d in magnitude", operation, CastUtil.MAX_PLAIN_EXPONENT));
        }
        return decimal;
    }

    public static int requireInteger(String operation, Object value) {
        BigDecimal decimal = requireNumber(operation, value);
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException e) {
            throw new FormulaEvaluationException(
                    DocHelperRulesErrorCodes.TYPE_MISMATCH,
                    operation + " expects an integer but got " + decimal.toPlainString());
        }
    }

    public static Object normalize(Object value) {
        if (value instanceof Number) {
            BigDecimal decimal = CastUtil.toDecimal(value);
            return decimal != null ? requireWithinRange("value", decimal) : value;
        }
        return value;
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor, MathContext mathContext) {
        if (divisor.signum() == 0) {
            throw new FormulaEvaluationException(DocHelperRulesErrorCodes.DIVISION_BY_ZERO, "Division by zero");
        }
        return dividend.divide(divisor, mathContext);
    }

    /**
     * Remainder with the sign of the divisor.
     */
    public static BigDecimal modulo(BigDecimal dividend, BigDecimal divisor, MathContext mathContext) {
        if (divisor.signum() == 0) {
            throw new FormulaEvaluationException(DocHelperRulesErrorCodes.DIVISION_BY_ZERO, "Modulo by zero");
        }
        BigDecimal remainder = dividend.remainder(divisor, mathContext);
        if (remainder.signum() != 0 && remainder.signum() != divisor.signum()) {
            remainder = remainder.add(divisor, mathContext);
        }
        return remainder;
    }

    public static BigDecimal power(BigDecimal base, BigDecimal exponent, MathContext mathContext) {
        boolean integral = exponent.signum() == 0 || exponent.stripTrailingZeros().scale() <= 0;
        if (integral && exponent.abs().compareTo(MAX_INTEGRAL_EXPONENT) <= 0) {
            if (base.signum() == 0 && exponent.signum() < 0) {
                throw new FormulaEvaluationException(DocHelperRulesErrorCodes.DIVISION_BY_ZERO,
                        "Zero cannot be raised to a negative power");
            }
            return requireWithinRange("operator **", base.pow(exponent.intValueExact(), mathContext));
        }
        double result = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new FormulaEvaluationException(DocHelperRulesErrorCodes.FUNCTION_EXECUTION_FAILED,
                    String.format("Power %s ** %s has no finite real result", base.toPlainString(), exponent.toPlainString()));
        }
        return requireWithinRange("operator **", new BigDecimal(result, mathContext));
    }

    /**
     * Equality across types: numbers (and numeric text) compare numerically,
     * anything else compares on its canonical text.
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (!(left instanceof Boolean) && !(right instanceof Boolean)) {
            BigDecimal leftNumber = CastUtil.toDecimal(left);
            BigDecimal rightNumber = CastUtil.toDecimal(right);
            if (leftNumber != null && rightNumber != null) {
                return leftNumber.compareTo(rightNumber) == 0;
            }
        }
        return CastUtil.canonical(left).equals(CastUtil.canonical(right));
    }

    public static int compare(String operation, Object left, Object right) {
        if (left instanceof String leftText && right instanceof String rightText
                && !(CastUtil.isNumeric(leftText) && CastUtil.isNumeric(rightText))) {
            return leftText.compareTo(rightText);
        }
        return requireNumber(operation, left).compareTo(requireNumber(operation, right));
    }
}

package com.dochelper.rules.core.util;

import java.math.BigDecimal;
import java.math.BigInteger;

public class CastUtil {

    /**
     * Largest decimal exponent, in either direction, that a number may carry
     * and still render in plain form.
     */
    public static final int MAX_PLAIN_EXPONENT = 1000;

    private CastUtil() {}

    public static Boolean castAsBoolean(Object e) {
        if (e instanceof Boolean bool) {
            return bool;
        } else if (e instanceof Number number) {
            BigDecimal decimal = toDecimal(number);
            return decimal != null && decimal.compareTo(BigDecimal.ONE) == 0;
        } else if (e instanceof String s) {
            String trimmed = s.trim();
            return "true".equalsIgnoreCase(trimmed) || "yes".equalsIgnoreCase(trimmed) || "1".equals(trimmed);
        }
        return false;
    }

    /**
     * Truthiness used by logical operators: null, false, zero and blank text are false.
     */
    public static boolean isTruthy(Object e) {
        if (e == null) {
            return false;
        } else if (e instanceof Boolean bool) {
            return bool;
        } else if (e instanceof Number number) {
            BigDecimal decimal = toDecimal(number);
            return decimal == null || decimal.signum() != 0;
        } else if (e instanceof String s) {
            String trimmed = s.trim();
            if ("false".equalsIgnoreCase(trimmed)) {
                return false;
            }
            return !trimmed.isEmpty();
        }
        return true;
    }

    /**
     * Numeric view of a value. Numbers and numeric text convert, everything
     * else (including null and booleans) yields null.
     */
    public static BigDecimal toDecimal(Object e) {
        if (e instanceof BigDecimal decimal) {
            return decimal;
        } else if (e instanceof BigInteger integer) {
            return new BigDecimal(integer);
        } else if (e instanceof Integer || e instanceof Long || e instanceof Short || e instanceof Byte) {
            return BigDecimal.valueOf(((Number) e).longValue());
        } else if (e instanceof Double || e instanceof Float) {
            double d = ((Number) e).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return new BigDecimal(Double.toString(d));
        } else if (e instanceof Number number) {
            return parseDecimal(number.toString());
        } else if (e instanceof String s) {
            return parseDecimal(s);
        }
        return null;
    }

    public static boolean isNumeric(Object e) {
        return toDecimal(e) != null;
    }

    /**
     * Canonical text form used for mapping keys and value equality.
     * Numbers render in plain form without trailing zeros, null renders empty.
     */
    public static String canonical(Object e) {
        if (e == null) {
            return "";
        } else if (e instanceof Boolean bool) {
            return bool.toString();
        } else if (e instanceof Number) {
            BigDecimal decimal = toDecimal(e);
            return decimal == null ? e.toString() : canonicalDecimal(decimal);
        }
        return e.toString();
    }

    /**
     * Value equality used for change detection and override matching. Numeric
     * text equals the number it spells ("10.0" and 10), otherwise values
     * compare on their canonical text.
     */
    public static boolean sameValue(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (!(left instanceof Boolean) && !(right instanceof Boolean)) {
            BigDecimal leftNumber = toDecimal(left);
            BigDecimal rightNumber = toDecimal(right);
            if (leftNumber != null && rightNumber != null) {
                return leftNumber.compareTo(rightNumber) == 0;
            }
        }
        return canonical(left).equals(canonical(right));
    }

    public static String castAsString(Object e) {
        if (e instanceof String string) {
            return string;
        } else if (e == null) {
            return "";
        } else if (e instanceof Number) {
            return canonical(e);
        }
        return e.toString();
    }

    public static boolean isWithinPlainRange(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return true;
        }
        long exponent = (long) decimal.precision() - decimal.scale() - 1;
        return Math.abs(exponent) <= MAX_PLAIN_EXPONENT;
    }

    private static String canonicalDecimal(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = decimal.stripTrailingZeros();
        return isWithinPlainRange(stripped) ? stripped.toPlainString() : stripped.toString();
    }

    private static BigDecimal parseDecimal(String s) {
        if (CommonUtil.isNullOrBlank(s)) {
            return null;
        }
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

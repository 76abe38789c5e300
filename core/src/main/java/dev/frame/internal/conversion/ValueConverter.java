/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.conversion;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

import dev.frame.series.Element;

/**
 * Shared coercion rules used when a native value is stored into a typed cell.
 * <p>
 * All {@code toXxx} methods return {@code null} (or NaN for doubles) when the value
 * cannot be represented, which callers turn into a missing cell.
 * </p>
 */
public final class ValueConverter {

    private static final double MAX_EXACT_INTEGRAL = 1e15;

    private ValueConverter() {
    }

    // ==================== Classification ====================

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    public static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
    }

    // ==================== Cell Coercions ====================

    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Element element) {
            return toLong(element.val());
        }
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (isFloating(value)) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return (long) d;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s);
            }
            catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static double toDouble(Object value) {
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Element element) {
            return toDouble(element.val());
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s);
            }
            catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static Boolean toBool(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Element element) {
            return toBool(element.val());
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            switch (s.toLowerCase(Locale.ROOT)) {
                case "true", "t", "1":
                    return Boolean.TRUE;
                case "false", "f", "0":
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == 1.0) {
                return Boolean.TRUE;
            }
            if (d == 0.0) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
     * Text form of a value; {@code null} for absent values.
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Element element) {
            return toText(element.val());
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            return formatDouble(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    /**
     * Shortest plain decimal form: {@code 3.0} becomes {@code "3"}, {@code 1.1} stays {@code "1.1"}.
     */
    public static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGRAL) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

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
import java.util.Set;

/**
 * Converts a cell or resolved value into the declared type of an object field.
 * <p>
 * Numeric and boolean targets are parsed from the value's text form, so a FLOAT cell
 * holding {@code 30.0} fits an {@code int} field while {@code 30.5} does not.
 * </p>
 */
public final class FieldValueConverter {

    private static final Set<String> TRUE_TEXT = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_TEXT = Set.of("0", "f", "F", "FALSE", "false", "False");

    private FieldValueConverter() {
    }

    /**
     * @param value non-null value to convert
     * @param target declared field type
     * @return a value assignable to {@code target}
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public static Object convert(Object value, Class<?> target) {
        if (target == String.class) {
            return ValueConverter.toText(value);
        }
        if (target == long.class || target == Long.class) {
            return Long.parseLong(ValueConverter.toText(value));
        }
        if (target == int.class || target == Integer.class) {
            return Integer.parseInt(ValueConverter.toText(value));
        }
        if (target == short.class || target == Short.class) {
            return Short.parseShort(ValueConverter.toText(value));
        }
        if (target == byte.class || target == Byte.class) {
            return Byte.parseByte(ValueConverter.toText(value));
        }
        if (target == double.class || target == Double.class) {
            return Double.parseDouble(ValueConverter.toText(value));
        }
        if (target == float.class || target == Float.class) {
            return Float.parseFloat(ValueConverter.toText(value));
        }
        if (target == boolean.class || target == Boolean.class) {
            return parseBoolean(ValueConverter.toText(value));
        }
        if (target == BigInteger.class) {
            return new BigInteger(ValueConverter.toText(value));
        }
        if (target == BigDecimal.class) {
            return new BigDecimal(ValueConverter.toText(value));
        }
        if (target.isInstance(value)) {
            return value;
        }
        throw new IllegalArgumentException("incompatible types: " + target.getName() + " and " + value.getClass().getName());
    }

    private static boolean parseBoolean(String text) {
        if (TRUE_TEXT.contains(text)) {
            return true;
        }
        if (FALSE_TEXT.contains(text)) {
            return false;
        }
        throw new IllegalArgumentException("invalid boolean syntax: \"" + text + "\"");
    }

    /**
     * The value a field of the given type holds before assignment.
     */
    public static Object defaultValue(Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }
        if (type == boolean.class) {
            return false;
        }
        if (type == char.class) {
            return '\0';
        }
        if (type == long.class) {
            return 0L;
        }
        if (type == double.class) {
            return 0.0d;
        }
        if (type == float.class) {
            return 0.0f;
        }
        if (type == short.class) {
            return (short) 0;
        }
        if (type == byte.class) {
            return (byte) 0;
        }
        return 0;
    }
}

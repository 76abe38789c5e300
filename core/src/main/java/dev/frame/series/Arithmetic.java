/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

import dev.frame.internal.series.ColumnValues;
import dev.frame.internal.series.FloatValues;
import dev.frame.internal.series.IntValues;

/**
 * Cell-wise arithmetic behind {@link Series#add(Object, String)} and friends.
 * <p>
 * INT results use exact 64-bit two's complement arithmetic; everything else is computed
 * on doubles.
 * </p>
 */
final class Arithmetic {

    enum Operation {
        ADD("add"),
        SUB("sub"),
        MUL("mul"),
        DIV("div");

        private final String label;

        Operation(String label) {
            this.label = label;
        }

        long apply(long a, long b) {
            return switch (this) {
                case ADD -> a + b;
                case SUB -> a - b;
                case MUL -> a * b;
                case DIV -> a / b;
            };
        }

        double apply(double a, double b) {
            return switch (this) {
                case ADD -> a + b;
                case SUB -> a - b;
                case MUL -> a * b;
                case DIV -> a / b;
            };
        }
    }

    private static final String NAN_OPERAND = "unsupported type for arithmetic operation: NaN";

    private Arithmetic() {
    }

    static Series apply(Series receiver, Object operand, Operation op, String name) {
        if (receiver.error() != null) {
            return receiver;
        }
        if (!receiver.type().isNumeric()) {
            return receiver.withError(new SeriesException("cannot perform arithmetic operation on series of type " + receiver.type()));
        }
        if (operand instanceof Series other) {
            return withSeries(receiver, other, op, name);
        }
        if (isIntegral(operand) || operand instanceof Double || operand instanceof Float) {
            return withScalar(receiver, (Number) operand, op, name);
        }
        return receiver.withError(new SeriesException("unsupported type for arithmetic operation: "
                + (operand == null ? "null" : operand.getClass().getName())));
    }

    private static Series withScalar(Series receiver, Number operand, Operation op, String name) {
        boolean integral = receiver.type() == Type.INT && isIntegral(operand);
        String resultName = isBlank(name) ? defaultName(receiver, op, scalarName(operand)) : name;
        int length = receiver.len();
        ColumnValues left = receiver.values();

        if (integral) {
            long b = operand.longValue();
            IntValues result = (IntValues) ColumnValues.allocate(Type.INT, length);
            IntValues ints = (IntValues) left;
            for (int i = 0; i < length; i++) {
                if (ints.isMissing(i)) {
                    return receiver.withError(new SeriesException(NAN_OPERAND));
                }
                if (op == Operation.DIV && b == 0) {
                    return divisionByZero(resultName, Type.INT, result);
                }
                result.setLong(i, op.apply(ints.getLong(i), b));
            }
            return new Series(resultName, Type.INT, result, null);
        }

        double b = operand.doubleValue();
        if (Double.isNaN(b)) {
            return receiver.withError(new SeriesException(NAN_OPERAND));
        }
        FloatValues result = (FloatValues) ColumnValues.allocate(Type.FLOAT, length);
        for (int i = 0; i < length; i++) {
            double a = left.toDouble(i);
            if (Double.isNaN(a)) {
                return receiver.withError(new SeriesException(NAN_OPERAND));
            }
            if (op == Operation.DIV && b == 0) {
                return divisionByZero(resultName, Type.FLOAT, result);
            }
            result.setDouble(i, op.apply(a, b));
        }
        return new Series(resultName, Type.FLOAT, result, null);
    }

    private static Series withSeries(Series receiver, Series operand, Operation op, String name) {
        if (operand.error() != null) {
            return receiver.withError(operand.error());
        }
        if (receiver.len() != operand.len()) {
            return receiver.withError(new SeriesException("cannot perform operation on series of different lengths"));
        }
        if (!operand.type().isNumeric()) {
            return receiver.withError(new SeriesException("cannot perform arithmetic operation between series of different types"));
        }
        String resultName = isBlank(name) ? defaultName(receiver, op, operand.name()) : name;
        int length = receiver.len();

        if (receiver.type() == Type.INT && operand.type() == Type.INT) {
            IntValues a = (IntValues) receiver.values();
            IntValues b = (IntValues) operand.values();
            IntValues result = (IntValues) ColumnValues.allocate(Type.INT, length);
            for (int i = 0; i < length; i++) {
                if (a.isMissing(i) || b.isMissing(i)) {
                    return receiver.withError(new SeriesException(NAN_OPERAND));
                }
                if (op == Operation.DIV && b.getLong(i) == 0) {
                    return divisionByZero(resultName, Type.INT, result);
                }
                result.setLong(i, op.apply(a.getLong(i), b.getLong(i)));
            }
            return new Series(resultName, Type.INT, result, null);
        }

        ColumnValues a = receiver.values();
        ColumnValues b = operand.values();
        FloatValues result = (FloatValues) ColumnValues.allocate(Type.FLOAT, length);
        for (int i = 0; i < length; i++) {
            double x = a.toDouble(i);
            double y = b.toDouble(i);
            if (Double.isNaN(x) || Double.isNaN(y)) {
                return receiver.withError(new SeriesException(NAN_OPERAND));
            }
            if (op == Operation.DIV && y == 0) {
                return divisionByZero(resultName, Type.FLOAT, result);
            }
            result.setDouble(i, op.apply(x, y));
        }
        return new Series(resultName, Type.FLOAT, result, null);
    }

    private static Series divisionByZero(String name, Type type, ColumnValues partial) {
        return new Series(name, type, partial, new SeriesException("division by zero"));
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    private static boolean isBlank(String name) {
        return name == null || name.isEmpty();
    }

    private static String defaultName(Series receiver, Operation op, String operandName) {
        return receiver.name() + "_" + op.label + "_" + operandName;
    }

    private static String scalarName(Number operand) {
        if (operand instanceof Integer) {
            return "int";
        }
        if (operand instanceof Long) {
            return "long";
        }
        if (operand instanceof Short) {
            return "short";
        }
        if (operand instanceof Byte) {
            return "byte";
        }
        if (operand instanceof Float) {
            return "float";
        }
        return "double";
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

import dev.frame.internal.conversion.ValueConverter;

/**
 * Double precision cell. NaN is the only NA value in the library.
 */
public final class FloatElement implements Element {

    private double value;

    /**
     * Creates an NA cell.
     */
    public FloatElement() {
        this.value = Double.NaN;
    }

    public FloatElement(double value) {
        this.value = value;
    }

    @Override
    public void set(Object newValue) {
        value = ValueConverter.toDouble(newValue);
    }

    @Override
    public boolean eq(Element other) {
        double o = ValueConverter.toDouble(other.val());
        return value == o;
    }

    @Override
    public boolean less(Element other) {
        double o = ValueConverter.toDouble(other.val());
        return value < o;
    }

    @Override
    public boolean greater(Element other) {
        double o = ValueConverter.toDouble(other.val());
        return value > o;
    }

    @Override
    public Element copy() {
        return new FloatElement(value);
    }

    @Override
    public Object val() {
        return isNA() ? null : value;
    }

    @Override
    public long toLong() {
        if (isNA()) {
            throw new SeriesException("can't convert NaN to int");
        }
        return (long) value;
    }

    @Override
    public double toDouble() {
        return value;
    }

    @Override
    public boolean toBool() {
        if (isNA()) {
            throw new SeriesException("can't convert NaN to bool");
        }
        if (value == 1.0) {
            return true;
        }
        if (value == 0.0) {
            return false;
        }
        throw new SeriesException("can't convert Float \"" + ValueConverter.formatDouble(value) + "\" to bool");
    }

    @Override
    public boolean isNA() {
        return Double.isNaN(value);
    }

    @Override
    public Type type() {
        return Type.FLOAT;
    }

    @Override
    public String toString() {
        return ValueConverter.formatDouble(value);
    }
}

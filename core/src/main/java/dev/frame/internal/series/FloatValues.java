/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.series;

import java.util.Arrays;

import dev.frame.internal.conversion.ValueConverter;
import dev.frame.series.Element;
import dev.frame.series.FloatElement;
import dev.frame.series.Type;

/**
 * {@code double[]} column; NaN marks NA cells.
 */
public final class FloatValues implements ColumnValues {

    private double[] values;
    private int size;

    FloatValues(int size) {
        this.values = new double[Math.max(size, 4)];
        Arrays.fill(this.values, Double.NaN);
        this.size = size;
    }

    private FloatValues(double[] values, int size) {
        this.values = values;
        this.size = size;
    }

    @Override
    public Type type() {
        return Type.FLOAT;
    }

    @Override
    public int size() {
        return size;
    }

    public double getDouble(int index) {
        return values[index];
    }

    public void setDouble(int index, double value) {
        values[index] = value;
    }

    @Override
    public Object val(int index) {
        double v = values[index];
        return Double.isNaN(v) ? null : v;
    }

    @Override
    public Element elem(int index) {
        return new FloatElement(values[index]);
    }

    @Override
    public void set(int index, Object value) {
        values[index] = ValueConverter.toDouble(value);
    }

    @Override
    public void add(Object value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, size * 2);
        }
        size++;
        set(size - 1, value);
    }

    @Override
    public void addAll(ColumnValues other) {
        if (other instanceof FloatValues floats) {
            if (size + floats.size > values.length) {
                values = Arrays.copyOf(values, Math.max(size + floats.size, size * 2));
            }
            System.arraycopy(floats.values, 0, values, size, floats.size);
            size += floats.size;
        }
        else {
            ColumnValues.super.addAll(other);
        }
    }

    @Override
    public boolean isNA(int index) {
        return Double.isNaN(values[index]);
    }

    @Override
    public String text(int index) {
        return ValueConverter.formatDouble(values[index]);
    }

    @Override
    public double toDouble(int index) {
        return values[index];
    }

    @Override
    public int compareCells(int i, int j) {
        // -0.0 and 0.0 tie
        double a = values[i];
        double b = values[j];
        return a < b ? -1 : a > b ? 1 : 0;
    }

    @Override
    public ColumnValues copy() {
        return new FloatValues(Arrays.copyOf(values, Math.max(size, 4)), size);
    }

    @Override
    public ColumnValues subset(int[] indexes) {
        FloatValues result = new FloatValues(indexes.length);
        for (int i = 0; i < indexes.length; i++) {
            result.values[i] = values[indexes[i]];
        }
        return result;
    }
}

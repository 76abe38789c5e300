/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.series;

import java.util.Arrays;
import java.util.BitSet;

import dev.frame.internal.conversion.ValueConverter;
import dev.frame.series.Element;
import dev.frame.series.IntElement;
import dev.frame.series.Type;

/**
 * {@code long[]} column with a bit set of missing cells.
 */
public final class IntValues implements ColumnValues {

    private long[] values;
    private final BitSet missing;
    private int size;

    IntValues(int size) {
        this.values = new long[Math.max(size, 4)];
        this.missing = new BitSet(size);
        this.missing.set(0, size);
        this.size = size;
    }

    private IntValues(long[] values, BitSet missing, int size) {
        this.values = values;
        this.missing = missing;
        this.size = size;
    }

    @Override
    public Type type() {
        return Type.INT;
    }

    @Override
    public int size() {
        return size;
    }

    public long getLong(int index) {
        return values[index];
    }

    public boolean isMissing(int index) {
        return missing.get(index);
    }

    public void setLong(int index, long value) {
        values[index] = value;
        missing.clear(index);
    }

    @Override
    public Object val(int index) {
        return missing.get(index) ? null : values[index];
    }

    @Override
    public Element elem(int index) {
        return missing.get(index) ? new IntElement() : new IntElement(values[index]);
    }

    @Override
    public void set(int index, Object value) {
        Long converted = ValueConverter.toLong(value);
        if (converted == null) {
            values[index] = 0;
            missing.set(index);
        }
        else {
            setLong(index, converted);
        }
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
        if (other instanceof IntValues ints) {
            if (size + ints.size > values.length) {
                values = Arrays.copyOf(values, Math.max(size + ints.size, size * 2));
            }
            System.arraycopy(ints.values, 0, values, size, ints.size);
            for (int i = ints.missing.nextSetBit(0); i >= 0 && i < ints.size; i = ints.missing.nextSetBit(i + 1)) {
                missing.set(size + i);
            }
            size += ints.size;
        }
        else {
            ColumnValues.super.addAll(other);
        }
    }

    @Override
    public boolean isNA(int index) {
        return false;
    }

    @Override
    public String text(int index) {
        return missing.get(index) ? "NaN" : Long.toString(values[index]);
    }

    @Override
    public double toDouble(int index) {
        return missing.get(index) ? Double.NaN : values[index];
    }

    @Override
    public int compareCells(int i, int j) {
        boolean mi = missing.get(i);
        boolean mj = missing.get(j);
        if (mi || mj) {
            return Boolean.compare(mi, mj);
        }
        return Long.compare(values[i], values[j]);
    }

    @Override
    public ColumnValues copy() {
        return new IntValues(Arrays.copyOf(values, Math.max(size, 4)), (BitSet) missing.clone(), size);
    }

    @Override
    public ColumnValues subset(int[] indexes) {
        IntValues result = new IntValues(indexes.length);
        for (int i = 0; i < indexes.length; i++) {
            if (!missing.get(indexes[i])) {
                result.setLong(i, values[indexes[i]]);
            }
        }
        return result;
    }
}

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
import dev.frame.series.BoolElement;
import dev.frame.series.Element;
import dev.frame.series.Type;

/**
 * {@code boolean[]} column with a bit set of missing cells.
 */
public final class BoolValues implements ColumnValues {

    private boolean[] values;
    private final BitSet missing;
    private int size;

    BoolValues(int size) {
        this.values = new boolean[Math.max(size, 4)];
        this.missing = new BitSet(size);
        this.missing.set(0, size);
        this.size = size;
    }

    private BoolValues(boolean[] values, BitSet missing, int size) {
        this.values = values;
        this.missing = missing;
        this.size = size;
    }

    @Override
    public Type type() {
        return Type.BOOL;
    }

    @Override
    public int size() {
        return size;
    }

    public boolean getBoolean(int index) {
        return values[index];
    }

    public boolean isMissing(int index) {
        return missing.get(index);
    }

    public void setBoolean(int index, boolean value) {
        values[index] = value;
        missing.clear(index);
    }

    @Override
    public Object val(int index) {
        return missing.get(index) ? null : values[index];
    }

    @Override
    public Element elem(int index) {
        return missing.get(index) ? new BoolElement() : new BoolElement(values[index]);
    }

    @Override
    public void set(int index, Object value) {
        Boolean converted = ValueConverter.toBool(value);
        if (converted == null) {
            values[index] = false;
            missing.set(index);
        }
        else {
            setBoolean(index, converted);
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
    public boolean isNA(int index) {
        return false;
    }

    @Override
    public String text(int index) {
        if (missing.get(index)) {
            return "NaN";
        }
        return values[index] ? "true" : "false";
    }

    @Override
    public int compareCells(int i, int j) {
        boolean mi = missing.get(i);
        boolean mj = missing.get(j);
        if (mi || mj) {
            return Boolean.compare(mi, mj);
        }
        return Boolean.compare(values[i], values[j]);
    }

    @Override
    public ColumnValues copy() {
        return new BoolValues(Arrays.copyOf(values, Math.max(size, 4)), (BitSet) missing.clone(), size);
    }

    @Override
    public ColumnValues subset(int[] indexes) {
        BoolValues result = new BoolValues(indexes.length);
        for (int i = 0; i < indexes.length; i++) {
            if (!missing.get(indexes[i])) {
                result.setBoolean(i, values[indexes[i]]);
            }
        }
        return result;
    }
}

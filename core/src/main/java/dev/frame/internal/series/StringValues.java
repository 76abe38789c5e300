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
import dev.frame.series.StringElement;
import dev.frame.series.Type;

/**
 * {@code String[]} column; a {@code null} slot is a missing cell.
 */
public final class StringValues implements ColumnValues {

    private static final String MISSING_TEXT = "NaN";

    private String[] values;
    private int size;

    StringValues(int size) {
        this.values = new String[Math.max(size, 4)];
        this.size = size;
    }

    private StringValues(String[] values, int size) {
        this.values = values;
        this.size = size;
    }

    @Override
    public Type type() {
        return Type.STRING;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Object val(int index) {
        return values[index];
    }

    @Override
    public Element elem(int index) {
        return values[index] == null ? new StringElement() : new StringElement(values[index]);
    }

    @Override
    public void set(int index, Object value) {
        String text = ValueConverter.toText(value);
        values[index] = MISSING_TEXT.equals(text) ? null : text;
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
        return values[index] == null ? MISSING_TEXT : values[index];
    }

    @Override
    public int compareCells(int i, int j) {
        String a = values[i];
        String b = values[j];
        if (a == null || b == null) {
            return Boolean.compare(a == null, b == null);
        }
        return a.compareTo(b);
    }

    @Override
    public ColumnValues copy() {
        return new StringValues(Arrays.copyOf(values, Math.max(size, 4)), size);
    }

    @Override
    public ColumnValues subset(int[] indexes) {
        StringValues result = new StringValues(indexes.length);
        for (int i = 0; i < indexes.length; i++) {
            result.values[i] = values[indexes[i]];
        }
        return result;
    }
}

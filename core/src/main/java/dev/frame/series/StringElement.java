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
 * Text cell. The literal {@code "NaN"} is read as a missing value.
 */
public final class StringElement implements Element {

    static final String MISSING_TEXT = "NaN";

    // null when missing
    private String value;

    /**
     * Creates a missing cell.
     */
    public StringElement() {
    }

    public StringElement(String value) {
        set(value);
    }

    @Override
    public void set(Object newValue) {
        String text = ValueConverter.toText(newValue);
        value = MISSING_TEXT.equals(text) ? null : text;
    }

    @Override
    public boolean eq(Element other) {
        if (value == null) {
            return other.val() == null && !other.isNA();
        }
        return value.equals(ValueConverter.toText(other.val()));
    }

    @Override
    public boolean less(Element other) {
        String o = ValueConverter.toText(other.val());
        return value != null && o != null && value.compareTo(o) < 0;
    }

    @Override
    public boolean greater(Element other) {
        String o = ValueConverter.toText(other.val());
        return value != null && o != null && value.compareTo(o) > 0;
    }

    @Override
    public Element copy() {
        StringElement copy = new StringElement();
        copy.value = value;
        return copy;
    }

    @Override
    public Object val() {
        return value;
    }

    @Override
    public long toLong() {
        if (value == null) {
            throw new SeriesException("can't convert NaN to int");
        }
        try {
            return Long.parseLong(value);
        }
        catch (NumberFormatException e) {
            throw new SeriesException("can't convert String \"" + value + "\" to int", e);
        }
    }

    @Override
    public double toDouble() {
        return ValueConverter.toDouble(value);
    }

    @Override
    public boolean toBool() {
        Boolean b = ValueConverter.toBool(value);
        if (b == null) {
            throw new SeriesException("can't convert String \"" + toString() + "\" to bool");
        }
        return b;
    }

    @Override
    public boolean isNA() {
        return false;
    }

    @Override
    public Type type() {
        return Type.STRING;
    }

    @Override
    public String toString() {
        return value == null ? MISSING_TEXT : value;
    }
}

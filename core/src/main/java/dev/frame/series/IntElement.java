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
 * 64-bit integer cell.
 */
public final class IntElement implements Element {

    private long value;
    private boolean missing;

    /**
     * Creates a missing cell.
     */
    public IntElement() {
        this.missing = true;
    }

    public IntElement(long value) {
        this.value = value;
    }

    @Override
    public void set(Object newValue) {
        Long converted = ValueConverter.toLong(newValue);
        if (converted == null) {
            value = 0;
            missing = true;
        }
        else {
            value = converted;
            missing = false;
        }
    }

    @Override
    public boolean eq(Element other) {
        if (missing) {
            return other.val() == null && !other.isNA();
        }
        Long o = ValueConverter.toLong(other.val());
        return o != null && value == o;
    }

    @Override
    public boolean less(Element other) {
        Long o = ValueConverter.toLong(other.val());
        return !missing && o != null && value < o;
    }

    @Override
    public boolean greater(Element other) {
        Long o = ValueConverter.toLong(other.val());
        return !missing && o != null && value > o;
    }

    @Override
    public Element copy() {
        return missing ? new IntElement() : new IntElement(value);
    }

    @Override
    public Object val() {
        return missing ? null : value;
    }

    @Override
    public long toLong() {
        if (missing) {
            throw new SeriesException("can't convert NaN to int");
        }
        return value;
    }

    @Override
    public double toDouble() {
        return missing ? Double.NaN : value;
    }

    @Override
    public boolean toBool() {
        if (missing) {
            throw new SeriesException("can't convert NaN to bool");
        }
        if (value == 1) {
            return true;
        }
        if (value == 0) {
            return false;
        }
        throw new SeriesException("can't convert Int \"" + value + "\" to bool");
    }

    @Override
    public boolean isNA() {
        return false;
    }

    @Override
    public Type type() {
        return Type.INT;
    }

    @Override
    public String toString() {
        return missing ? "NaN" : Long.toString(value);
    }
}

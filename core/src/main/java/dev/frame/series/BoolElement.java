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
 * Boolean cell, ordered {@code false < true}.
 */
public final class BoolElement implements Element {

    private boolean value;
    private boolean missing;

    /**
     * Creates a missing cell.
     */
    public BoolElement() {
        this.missing = true;
    }

    public BoolElement(boolean value) {
        this.value = value;
    }

    @Override
    public void set(Object newValue) {
        Boolean converted = ValueConverter.toBool(newValue);
        if (converted == null) {
            value = false;
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
        Boolean o = ValueConverter.toBool(other.val());
        return o != null && value == o;
    }

    @Override
    public boolean less(Element other) {
        Boolean o = ValueConverter.toBool(other.val());
        return !missing && o != null && !value && o;
    }

    @Override
    public boolean greater(Element other) {
        Boolean o = ValueConverter.toBool(other.val());
        return !missing && o != null && value && !o;
    }

    @Override
    public Element copy() {
        return missing ? new BoolElement() : new BoolElement(value);
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
        return value ? 1 : 0;
    }

    @Override
    public double toDouble() {
        if (missing) {
            return Double.NaN;
        }
        return value ? 1.0 : 0.0;
    }

    @Override
    public boolean toBool() {
        if (missing) {
            throw new SeriesException("can't convert NaN to bool");
        }
        return value;
    }

    @Override
    public boolean isNA() {
        return false;
    }

    @Override
    public Type type() {
        return Type.BOOL;
    }

    @Override
    public String toString() {
        if (missing) {
            return "NaN";
        }
        return value ? "true" : "false";
    }
}

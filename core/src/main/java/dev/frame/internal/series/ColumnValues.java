/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.series;

import dev.frame.internal.conversion.ValueConverter;
import dev.frame.series.Element;
import dev.frame.series.Type;

/**
 * Typed backing store of a Series: one primitive array per type, no boxed cells.
 * <p>
 * Cell values are coerced on write following the rules of {@link ValueConverter}.
 * Elements handed out by {@link #elem(int)} are detached copies.
 * </p>
 */
public sealed interface ColumnValues permits IntValues, FloatValues, StringValues, BoolValues {

    Type type();

    int size();

    /**
     * Native cell value, {@code null} for NA and missing cells.
     */
    Object val(int index);

    Element elem(int index);

    /**
     * Overwrite one cell, coercing the value to this column's type.
     */
    void set(int index, Object value);

    /**
     * Append one cell, coercing the value to this column's type.
     */
    void add(Object value);

    /**
     * Float NaN. Int, String and Bool cells are never NA, even when missing.
     */
    boolean isNA(int index);

    /**
     * Text form used by {@code records()}; missing and NA cells render as {@code "NaN"}.
     */
    String text(int index);

    /**
     * Compares two cells of this column. Missing cells order after present ones;
     * callers handle Float NaN separately.
     */
    int compareCells(int i, int j);

    ColumnValues copy();

    /**
     * New column holding the cells at the given positions, in that order.
     */
    ColumnValues subset(int[] indexes);

    default double toDouble(int index) {
        return ValueConverter.toDouble(val(index));
    }

    default void addAll(ColumnValues other) {
        for (int i = 0; i < other.size(); i++) {
            add(other.val(i));
        }
    }

    /**
     * Column of the given type with {@code size} missing (or NaN) cells.
     */
    static ColumnValues allocate(Type type, int size) {
        return switch (type) {
            case INT -> new IntValues(size);
            case FLOAT -> new FloatValues(size);
            case STRING -> new StringValues(size);
            case BOOL -> new BoolValues(size);
        };
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

/**
 * A single typed cell of a {@link Series}.
 * <p>
 * Elements obtained from a Series are detached copies: {@link #set(Object)} changes
 * the element only, use {@link Series#set(Object, Series)} to write back.
 * </p>
 * <p>
 * Comparisons coerce the other element to this element's type. Only Float elements
 * can be NA (NaN); Int, String and Bool cells built from an absent or unconvertible
 * source are <i>missing</i>, print as {@code "NaN"} and have a {@code null} value, but
 * still report {@link #isNA()} as false.
 * </p>
 */
public sealed interface Element permits IntElement, FloatElement, StringElement, BoolElement {

    /**
     * Replace the value, coercing it to this element's type.
     */
    void set(Object value);

    boolean eq(Element other);

    default boolean neq(Element other) {
        return !eq(other);
    }

    boolean less(Element other);

    default boolean lessEq(Element other) {
        return less(other) || eq(other);
    }

    boolean greater(Element other);

    default boolean greaterEq(Element other) {
        return greater(other) || eq(other);
    }

    Element copy();

    /**
     * The native value ({@link Long}, {@link Double}, {@link String} or {@link Boolean}),
     * or {@code null} for NA and missing cells.
     */
    Object val();

    /**
     * @throws SeriesException if the value has no integer representation
     */
    long toLong();

    /**
     * Float projection; NaN when the value has no numeric representation.
     */
    double toDouble();

    /**
     * @throws SeriesException if the value has no boolean representation
     */
    boolean toBool();

    boolean isNA();

    Type type();

    /**
     * Create an element of the given type holding the coerced value.
     */
    static Element of(Type type, Object value) {
        Element element = switch (type) {
            case INT -> new IntElement();
            case FLOAT -> new FloatElement();
            case STRING -> new StringElement();
            case BOOL -> new BoolElement();
        };
        element.set(value);
        return element;
    }
}

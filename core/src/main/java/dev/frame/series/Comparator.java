/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

/**
 * Comparison operators accepted by {@link Series#compare(Comparator, Object)}.
 */
public enum Comparator {

    EQ("=="),
    NEQ("!="),
    GREATER(">"),
    GREATER_EQ(">="),
    LESS("<"),
    LESS_EQ("<="),
    /**
     * Membership: true when the cell equals any cell of the comparando.
     */
    IN("in"),
    /**
     * The comparando is a {@code Predicate<Element>} applied to each cell.
     */
    FUNC("func");

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Applies one of the six relational operators to a pair of elements.
     *
     * @throws IllegalArgumentException for {@link #IN} and {@link #FUNC}
     */
    public boolean test(Element a, Element b) {
        return switch (this) {
            case EQ -> a.eq(b);
            case NEQ -> a.neq(b);
            case GREATER -> a.greater(b);
            case GREATER_EQ -> a.greaterEq(b);
            case LESS -> a.less(b);
            case LESS_EQ -> a.lessEq(b);
            case IN, FUNC -> throw new IllegalArgumentException("Comparator " + symbol + " does not compare element pairs");
        };
    }

    public static Comparator fromSymbol(String symbol) {
        for (Comparator comparator : values()) {
            if (comparator.symbol.equals(symbol)) {
                return comparator;
            }
        }
        throw new IllegalArgumentException("Unknown comparator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}

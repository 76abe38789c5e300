/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

/**
 * Element types a {@link Series} can hold. Fixed when the Series is created.
 */
public enum Type {
    STRING("string"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool");

    private final String label;

    Type(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Whether arithmetic is defined for Series of this type.
     */
    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    public static Type fromLabel(String label) {
        for (Type type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown series type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.reflect;

import java.net.URI;
import java.util.Collection;
import java.util.Currency;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Structural classification of a runtime value, as seen by path resolution, frame building
 * and deep copy.
 */
public enum ValueKind {

    /**
     * {@code null}.
     */
    NULL("nil"),
    /**
     * Strings, boxed primitives, enums and other {@code java.*} value classes.
     */
    SCALAR("scalar"),
    /**
     * Lambdas and method references.
     */
    FUNCTION("func"),
    OPTIONAL("interface"),
    MAP("map"),
    /**
     * Arrays and collections.
     */
    SEQUENCE("slice"),
    /**
     * Records and other objects, addressed field by field.
     */
    OBJECT("struct");

    private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
            String.class, Boolean.class, Character.class, Byte.class, Short.class, Integer.class,
            Long.class, Float.class, Double.class, UUID.class, Locale.class, Currency.class,
            URI.class, Pattern.class, Class.class);

    private final String label;

    ValueKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isComposite() {
        return this == MAP || this == SEQUENCE || this == OBJECT;
    }

    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Optional<?>) {
            return OPTIONAL;
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return SEQUENCE;
        }
        Class<?> type = value.getClass();
        if (isLambda(type)) {
            return FUNCTION;
        }
        if (isValueClass(type)) {
            return SCALAR;
        }
        return OBJECT;
    }

    /**
     * Name used in "unsupported type" messages: the kind label, or the lower-cased class
     * name for scalars.
     */
    public static String describe(Object value) {
        ValueKind kind = of(value);
        if (kind == SCALAR) {
            return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        }
        return kind.label;
    }

    /**
     * Whether instances of the type are immutable leaf values.
     */
    public static boolean isValueClass(Class<?> type) {
        if (type.isPrimitive() || type.isEnum() || Enum.class.isAssignableFrom(type)) {
            return true;
        }
        if (Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)
                || Optional.class.isAssignableFrom(type) || type.isArray()) {
            return false;
        }
        String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.");
    }

    /**
     * Immutable JDK value types that can be shared between a value and its copy. Other
     * {@code java.*} classes are leaves for path resolution but may still be mutable.
     */
    public static boolean isImmutable(Class<?> type) {
        if (type.isPrimitive() || type.isEnum() || Enum.class.isAssignableFrom(type)) {
            return true;
        }
        if (IMMUTABLE_TYPES.contains(type)) {
            return true;
        }
        String name = type.getName();
        return name.startsWith("java.time.") || type.getPackageName().equals("java.math");
    }

    /**
     * Lambda and method-reference classes, or a declared type that is itself a
     * {@link FunctionalInterface}. Classes that merely implement such an interface are not
     * functions.
     */
    public static boolean isFunction(Class<?> type) {
        if (type.isInterface()) {
            return type.isAnnotationPresent(FunctionalInterface.class);
        }
        return isLambda(type);
    }

    private static boolean isLambda(Class<?> type) {
        return type.isHidden() || type.isSynthetic() || type.getName().contains("$$Lambda");
    }
}

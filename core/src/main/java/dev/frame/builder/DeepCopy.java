/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.builder;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import dev.frame.internal.conversion.FieldValueConverter;
import dev.frame.internal.reflect.FieldAccessors;
import dev.frame.internal.reflect.ValueKind;

/**
 * Recursive cloner for object graphs.
 * <p>
 * Immutable values (strings, boxed primitives, enums, {@code java.time} and
 * {@code java.math} types) and lambdas are shared. Mutable JDK values such as
 * {@link java.util.Date}, {@link StringBuilder}, {@link java.util.BitSet} and the atomics are
 * copied through their public API; a JDK type with neither a copy constructor nor a public
 * {@code clone()} is shared. Arrays, collections, maps, {@link Optional}s, records and plain
 * objects are cloned. Each composite value is cloned at most once per call: a value met a
 * second time, as in a cycle, is copied as {@code null}, so cyclic graphs are truncated
 * rather than reproduced.
 * </p>
 */
public final class DeepCopy {

    private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());

    private DeepCopy() {
    }

    /**
     * Returns a deep clone of {@code source}.
     *
     * @throws DeepCopyException if {@code source} is not an instance of {@code type} or a
     *     value in the graph cannot be instantiated
     */
    public static <T> T copy(Object source, Class<T> type) {
        if (source != null && !type.isInstance(source)) {
            throw notAssignable(source.getClass(), type);
        }
        return type.cast(new DeepCopy().cloneValue(source));
    }

    /**
     * Clones the fields of {@code source} into {@code destination}. A {@code null} source
     * resets every field of the destination to its default value.
     *
     * @throws DeepCopyException if {@code source} is not an instance of the destination's
     *     class or the destination is a record
     */
    public static void copyInto(Object destination, Object source) {
        if (destination == null) {
            throw new DeepCopyException("destination must not be null");
        }
        Class<?> type = destination.getClass();
        if (type.isRecord()) {
            throw new DeepCopyException("cannot copy into record " + type.getName());
        }
        if (source != null && !type.isInstance(source)) {
            throw notAssignable(source.getClass(), type);
        }
        DeepCopy copy = new DeepCopy();
        if (source != null) {
            copy.visited.add(source);
        }
        for (Field field : FieldAccessors.fields(type).values()) {
            Object value = source == null
                    ? FieldValueConverter.defaultValue(field.getType())
                    : copy.cloneValue(FieldAccessors.read(field, source));
            FieldAccessors.write(field, destination, value);
        }
    }

    private static DeepCopyException notAssignable(Class<?> source, Class<?> destination) {
        return new DeepCopyException("source type " + source.getName() + " is not assignable to destination type " + destination.getName());
    }

    private Object cloneValue(Object source) {
        ValueKind kind = ValueKind.of(source);
        switch (kind) {
            case NULL, FUNCTION:
                return source;
            case SCALAR:
                return ValueKind.isImmutable(source.getClass()) ? source : cloneJdkValue(source);
            case OPTIONAL:
                return Optional.ofNullable(cloneValue(((Optional<?>) source).orElse(null)));
            default:
                break;
        }
        if (!visited.add(source)) {
            return null;
        }
        return switch (kind) {
            case MAP -> cloneMap((Map<?, ?>) source);
            case SEQUENCE -> source.getClass().isArray() ? cloneArray(source) : cloneCollection((Collection<?>) source);
            default -> source.getClass().isRecord() ? cloneRecord(source) : cloneObject(source);
        };
    }

    private Object cloneJdkValue(Object source) {
        if (source instanceof StringBuilder builder) {
            return new StringBuilder(builder);
        }
        if (source instanceof StringBuffer buffer) {
            return new StringBuffer(buffer);
        }
        if (source instanceof AtomicInteger atomic) {
            return new AtomicInteger(atomic.get());
        }
        if (source instanceof AtomicLong atomic) {
            return new AtomicLong(atomic.get());
        }
        if (source instanceof AtomicBoolean atomic) {
            return new AtomicBoolean(atomic.get());
        }
        if (source instanceof AtomicReference<?> atomic) {
            return new AtomicReference<>(cloneValue(atomic.get()));
        }
        if (source instanceof Cloneable) {
            Method clone;
            try {
                clone = source.getClass().getMethod("clone");
            }
            catch (NoSuchMethodException e) {
                return source;
            }
            try {
                return clone.invoke(source);
            }
            catch (ReflectiveOperationException | RuntimeException e) {
                throw new DeepCopyException("cannot clone " + source.getClass().getName(), e);
            }
        }
        return source;
    }

    private Object cloneArray(Object source) {
        Class<?> component = source.getClass().getComponentType();
        int length = Array.getLength(source);
        Object target = Array.newInstance(component, length);
        if (component.isPrimitive()) {
            System.arraycopy(source, 0, target, 0, length);
            return target;
        }
        for (int i = 0; i < length; i++) {
            Array.set(target, i, cloneValue(Array.get(source, i)));
        }
        return target;
    }

    @SuppressWarnings("unchecked")
    private Collection<Object> cloneCollection(Collection<?> source) {
        Collection<Object> target;
        if (source instanceof SortedSet<?> sorted) {
            target = new TreeSet<>((Comparator<Object>) sorted.comparator());
        }
        else {
            target = (Collection<Object>) newContainer(source);
            if (target == null) {
                target = source instanceof Set<?> ? new LinkedHashSet<>() : new ArrayList<>();
            }
        }
        for (Object item : source) {
            target.add(cloneValue(item));
        }
        return target;
    }

    @SuppressWarnings("unchecked")
    private Map<Object, Object> cloneMap(Map<?, ?> source) {
        Map<Object, Object> target;
        if (source instanceof SortedMap<?, ?> sorted) {
            target = new TreeMap<>((Comparator<Object>) sorted.comparator());
        }
        else {
            target = (Map<Object, Object>) newContainer(source);
            if (target == null) {
                target = new LinkedHashMap<>();
            }
        }
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            target.put(cloneValue(entry.getKey()), cloneValue(entry.getValue()));
        }
        return target;
    }

    /**
     * A fresh instance of a public container class with a public no-arg constructor,
     * {@code null} for unmodifiable and other non-instantiable containers.
     */
    private static Object newContainer(Object source) {
        if (!Modifier.isPublic(source.getClass().getModifiers())) {
            return null;
        }
        Constructor<?> constructor;
        try {
            constructor = source.getClass().getConstructor();
        }
        catch (NoSuchMethodException e) {
            return null;
        }
        try {
            return constructor.newInstance();
        }
        catch (ReflectiveOperationException | RuntimeException e) {
            throw new DeepCopyException("cannot instantiate " + source.getClass().getName(), e);
        }
    }

    private Object cloneRecord(Object source) {
        Class<?> type = source.getClass();
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        Object[] arguments = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
            Object value = cloneValue(FieldAccessors.read(FieldAccessors.field(type, components[i].getName()), source));
            arguments[i] = value == null ? FieldValueConverter.defaultValue(parameterTypes[i]) : value;
        }
        try {
            Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor.newInstance(arguments);
        }
        catch (ReflectiveOperationException | RuntimeException e) {
            throw new DeepCopyException("cannot instantiate record " + type.getName(), e);
        }
    }

    private Object cloneObject(Object source) {
        Class<?> type = source.getClass();
        Object target;
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            target = constructor.newInstance();
        }
        catch (ReflectiveOperationException | RuntimeException e) {
            throw new DeepCopyException("cannot instantiate " + type.getName() + ", a no-arg constructor is required", e);
        }
        for (Field field : FieldAccessors.fields(type).values()) {
            FieldAccessors.write(field, target, cloneValue(FieldAccessors.read(field, source)));
        }
        return target;
    }
}

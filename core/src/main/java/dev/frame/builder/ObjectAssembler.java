/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.builder;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Map;
import java.util.function.Supplier;

import dev.frame.internal.conversion.FieldValueConverter;
import dev.frame.internal.reflect.FieldAccessors;

/**
 * Creates instances of a target type from per-field values. Records go through their
 * canonical constructor, other classes through the factory followed by field writes.
 * Fields without a value keep their default.
 */
final class ObjectAssembler<T> {

    private final Class<T> type;
    private final Supplier<T> factory;

    ObjectAssembler(Class<T> type, Supplier<T> factory) {
        this.type = type;
        this.factory = factory != null ? factory : defaultFactory(type);
    }

    T assemble(Map<Field, Object> values) {
        if (type.isRecord()) {
            return assembleRecord(values);
        }
        T instance = factory.get();
        for (Map.Entry<Field, Object> entry : values.entrySet()) {
            FieldAccessors.write(entry.getKey(), instance, entry.getValue());
        }
        return instance;
    }

    private T assembleRecord(Map<Field, Object> values) {
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        Object[] arguments = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
            Field field = FieldAccessors.field(type, components[i].getName());
            arguments[i] = values.containsKey(field) ? values.get(field) : FieldValueConverter.defaultValue(parameterTypes[i]);
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor.newInstance(arguments);
        }
        catch (ReflectiveOperationException | RuntimeException e) {
            throw new FrameBuildException("cannot instantiate record " + type.getName(), e);
        }
    }

    private static <T> Supplier<T> defaultFactory(Class<T> type) {
        if (type.isRecord()) {
            return null;
        }
        if (type.isInterface() || type.isArray() || type.isPrimitive() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException("Target type must be a record or a concrete class: " + type.getName());
        }
        return () -> {
            try {
                Constructor<T> constructor = type.getDeclaredConstructor();
                constructor.setAccessible(true);
                return constructor.newInstance();
            }
            catch (ReflectiveOperationException | RuntimeException e) {
                throw new FrameBuildException("cannot instantiate " + type.getName() + ", a no-arg constructor or factory is required", e);
            }
        };
    }
}

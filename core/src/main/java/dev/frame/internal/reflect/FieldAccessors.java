/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.reflect;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-class cache of instance fields, including inherited ones, keyed by name.
 * A field declared in a subclass hides a same-named field of its superclasses.
 */
public final class FieldAccessors {

    private static final ClassValue<Map<String, Field>> FIELDS = new ClassValue<>() {
        @Override
        protected Map<String, Field> computeValue(Class<?> type) {
            Map<String, Field> fields = new LinkedHashMap<>();
            for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
                for (Field field : c.getDeclaredFields()) {
                    if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                        continue;
                    }
                    fields.putIfAbsent(field.getName(), field);
                }
            }
            return Collections.unmodifiableMap(fields);
        }
    };

    private FieldAccessors() {
    }

    public static Map<String, Field> fields(Class<?> type) {
        return FIELDS.get(type);
    }

    /**
     * @return the field, or {@code null} if the class has no instance field of that name
     */
    public static Field field(Class<?> type, String name) {
        return FIELDS.get(type).get(name);
    }

    public static Object read(Field field, Object target) {
        try {
            field.setAccessible(true);
            return field.get(target);
        }
        catch (IllegalAccessException | InaccessibleObjectException e) {
            throw new IllegalStateException("Cannot read field " + field.getDeclaringClass().getName() + "." + field.getName(), e);
        }
    }

    public static void write(Field field, Object target, Object value) {
        try {
            field.setAccessible(true);
            field.set(target, value);
        }
        catch (IllegalAccessException | InaccessibleObjectException e) {
            throw new IllegalStateException("Cannot write field " + field.getDeclaringClass().getName() + "." + field.getName(), e);
        }
    }
}

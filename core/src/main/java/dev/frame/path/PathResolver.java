/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.path;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import dev.frame.internal.reflect.FieldAccessors;
import dev.frame.internal.reflect.ValueKind;
import dev.frame.path.PathResolutionException.Reason;

/**
 * Follows dotted paths such as {@code "orders.0.address.city"} through nested objects,
 * maps, lists and arrays.
 * <p>
 * Each segment names a field of an object (records included), a map key (compared by its
 * string form) or a non-negative list or array index. {@link Optional} values are unwrapped
 * in place without consuming a segment. Every composite value met during one call is
 * remembered by identity; meeting it again is reported as a circular reference.
 * </p>
 */
public final class PathResolver {

    private PathResolver() {
    }

    /**
     * Resolves {@code path} against {@code data}.
     *
     * @return the value at the end of the path; {@code null} if the last field, key or
     *     element holds {@code null}
     * @throws PathResolutionException if the path cannot be followed
     */
    public static Object getValueByPath(Object data, String path) {
        if (path == null || path.isEmpty()) {
            throw new PathResolutionException(Reason.EMPTY_PATH, "", "empty path is not allowed");
        }
        String[] segments = path.split("\\.", -1);
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Object cursor = data;

        int i = 0;
        while (i < segments.length) {
            String segment = segments[i];
            if (cursor == null) {
                if (i == 0) {
                    throw new PathResolutionException(Reason.INVALID_VALUE, segment, "invalid value encountered at key: " + segment);
                }
                throw new PathResolutionException(Reason.NIL_POINTER, segment, "nil pointer encountered at key: " + segment);
            }

            ValueKind kind = ValueKind.of(cursor);
            if (kind == ValueKind.OPTIONAL) {
                Optional<?> optional = (Optional<?>) cursor;
                if (optional.isEmpty()) {
                    throw new PathResolutionException(Reason.NIL_INTERFACE, segment, "nil interface encountered at key: " + segment);
                }
                // same segment again
                cursor = optional.get();
                continue;
            }
            if (kind.isComposite() && !visited.add(cursor)) {
                throw new PathResolutionException(Reason.CIRCULAR_REFERENCE, segment, "circular reference detected at key: " + segment);
            }

            cursor = switch (kind) {
                case OBJECT -> field(cursor, segment);
                case MAP -> entry((Map<?, ?>) cursor, segment);
                case SEQUENCE -> element(cursor, segment);
                default -> throw unsupported(cursor, segment);
            };
            if (ValueKind.of(cursor) == ValueKind.FUNCTION) {
                throw unsupportedFunction(segment);
            }
            i++;
        }

        while (cursor instanceof Optional<?> optional) {
            cursor = optional.orElse(null);
        }
        return cursor;
    }

    private static Object field(Object target, String segment) {
        Field field = FieldAccessors.field(target.getClass(), segment);
        if (field == null) {
            throw new PathResolutionException(Reason.FIELD_NOT_FOUND, segment, "field not found: " + segment);
        }
        if (ValueKind.isFunction(field.getType())) {
            throw unsupportedFunction(segment);
        }
        return FieldAccessors.read(field, target);
    }

    private static Object entry(Map<?, ?> map, String segment) {
        // sorted maps may reject a String probe
        if (map instanceof HashMap<?, ?> && map.containsKey(segment)) {
            return map.get(segment);
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (segment.equals(String.valueOf(entry.getKey()))) {
                return entry.getValue();
            }
        }
        throw new PathResolutionException(Reason.KEY_NOT_FOUND, segment, "key not found in map: " + segment);
    }

    private static Object element(Object sequence, String segment) {
        int index;
        try {
            index = Integer.parseInt(segment);
        }
        catch (NumberFormatException e) {
            throw new PathResolutionException(Reason.INVALID_INDEX, segment, "invalid array index at key: " + segment);
        }
        int length = sequence instanceof Collection<?> collection ? collection.size() : Array.getLength(sequence);
        if (index < 0 || index >= length) {
            throw new PathResolutionException(Reason.INDEX_OUT_OF_BOUNDS, segment, "array index out of bounds at key: " + segment);
        }
        if (sequence instanceof List<?> list) {
            return list.get(index);
        }
        if (sequence instanceof Collection<?> collection) {
            Iterator<?> iterator = collection.iterator();
            for (int i = 0; i < index; i++) {
                iterator.next();
            }
            return iterator.next();
        }
        return Array.get(sequence, index);
    }

    private static PathResolutionException unsupportedFunction(String segment) {
        return new PathResolutionException(Reason.UNSUPPORTED_TYPE, segment, "unsupported type: func at key: " + segment);
    }

    private static PathResolutionException unsupported(Object value, String segment) {
        return new PathResolutionException(Reason.UNSUPPORTED_TYPE, segment,
                "unsupported type: " + ValueKind.describe(value) + " at key: " + segment);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.builder;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.frame.internal.conversion.ValueConverter;
import dev.frame.internal.reflect.ValueKind;
import dev.frame.series.Series;
import dev.frame.series.Type;

/**
 * Turns the raw values extracted for one path into a typed Series.
 * <p>
 * The column type follows the first non-null value: integral numbers give INT, floating
 * point numbers FLOAT, booleans BOOL and anything else STRING. Values that do not fit that
 * type become missing cells. In STRING columns, objects, maps and sequences are encoded as
 * JSON; a value that cannot be encoded fails the build in strict mode and becomes a missing
 * cell otherwise.
 * </p>
 */
final class ColumnAssembler {

    private static final System.Logger LOG = System.getLogger(ColumnAssembler.class.getName());

    private final ObjectMapper mapper;

    ColumnAssembler(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    Series assemble(Object[] raw, String name, boolean strictMode) {
        Type type = inferType(raw);
        Object[] cells = new Object[raw.length];
        for (int i = 0; i < raw.length; i++) {
            cells[i] = cell(unwrap(raw[i]), type, name, strictMode);
        }
        return Series.of(cells, type, name);
    }

    static Type inferType(Object[] raw) {
        for (Object value : raw) {
            Object v = unwrap(value);
            if (v == null) {
                continue;
            }
            if (ValueConverter.isIntegral(v)) {
                return Type.INT;
            }
            if (ValueConverter.isFloating(v)) {
                return Type.FLOAT;
            }
            if (v instanceof Boolean) {
                return Type.BOOL;
            }
            return Type.STRING;
        }
        return Type.STRING;
    }

    private Object cell(Object value, Type type, String name, boolean strictMode) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case INT -> ValueConverter.isIntegral(value) ? ((Number) value).longValue() : null;
            case FLOAT -> ValueConverter.isFloating(value) ? ((Number) value).doubleValue() : null;
            case BOOL -> value instanceof Boolean ? value : null;
            case STRING -> ValueKind.of(value).isComposite() ? toJson(value, name, strictMode) : ValueConverter.toText(value);
        };
    }

    private String toJson(Object value, String name, boolean strictMode) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            if (strictMode) {
                throw new FrameBuildException("error encoding value of type " + value.getClass().getName() + " at path " + name + ": " + e.getOriginalMessage(), e);
            }
            LOG.log(System.Logger.Level.TRACE, "Value of type {0} at path ''{1}'' not encoded: {2}", value.getClass().getName(), name, e.getOriginalMessage());
            return null;
        }
    }

    static Object unwrap(Object value) {
        Object v = value;
        while (v instanceof Optional<?> optional) {
            v = optional.orElse(null);
        }
        return v;
    }
}

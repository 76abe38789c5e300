/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.builder;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.RandomAccess;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import dev.frame.dataframe.DataFrame;
import dev.frame.dataframe.DataFrameException;
import dev.frame.internal.conversion.FieldValueConverter;
import dev.frame.internal.reflect.FieldAccessors;
import dev.frame.path.PathResolutionException;
import dev.frame.path.PathResolver;
import dev.frame.series.Series;
import dev.frame.series.Type;

/**
 * Converts between collections of nested records and {@link DataFrame}s.
 * <p>
 * Columns are addressed by dotted paths, see {@link PathResolver}. In strict mode a path
 * that cannot be resolved for some record aborts the conversion; otherwise the cell is
 * left missing.
 * </p>
 * <p>
 * Configuration is read from system properties when a builder is created:
 * <ul>
 *   <li>{@code frame.builder.strict}: strict mode for the overloads without a
 *   {@code strictMode} argument, default {@code false}</li>
 *   <li>{@code frame.builder.json.sortKeys}: sort map keys when nested values are encoded
 *   as JSON, default {@code true}</li>
 * </ul>
 * </p>
 */
public final class FrameBuilder {

    private static final String STRICT_PROPERTY = "frame.builder.strict";
    private static final String SORT_KEYS_PROPERTY = "frame.builder.json.sortKeys";

    private static final System.Logger LOG = System.getLogger(FrameBuilder.class.getName());

    private final boolean defaultStrict;
    private final ColumnAssembler columns;

    private FrameBuilder(boolean defaultStrict, ObjectMapper mapper) {
        this.defaultStrict = defaultStrict;
        this.columns = new ColumnAssembler(mapper);
    }

    /**
     * Creates a builder configured from system properties.
     */
    public static FrameBuilder create() {
        boolean strict = Boolean.parseBoolean(System.getProperty(STRICT_PROPERTY, "false"));
        boolean sortKeys = !"false".equalsIgnoreCase(System.getProperty(SORT_KEYS_PROPERTY));
        LOG.log(System.Logger.Level.DEBUG, "Creating frame builder (strict={0}, sortKeys={1})", strict, sortKeys);
        return new FrameBuilder(strict, createMapper(sortKeys));
    }

    /**
     * Creates a builder that encodes nested values with the given mapper.
     */
    public static FrameBuilder create(ObjectMapper mapper) {
        boolean strict = Boolean.parseBoolean(System.getProperty(STRICT_PROPERTY, "false"));
        return new FrameBuilder(strict, mapper);
    }

    private static ObjectMapper createMapper(boolean sortKeys) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, sortKeys);
        return mapper;
    }

    /**
     * Strict mode used when none is given.
     */
    public boolean defaultStrict() {
        return defaultStrict;
    }

    // ==================== Records to DataFrame ====================

    public DataFrame flexibleToDataFrame(Object data, String... paths) {
        return flexibleToDataFrame(data, defaultStrict, paths);
    }

    /**
     * One column per path, one row per element of {@code data}.
     *
     * @param data a list, collection or array of records
     * @throws FrameBuildException if {@code data} is not a sequence, or in strict mode if a
     *     path cannot be resolved for some element
     */
    public DataFrame flexibleToDataFrame(Object data, boolean strictMode, String... paths) {
        List<?> rows = sequence(data);
        if (rows == null) {
            throw failure("input must be a slice");
        }
        LOG.log(System.Logger.Level.DEBUG, "Extracting {0} paths from {1} records (strict={2})", paths.length, rows.size(), strictMode);

        Series[] series = new Series[paths.length];
        for (int p = 0; p < paths.length; p++) {
            if (rows.isEmpty()) {
                series[p] = Series.of(new String[0], Type.STRING, paths[p]);
            }
            else {
                series[p] = columns.assemble(extract(rows, paths[p], strictMode), paths[p], strictMode);
            }
        }
        return checked(DataFrame.of(series));
    }

    private Object[] extract(List<?> rows, String path, boolean strictMode) {
        Object[] raw = new Object[rows.size()];
        for (int i = 0; i < raw.length; i++) {
            try {
                raw[i] = PathResolver.getValueByPath(rows.get(i), path);
            }
            catch (PathResolutionException e) {
                if (strictMode) {
                    throw new FrameBuildException("error extracting value from path " + path + " for element " + i + ": " + e.getMessage(), e);
                }
                LOG.log(System.Logger.Level.TRACE, "Path ''{0}'' not resolved for element {1}: {2}", path, i, e.getMessage());
                raw[i] = null;
            }
        }
        return raw;
    }

    public DataFrame mapToDataFrame(Object data, String topColumn, String... paths) {
        return mapToDataFrame(data, topColumn, defaultStrict, paths);
    }

    /**
     * Converts a map of record sequences. Keys are visited in sorted order of their string
     * form; each key's rows are tagged with the key in the {@code topColumn} column, placed
     * first.
     *
     * @throws FrameBuildException if {@code data} is not a map or a value cannot be converted
     */
    public DataFrame mapToDataFrame(Object data, String topColumn, boolean strictMode, String... paths) {
        if (!(data instanceof Map<?, ?> map)) {
            throw failure("input must be a map");
        }
        Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        LOG.log(System.Logger.Level.DEBUG, "Converting map with {0} keys into column ''{1}''", sorted.size(), topColumn);

        DataFrame result = DataFrame.of();
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            DataFrame frame = flexibleToDataFrame(ColumnAssembler.unwrap(entry.getValue()), strictMode, paths);
            String[] tags = new String[frame.nrow()];
            Arrays.fill(tags, entry.getKey());
            List<String> names = new ArrayList<>();
            names.add(topColumn);
            names.addAll(frame.names());
            frame = frame.mutate(Series.of(tags, Type.STRING, topColumn)).select(names);
            result = result.concat(frame);
        }
        return checked(result);
    }

    public DataFrame deepSliceToDataFrame(Object data, String topColumnPath, String slicePath, String... paths) {
        return deepSliceToDataFrame(data, topColumnPath, slicePath, defaultStrict, paths);
    }

    /**
     * Flattens the sequence found at {@code slicePath} in every record, tagging each nested
     * element with the record's value at {@code topColumnPath}. The STRING tag column,
     * named after {@code topColumnPath}, comes first.
     *
     * @throws FrameBuildException if {@code data} is not a sequence, a value at
     *     {@code slicePath} is not a sequence, or in strict mode a path cannot be resolved
     */
    public DataFrame deepSliceToDataFrame(Object data, String topColumnPath, String slicePath, boolean strictMode, String... paths) {
        List<?> rows = sequence(data);
        if (rows == null) {
            throw failure("input must be a slice");
        }
        List<Object> tags = new ArrayList<>();
        List<Object> items = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Object record = rows.get(i);
            Object tag;
            try {
                tag = PathResolver.getValueByPath(record, topColumnPath);
            }
            catch (PathResolutionException e) {
                if (strictMode) {
                    throw new FrameBuildException("error extracting top column value at index " + i + ": " + e.getMessage(), e);
                }
                tag = null;
            }
            List<?> nested = nestedSequence(record, slicePath, strictMode, i);
            if (nested == null) {
                continue;
            }
            for (Object item : nested) {
                tags.add(tag);
                items.add(item);
            }
        }
        LOG.log(System.Logger.Level.DEBUG, "Flattened {0} records into {1} rows", rows.size(), items.size());

        DataFrame frame;
        try {
            frame = flexibleToDataFrame(items, strictMode, paths);
        }
        catch (FrameBuildException e) {
            throw new FrameBuildException("error creating DataFrame from deep slice data: " + e.getMessage(), e, e.frame());
        }
        List<String> names = new ArrayList<>();
        names.add(topColumnPath);
        names.addAll(frame.names());
        Series tagColumn = Series.of(tags, Type.STRING, topColumnPath);
        return checked(frame.mutate(tagColumn).select(names));
    }

    /**
     * The sequence at {@code slicePath}, or {@code null} if it cannot be resolved in
     * non-strict mode.
     */
    private List<?> nestedSequence(Object record, String slicePath, boolean strictMode, int index) {
        Object value;
        try {
            value = PathResolver.getValueByPath(record, slicePath);
        }
        catch (PathResolutionException e) {
            if (strictMode) {
                throw new FrameBuildException("error extracting deep slice at index " + index + ": " + e.getMessage(), e);
            }
            LOG.log(System.Logger.Level.TRACE, "Skipping record {0}: {1}", index, e.getMessage());
            return null;
        }
        List<?> nested = sequence(value);
        if (nested == null) {
            throw failure("value at slicePath must be a slice");
        }
        return nested;
    }

    // ==================== DataFrame to Objects ====================

    public <T> List<T> dataFrameToObjects(DataFrame df, Class<T> type) {
        return dataFrameToObjects(df, type, null);
    }

    /**
     * Creates one {@code T} per row. Fields annotated with {@link JsonProperty} receive the
     * cell of the column named by the annotation (or the field name when the annotation has
     * no value). Missing cells and absent columns leave the field at its default.
     *
     * @param factory creates empty instances; {@code null} to use the no-arg constructor
     * @throws FrameBuildException if a cell does not fit its field or a required column is
     *     absent
     */
    public <T> List<T> dataFrameToObjects(DataFrame df, Class<T> type, Supplier<T> factory) {
        if (df.error() != null) {
            throw new FrameBuildException("dataframe has errors: " + df.error().getMessage(), df.error(), df);
        }
        Map<String, Field> tagged = new LinkedHashMap<>();
        Set<String> required = new HashSet<>();
        for (Field field : FieldAccessors.fields(type).values()) {
            JsonProperty property = field.getAnnotation(JsonProperty.class);
            if (property == null) {
                continue;
            }
            String tag = property.value().isEmpty() ? field.getName() : property.value();
            tagged.put(tag, field);
            if (property.required()) {
                required.add(tag);
            }
        }
        Set<String> columnNames = new HashSet<>(df.names());
        ObjectAssembler<T> assembler = new ObjectAssembler<>(type, factory);
        List<T> result = new ArrayList<>(df.nrow());
        for (int i = 0; i < df.nrow(); i++) {
            Map<String, Object> row = df.row(i);
            Map<Field, Object> values = new LinkedHashMap<>();
            List<String> missing = new ArrayList<>();
            for (Map.Entry<String, Field> entry : tagged.entrySet()) {
                String tag = entry.getKey();
                if (!columnNames.contains(tag)) {
                    if (required.contains(tag)) {
                        missing.add(tag);
                    }
                    continue;
                }
                Object cell = row.get(tag);
                if (cell == null) {
                    continue;
                }
                try {
                    values.put(entry.getValue(), FieldValueConverter.convert(cell, entry.getValue().getType()));
                }
                catch (IllegalArgumentException e) {
                    throw new FrameBuildException("error setting field for tag '" + tag + "' at row " + i + ": " + e.getMessage(), e);
                }
            }
            if (!missing.isEmpty()) {
                throw new FrameBuildException("missing required fields at row " + i + ": " + missing);
            }
            result.add(assembler.assemble(values));
        }
        return result;
    }

    public <T> List<T> deepSliceToList(Object data, Class<T> type, String slicePath, boolean strictMode, String... paths) {
        return deepSliceToList(data, type, null, slicePath, strictMode, paths);
    }

    /**
     * Flattens the sequence found at {@code slicePath} in every record into a list of
     * {@code T}. Without paths, every nested element must be a {@code T} and is deep-copied.
     * With paths, each path is resolved on the nested element and assigned to the field of
     * the same name.
     *
     * @param factory creates empty instances; {@code null} to use the no-arg constructor
     * @throws FrameBuildException on type mismatches, values that do not fit their field, or
     *     in strict mode unresolvable paths
     */
    public <T> List<T> deepSliceToList(Object data, Class<T> type, Supplier<T> factory, String slicePath, boolean strictMode, String... paths) {
        List<?> rows = sequence(data);
        if (rows == null) {
            throw failure("input must be a slice");
        }
        ObjectAssembler<T> assembler = paths.length == 0 ? null : new ObjectAssembler<>(type, factory);
        List<T> result = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            List<?> nested = nestedSequence(rows.get(i), slicePath, strictMode, i);
            if (nested == null) {
                continue;
            }
            for (int j = 0; j < nested.size(); j++) {
                Object item = nested.get(j);
                if (assembler == null) {
                    result.add(copyElement(item, type, i, j));
                }
                else {
                    result.add(assembler.assemble(fieldValues(item, type, strictMode, i, j, paths)));
                }
            }
        }
        return result;
    }

    private static <T> T copyElement(Object item, Class<T> type, int i, int j) {
        if (!type.isInstance(item)) {
            throw new FrameBuildException("element type mismatch at index " + i + "," + j + ": expected " + type.getName()
                    + ", got " + (item == null ? "null" : item.getClass().getName()));
        }
        try {
            return DeepCopy.copy(item, type);
        }
        catch (DeepCopyException e) {
            throw new FrameBuildException("error deep copying element at index " + i + "," + j + ": " + e.getMessage(), e);
        }
    }

    private static Map<Field, Object> fieldValues(Object item, Class<?> type, boolean strictMode, int i, int j, String... paths) {
        Map<Field, Object> values = new LinkedHashMap<>();
        for (String path : paths) {
            Object value;
            try {
                value = ColumnAssembler.unwrap(PathResolver.getValueByPath(item, path));
            }
            catch (PathResolutionException e) {
                if (strictMode) {
                    throw new FrameBuildException("error extracting value from path " + path + " for element " + i + "," + j + ": " + e.getMessage(), e);
                }
                value = null;
            }
            Field field = FieldAccessors.field(type, path);
            if (field == null || value == null) {
                continue;
            }
            try {
                values.put(field, FieldValueConverter.convert(value, field.getType()));
            }
            catch (IllegalArgumentException e) {
                throw new FrameBuildException("error setting field " + path + ": " + e.getMessage(), e);
            }
        }
        return values;
    }

    // ==================== Helpers ====================

    /**
     * Lists, other collections and arrays as a random-access list; {@code null} for
     * anything else.
     */
    private static List<?> sequence(Object data) {
        if (data instanceof List<?> list && list instanceof RandomAccess) {
            return list;
        }
        if (data instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (data != null && data.getClass().isArray()) {
            int length = Array.getLength(data);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(data, i));
            }
            return list;
        }
        return null;
    }

    private static FrameBuildException failure(String message) {
        DataFrameException error = new DataFrameException(message);
        return new FrameBuildException(message, error, DataFrame.of().withError(error));
    }

    private static DataFrame checked(DataFrame frame) {
        if (frame.error() != null) {
            throw new FrameBuildException(frame.error().getMessage(), frame.error(), frame);
        }
        return frame;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.frame.series.Element;
import dev.frame.series.Series;
import dev.frame.series.SeriesException;
import dev.frame.series.Type;

/**
 * An ordered collection of uniquely named, equal-length {@link Series}.
 * <p>
 * Every operation returns a new frame. Like Series, a frame may carry a sticky
 * {@link #error()}; operations on such a frame return it unchanged.
 * </p>
 */
public final class DataFrame {

    private final List<Series> columns;
    private final DataFrameException error;

    private DataFrame(List<Series> columns, DataFrameException error) {
        this.columns = columns;
        this.error = error;
    }

    // ==================== Construction ====================

    /**
     * Creates a frame from copies of the given Series. Unnamed Series are called
     * {@code X0}, {@code X1}, ... after their position.
     */
    public static DataFrame of(Series... series) {
        List<Series> columns = new ArrayList<>(series.length);
        for (int i = 0; i < series.length; i++) {
            Series column = series[i].copy();
            if (column.error() != null) {
                return failed("series " + i + " has errors: " + column.error().getMessage(), column.error());
            }
            if (column.name().isEmpty()) {
                column.setName("X" + i);
            }
            columns.add(column);
        }
        return validated(columns);
    }

    public static DataFrame of(List<Series> series) {
        return of(series.toArray(new Series[0]));
    }

    private static DataFrame validated(List<Series> columns) {
        Set<String> names = new HashSet<>();
        for (Series column : columns) {
            if (column.len() != columns.get(0).len()) {
                return failed("arguments have different dimensions");
            }
            if (!names.add(column.name())) {
                return failed("duplicated column name: " + column.name());
            }
        }
        return new DataFrame(columns, null);
    }

    private static DataFrame failed(String message) {
        return new DataFrame(List.of(), new DataFrameException(message));
    }

    private static DataFrame failed(String message, Throwable cause) {
        return new DataFrame(List.of(), new DataFrameException(message, cause));
    }

    /**
     * This frame with the given error attached.
     */
    public DataFrame withError(DataFrameException error) {
        return new DataFrame(columns, error);
    }

    // ==================== Accessors ====================

    public DataFrameException error() {
        return error;
    }

    public int nrow() {
        return columns.isEmpty() ? 0 : columns.get(0).len();
    }

    public int ncol() {
        return columns.size();
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(columns.size());
        for (Series column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public List<Type> types() {
        List<Type> types = new ArrayList<>(columns.size());
        for (Series column : columns) {
            types.add(column.type());
        }
        return types;
    }

    /**
     * A copy of the named column, or a poisoned empty Series if there is none.
     */
    public Series col(String name) {
        int index = indexOf(name);
        if (index < 0) {
            return Series.of(new Object[0], Type.STRING, name).withError(new SeriesException("unknown column name: " + name));
        }
        return columns.get(index).copy();
    }

    /**
     * Column name to native value for row {@code i}, in column order.
     */
    public Map<String, Object> row(int i) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Series column : columns) {
            row.put(column.name(), column.val(i));
        }
        return row;
    }

    public Element elem(int row, int column) {
        return columns.get(column).elem(row);
    }

    /**
     * Text of every cell, header row first.
     */
    public List<List<String>> records() {
        List<List<String>> records = new ArrayList<>(nrow() + 1);
        records.add(names());
        List<List<String>> cells = new ArrayList<>(columns.size());
        for (Series column : columns) {
            cells.add(column.records());
        }
        for (int i = 0; i < nrow(); i++) {
            List<String> record = new ArrayList<>(columns.size());
            for (List<String> column : cells) {
                record.add(column.get(i));
            }
            records.add(record);
        }
        return records;
    }

    public boolean equal(DataFrame other) {
        if (ncol() != other.ncol()) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).equal(other.columns.get(i))) {
                return false;
            }
        }
        return true;
    }

    public RowsIterator rowsIterator() {
        return rowsIterator(RowIterationOptions.defaults());
    }

    public RowsIterator rowsIterator(RowIterationOptions options) {
        return new RowsIterator(this, options);
    }

    private int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Column Operations ====================

    /**
     * Replaces the column of the same name, or appends the Series as a new column.
     */
    public DataFrame mutate(Series series) {
        if (error != null) {
            return this;
        }
        if (series.error() != null) {
            return withError(new DataFrameException("mutate: argument has errors: " + series.error().getMessage(), series.error()));
        }
        if (!columns.isEmpty() && series.len() != nrow()) {
            return withError(new DataFrameException("mutate: wrong dimensions"));
        }
        List<Series> result = new ArrayList<>(columns);
        int index = indexOf(series.name());
        if (index >= 0) {
            result.set(index, series.copy());
        }
        else {
            result.add(series.copy());
        }
        return new DataFrame(result, null);
    }

    /**
     * Projects and reorders columns.
     */
    public DataFrame select(String... names) {
        if (error != null) {
            return this;
        }
        List<Series> result = new ArrayList<>(names.length);
        for (String name : names) {
            int index = indexOf(name);
            if (index < 0) {
                return withError(new DataFrameException("select: column name \"" + name + "\" not found"));
            }
            result.add(columns.get(index));
        }
        return validated(result);
    }

    public DataFrame select(List<String> names) {
        return select(names.toArray(new String[0]));
    }

    /**
     * Rows of this frame followed by the rows of {@code other}. Columns are matched by
     * name; a column present on one side only is padded with missing cells.
     */
    public DataFrame concat(DataFrame other) {
        if (error != null) {
            return this;
        }
        if (other.error != null) {
            return withError(new DataFrameException("concat: argument has errors: " + other.error.getMessage(), other.error));
        }
        if (columns.isEmpty()) {
            return other;
        }
        if (other.columns.isEmpty()) {
            return this;
        }
        List<String> names = new ArrayList<>(names());
        for (String name : other.names()) {
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        List<Series> result = new ArrayList<>(names.size());
        for (String name : names) {
            int left = indexOf(name);
            int right = other.indexOf(name);
            Series head = left >= 0 ? columns.get(left)
                    : Series.of(new Object[nrow()], other.columns.get(right).type(), name);
            Series tail = right >= 0 ? other.columns.get(right)
                    : Series.of(new Object[other.nrow()], head.type(), name);
            result.add(head.concat(tail));
        }
        return new DataFrame(result, null);
    }

    /**
     * Concatenates the frames in order; no frames give an empty frame.
     */
    public static DataFrame concat(DataFrame... frames) {
        DataFrame result = new DataFrame(List.of(), null);
        for (DataFrame frame : frames) {
            result = result.concat(frame);
        }
        return result;
    }

    // ==================== Row Operations ====================

    /**
     * Rows at the given positions, in that order.
     */
    public DataFrame subset(int[] rows) {
        if (error != null) {
            return this;
        }
        List<Series> result = new ArrayList<>(columns.size());
        for (Series column : columns) {
            Series subset = column.subset(rows);
            if (subset.error() != null) {
                return withError(new DataFrameException(subset.error().getMessage(), subset.error()));
            }
            result.add(subset);
        }
        return new DataFrame(result, null);
    }

    /**
     * First occurrence of every distinct row, compared by cell text.
     */
    public DataFrame distinct() {
        if (error != null) {
            return this;
        }
        Set<List<String>> seen = new HashSet<>();
        List<Integer> keep = new ArrayList<>();
        List<List<String>> records = records();
        for (int i = 0; i < nrow(); i++) {
            if (seen.add(records.get(i + 1))) {
                keep.add(i);
            }
        }
        return subset(toArray(keep));
    }

    /**
     * Every row of this frame combined with every row of {@code other}.
     */
    public DataFrame crossJoin(DataFrame other) {
        return crossJoin(other, JoinOptions.defaults());
    }

    public DataFrame crossJoin(DataFrame other, JoinOptions options) {
        if (error != null) {
            return this;
        }
        if (other.error != null) {
            return withError(new DataFrameException("cross join: argument has errors: " + other.error.getMessage(), other.error));
        }
        int left = nrow();
        int right = other.nrow();
        int[] leftRows = new int[left * right];
        int[] rightRows = new int[left * right];
        for (int i = 0; i < left; i++) {
            for (int j = 0; j < right; j++) {
                leftRows[i * right + j] = i;
                rightRows[i * right + j] = j;
            }
        }
        List<Series> result = new ArrayList<>();
        for (Series column : columns) {
            result.add(column.subset(leftRows));
        }
        Set<String> leftNames = new HashSet<>(names());
        if (right > 0) {
            for (Series column : other.columns) {
                Series joined = column.subset(rightRows);
                if (leftNames.contains(joined.name())) {
                    joined.setName(joined.name() + options.rightSuffix());
                }
                result.add(joined);
            }
        }
        return validated(result);
    }

    /**
     * Rows of {@code left} whose values in {@code keys} match no row of {@code right}.
     */
    public static DataFrame antiJoin(DataFrame left, DataFrame right, String... keys) {
        if (left.error != null) {
            return left;
        }
        if (right.error != null) {
            return left.withError(new DataFrameException("anti join: argument has errors: " + right.error.getMessage(), right.error));
        }
        for (String key : keys) {
            if (left.indexOf(key) < 0 || right.indexOf(key) < 0) {
                return left.withError(new DataFrameException("anti join: key column \"" + key + "\" not found"));
            }
        }
        Set<List<String>> rightKeys = new HashSet<>();
        for (int i = 0; i < right.nrow(); i++) {
            rightKeys.add(right.keyOf(i, List.of(keys)));
        }
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < left.nrow(); i++) {
            if (!rightKeys.contains(left.keyOf(i, List.of(keys)))) {
                keep.add(i);
            }
        }
        return left.subset(toArray(keep));
    }

    private List<String> keyOf(int row, List<String> keys) {
        List<String> key = new ArrayList<>(keys.size());
        for (String name : keys) {
            key.add(columns.get(indexOf(name)).elem(row).toString());
        }
        return key;
    }

    // ==================== Aggregation ====================

    /**
     * Groups rows on the key columns and aggregates each requested column per group.
     * <p>
     * The result holds the key columns (one row per group, in order of first appearance)
     * followed by the FLOAT aggregate columns sorted by name. With a left join, the
     * aggregates are instead appended to every row of the join frame; rows without a
     * matching group get NaN.
     * </p>
     */
    public static DataFrame groupAggregate(DataFrame df, GroupAggregation aggregation) {
        if (df.error != null) {
            return df;
        }
        List<String> required = new ArrayList<>(aggregation.keys());
        required.addAll(aggregation.columns());
        for (String name : required) {
            if (df.indexOf(name) < 0) {
                return df.withError(new DataFrameException("group aggregate: column \"" + name + "\" not found"));
            }
        }

        Map<List<String>, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < df.nrow(); i++) {
            groups.computeIfAbsent(df.keyOf(i, aggregation.keys()), k -> new ArrayList<>()).add(i);
        }

        Map<String, double[]> aggregates = new LinkedHashMap<>();
        for (int a = 0; a < aggregation.columns().size(); a++) {
            Aggregation type = aggregation.aggregations().get(a);
            Series column = df.columns.get(df.indexOf(aggregation.columns().get(a)));
            double[] values = new double[groups.size()];
            int g = 0;
            for (List<Integer> rows : groups.values()) {
                values[g++] = type.apply(column.subset(toArray(rows)));
            }
            aggregates.put(type.columnName(column.name()), values);
        }
        List<String> aggregateNames = new ArrayList<>(aggregates.keySet());
        Collections.sort(aggregateNames);

        if (aggregation.joinFrame() != null) {
            return leftJoin(aggregation, new ArrayList<>(groups.keySet()), aggregates, aggregateNames);
        }

        int[] firstRows = new int[groups.size()];
        int g = 0;
        for (List<Integer> rows : groups.values()) {
            firstRows[g++] = rows.get(0);
        }
        List<Series> result = new ArrayList<>();
        for (String key : aggregation.keys()) {
            result.add(df.columns.get(df.indexOf(key)).subset(firstRows));
        }
        for (String name : aggregateNames) {
            result.add(Series.of(aggregates.get(name), Type.FLOAT, name));
        }
        return validated(result);
    }

    private static DataFrame leftJoin(GroupAggregation aggregation, List<List<String>> groupKeys,
                                      Map<String, double[]> aggregates, List<String> aggregateNames) {
        DataFrame target = aggregation.joinFrame();
        if (target.error != null) {
            return target;
        }
        for (String key : aggregation.joinKeys()) {
            if (target.indexOf(key) < 0) {
                return target.withError(new DataFrameException("group aggregate: join column \"" + key + "\" not found"));
            }
        }
        Map<List<String>, Integer> groupIndex = new LinkedHashMap<>();
        for (int g = 0; g < groupKeys.size(); g++) {
            groupIndex.put(groupKeys.get(g), g);
        }
        DataFrame result = target;
        for (String name : aggregateNames) {
            double[] perGroup = aggregates.get(name);
            double[] values = new double[target.nrow()];
            for (int i = 0; i < values.length; i++) {
                Integer g = groupIndex.get(target.keyOf(i, aggregation.joinKeys()));
                values[i] = g == null ? Double.NaN : perGroup[g];
            }
            result = result.mutate(Series.of(values, Type.FLOAT, name));
        }
        return result;
    }

    /**
     * Row-wise maximum over the named INT and FLOAT columns; other and unknown columns are
     * ignored. The result has the type of the first usable column. Without usable columns
     * the result is a single NaN FLOAT cell.
     */
    public static Series maxInColumns(DataFrame df, String name, String... columns) {
        return inColumns(df, name, true, columns);
    }

    /**
     * Row-wise minimum, see {@link #maxInColumns(DataFrame, String, String...)}.
     */
    public static Series minInColumns(DataFrame df, String name, String... columns) {
        return inColumns(df, name, false, columns);
    }

    private static Series inColumns(DataFrame df, String name, boolean max, String... columns) {
        List<Series> usable = new ArrayList<>();
        for (String column : columns) {
            int index = df.indexOf(column);
            if (index >= 0 && df.columns.get(index).type().isNumeric()) {
                usable.add(df.columns.get(index));
            }
        }
        if (usable.isEmpty()) {
            return Series.of(null, Type.FLOAT, "");
        }
        Series[] inputs = usable.toArray(new Series[0]);
        Series result = max ? Series.max(name, inputs) : Series.min(name, inputs);
        if (result.error() != null) {
            return result;
        }
        return Series.of(result, inputs[0].type(), result.name());
    }

    private static int[] toArray(List<Integer> values) {
        int[] result = new int[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(nrow()).append('x').append(ncol()).append("] DataFrame");
        for (List<String> record : records()) {
            sb.append('\n').append(String.join("\t", record));
        }
        return sb.toString();
    }
}

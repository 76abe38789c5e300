/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

import dev.frame.internal.series.ColumnValues;
import dev.frame.internal.series.Indexes;

/**
 * A named, homogeneously typed column of cells.
 * <p>
 * A Series carries an optional sticky error. Operations on a Series whose {@link #error()}
 * is set return that Series unchanged, so call chains can be checked once at the end.
 * {@link #append(Object)} and {@link #set(Object, Series)} mutate the receiver; all other
 * operations return a Series with its own storage.
 * </p>
 *
 * <pre>{@code
 * Series x = Series.of(new long[]{ 1, 2, 3 }, Type.INT, "x");
 * Series y = x.subset(new int[]{ 2, 0 }).add(1);
 * if (y.error() != null) {
 *     throw y.error();
 * }
 * }</pre>
 */
public final class Series {

    private String name;
    private final Type type;
    private final ColumnValues values;
    private final SeriesException error;

    Series(String name, Type type, ColumnValues values, SeriesException error) {
        this.name = name == null ? "" : name;
        this.type = type;
        this.values = values;
        this.error = error;
    }

    // ==================== Construction ====================

    /**
     * Creates a Series of the given type.
     *
     * @param values {@code null} (one missing cell), an array, a {@link Collection}, another
     *     Series (copied with coercion) or a single value
     * @param type the cell type
     * @param name the Series name, may be empty
     */
    public static Series of(Object values, Type type, String name) {
        Objects.requireNonNull(type, "type");
        ColumnValues column;
        if (values == null) {
            column = ColumnValues.allocate(type, 1);
        }
        else if (values instanceof Series source) {
            if (source.type == type) {
                column = source.values.copy();
            }
            else {
                column = ColumnValues.allocate(type, source.len());
                for (int i = 0; i < source.len(); i++) {
                    column.set(i, source.values.val(i));
                }
            }
        }
        else if (values instanceof Collection<?> collection) {
            column = ColumnValues.allocate(type, collection.size());
            int i = 0;
            for (Object value : collection) {
                column.set(i++, value);
            }
        }
        else if (values.getClass().isArray()) {
            int length = Array.getLength(values);
            column = ColumnValues.allocate(type, length);
            for (int i = 0; i < length; i++) {
                column.set(i, Array.get(values, i));
            }
        }
        else {
            column = ColumnValues.allocate(type, 1);
            column.set(0, values);
        }
        return new Series(name, type, column, null);
    }

    public static Series ofStrings(Object values) {
        return of(values, Type.STRING, "");
    }

    public static Series ofInts(Object values) {
        return of(values, Type.INT, "");
    }

    public static Series ofFloats(Object values) {
        return of(values, Type.FLOAT, "");
    }

    public static Series ofBools(Object values) {
        return of(values, Type.BOOL, "");
    }

    /**
     * Builds a Series from an iterator. The type is taken from the first value:
     * {@link Double} or {@link Float} give FLOAT, {@link Boolean} gives BOOL, anything
     * else gives STRING. An empty iterator gives an empty STRING Series.
     */
    public static Series fromIterator(Iterator<IndexedValue> iterator, String name) {
        if (!iterator.hasNext()) {
            return new Series(name, Type.STRING, ColumnValues.allocate(Type.STRING, 0), null);
        }
        Object first = iterator.next().value();
        Type type;
        if (first instanceof Double || first instanceof Float) {
            type = Type.FLOAT;
        }
        else if (first instanceof Boolean) {
            type = Type.BOOL;
        }
        else {
            type = Type.STRING;
        }
        Series result = of(first, type, name);
        while (iterator.hasNext()) {
            result.values.add(iterator.next().value());
        }
        return result;
    }

    /**
     * A Series of the same type and name with no cells.
     */
    public Series empty() {
        return new Series(name, type, ColumnValues.allocate(type, 0), null);
    }

    /**
     * A Series as long as this one with every cell set to {@code value}. The value must
     * already be of the native class of {@code type}.
     */
    public Series newFill(Object value, Type type, String name) {
        boolean matches = switch (type) {
            case STRING -> value instanceof String;
            case INT -> value instanceof Integer || value instanceof Long;
            case FLOAT -> value instanceof Double;
            case BOOL -> value instanceof Boolean;
        };
        if (!matches) {
            return new Series(name, type, ColumnValues.allocate(type, 0), new SeriesException("newfill error: value type mismatch"));
        }
        ColumnValues column = ColumnValues.allocate(type, len());
        for (int i = 0; i < len(); i++) {
            column.set(i, value);
        }
        return new Series(name, type, column, null);
    }

    /**
     * A Series sharing this one's cells and carrying the given error.
     */
    public Series withError(SeriesException error) {
        return new Series(name, type, values, error);
    }

    // ==================== Accessors ====================

    public SeriesException error() {
        return error;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public Type type() {
        return type;
    }

    public int len() {
        return values.size();
    }

    /**
     * Native value of a cell, {@code null} for NA and missing cells.
     */
    public Object val(int index) {
        Objects.checkIndex(index, len());
        return values.val(index);
    }

    /**
     * Detached copy of a cell.
     */
    public Element elem(int index) {
        Objects.checkIndex(index, len());
        return values.elem(index);
    }

    ColumnValues values() {
        return values;
    }

    public List<String> records() {
        List<String> records = new ArrayList<>(len());
        for (int i = 0; i < len(); i++) {
            records.add(values.text(i));
        }
        return records;
    }

    /**
     * Float projection of every cell; cells without a numeric value become NaN.
     */
    public double[] floats() {
        double[] result = new double[len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.toDouble(i);
        }
        return result;
    }

    /**
     * @throws SeriesException if any cell has no integer value
     */
    public long[] ints() {
        long[] result = new long[len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.elem(i).toLong();
        }
        return result;
    }

    /**
     * @throws SeriesException if any cell has no boolean value
     */
    public boolean[] bools() {
        boolean[] result = new boolean[len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.elem(i).toBool();
        }
        return result;
    }

    public boolean hasNaN() {
        for (int i = 0; i < len(); i++) {
            if (values.isNA(i)) {
                return true;
            }
        }
        return false;
    }

    public boolean[] isNaN() {
        boolean[] result = new boolean[len()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.isNA(i);
        }
        return result;
    }

    // ==================== Mutation ====================

    /**
     * Appends values, coerced to this Series' type, in place.
     */
    public void append(Object newValues) {
        if (error != null) {
            return;
        }
        values.addAll(of(newValues, type, name).values);
    }

    /**
     * Overwrites the cells at {@code indexes} with the cells of {@code newValues}, in place.
     *
     * @return this Series, or a poisoned view of it on failure
     */
    public Series set(Object indexes, Series newValues) {
        if (error != null) {
            return this;
        }
        if (newValues.error != null) {
            return withError(new SeriesException("set error: argument has errors: " + newValues.error.getMessage(), newValues.error));
        }
        int[] positions;
        try {
            positions = Indexes.resolve(indexes, len());
        }
        catch (SeriesException e) {
            return withError(e);
        }
        if (positions.length != newValues.len()) {
            return withError(new SeriesException("set error: dimensions mismatch"));
        }
        for (int k = 0; k < positions.length; k++) {
            values.set(positions[k], newValues.values.val(k));
        }
        return this;
    }

    // ==================== Transformation ====================

    public Series copy() {
        return new Series(name, type, values.copy(), error);
    }

    public Series concat(Series other) {
        if (error != null) {
            return this;
        }
        if (other.error != null) {
            return withError(new SeriesException("concat error: argument has errors: " + other.error.getMessage(), other.error));
        }
        Series result = copy();
        result.append(other);
        return result;
    }

    public Series subset(Object indexes) {
        if (error != null) {
            return this;
        }
        try {
            return new Series(name, type, values.subset(Indexes.resolve(indexes, len())), null);
        }
        catch (SeriesException e) {
            return withError(e);
        }
    }

    /**
     * Cells {@code from} (inclusive) to {@code to} (exclusive).
     */
    public Series slice(int from, int to) {
        if (error != null) {
            return this;
        }
        if (from < 0 || from > to || to > len()) {
            return empty().withError(new SeriesException("slice index out of bounds"));
        }
        int[] positions = new int[to - from];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = from + i;
        }
        return new Series(name, type, values.subset(positions), null);
    }

    /**
     * Applies {@code f} to every cell; results are coerced back to this Series' type.
     */
    public Series map(Function<Element, Element> f) {
        if (error != null) {
            return this;
        }
        ColumnValues column = ColumnValues.allocate(type, len());
        for (int i = 0; i < len(); i++) {
            column.set(i, f.apply(values.elem(i)));
        }
        return new Series(name, type, column, null);
    }

    // ==================== Comparison ====================

    /**
     * Compares every cell with {@code comparando} and returns a BOOL Series.
     * <p>
     * For {@link Comparator#FUNC} the comparando must be a {@code Predicate<Element>}.
     * Otherwise it is converted to a Series of this type: one cell is compared with
     * every cell, a Series of the same length is compared pairwise, and
     * {@link Comparator#IN} tests membership.
     * </p>
     *
     * @throws IllegalArgumentException if {@code FUNC} is used without a predicate
     */
    @SuppressWarnings("unchecked")
    public Series compare(Comparator comparator, Object comparando) {
        if (error != null) {
            return this;
        }
        boolean[] result = new boolean[len()];
        if (comparator == Comparator.FUNC) {
            if (!(comparando instanceof Predicate<?> predicate)) {
                throw new IllegalArgumentException("Comparando of " + comparator + " must be a Predicate<Element>");
            }
            Predicate<Element> test = (Predicate<Element>) predicate;
            for (int i = 0; i < result.length; i++) {
                result[i] = test.test(values.elem(i));
            }
            return ofBools(result);
        }

        Series other = of(comparando, type, "");
        if (comparator == Comparator.IN) {
            for (int i = 0; i < result.length; i++) {
                Element element = values.elem(i);
                for (int j = 0; j < other.len() && !result[i]; j++) {
                    result[i] = element.eq(other.values.elem(j));
                }
            }
            return ofBools(result);
        }
        if (other.len() == 1) {
            Element single = other.values.elem(0);
            for (int i = 0; i < result.length; i++) {
                result[i] = comparator.test(values.elem(i), single);
            }
            return ofBools(result);
        }
        if (other.len() != len()) {
            return new Series(name, Type.BOOL, ColumnValues.allocate(Type.BOOL, 0), new SeriesException("can't compare: length mismatch"));
        }
        for (int i = 0; i < result.length; i++) {
            result[i] = comparator.test(values.elem(i), other.values.elem(i));
        }
        return ofBools(result);
    }

    /**
     * Same name, type, length and pairwise equal cells.
     */
    public boolean equal(Series other) {
        if (!name.equals(other.name) || type != other.type || len() != other.len()) {
            return false;
        }
        for (int i = 0; i < len(); i++) {
            if (!values.elem(i).eq(other.values.elem(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Positions that sort this Series. The sort is stable; NA and missing cells are
     * placed last in their original order whatever the direction.
     */
    public int[] order(boolean reverse) {
        List<Integer> present = new ArrayList<>(len());
        List<Integer> absent = new ArrayList<>();
        for (int i = 0; i < len(); i++) {
            if (values.isNA(i) || values.val(i) == null) {
                absent.add(i);
            }
            else {
                present.add(i);
            }
        }
        Integer[] sorted = present.toArray(new Integer[0]);
        java.util.Comparator<Integer> byCell = values::compareCells;
        Arrays.sort(sorted, reverse ? byCell.reversed() : byCell);

        int[] result = new int[len()];
        int k = 0;
        for (Integer index : sorted) {
            result[k++] = index;
        }
        for (Integer index : absent) {
            result[k++] = index;
        }
        return result;
    }

    // ==================== Arithmetic ====================

    public Series add(Object operand) {
        return add(operand, null);
    }

    /**
     * Adds a number or, cell by cell, another numeric Series.
     *
     * @param name result name; when empty, {@code <name>_add_<operand>}
     */
    public Series add(Object operand, String name) {
        return Arithmetic.apply(this, operand, Arithmetic.Operation.ADD, name);
    }

    public Series sub(Object operand) {
        return sub(operand, null);
    }

    public Series sub(Object operand, String name) {
        return Arithmetic.apply(this, operand, Arithmetic.Operation.SUB, name);
    }

    public Series mul(Object operand) {
        return mul(operand, null);
    }

    public Series mul(Object operand, String name) {
        return Arithmetic.apply(this, operand, Arithmetic.Operation.MUL, name);
    }

    public Series div(Object operand) {
        return div(operand, null);
    }

    /**
     * Divides by a number or another numeric Series. INT division truncates toward zero.
     * Division by zero returns a poisoned Series of the full length.
     */
    public Series div(Object operand, String name) {
        return Arithmetic.apply(this, operand, Arithmetic.Operation.DIV, name);
    }

    // ==================== Aggregates ====================

    public double sum() {
        if (len() == 0 || type == Type.STRING || type == Type.BOOL) {
            return Double.NaN;
        }
        double sum = 0;
        for (double value : floats()) {
            sum += value;
        }
        return sum;
    }

    public double mean() {
        double[] values = floats();
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation; 0 for a single cell.
     */
    public double stdDev() {
        double[] values = floats();
        if (values.length == 0) {
            return Double.NaN;
        }
        if (values.length == 1) {
            return Double.isNaN(values[0]) ? Double.NaN : 0.0;
        }
        double mean = mean();
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    public double median() {
        if (len() == 0 || type == Type.STRING || type == Type.BOOL) {
            return Double.NaN;
        }
        int[] ordered = order(false);
        int middle = ordered.length / 2;
        if (ordered.length % 2 != 0) {
            return values.toDouble(ordered[middle]);
        }
        return (values.toDouble(ordered[middle - 1]) + values.toDouble(ordered[middle])) * 0.5;
    }

    public double max() {
        if (len() == 0 || type == Type.STRING) {
            return Double.NaN;
        }
        return extreme(Comparator.GREATER).toDouble();
    }

    public double min() {
        if (len() == 0 || type == Type.STRING) {
            return Double.NaN;
        }
        return extreme(Comparator.LESS).toDouble();
    }

    /**
     * Largest value of a STRING Series, {@code ""} for other types.
     */
    public String maxString() {
        if (len() == 0 || type != Type.STRING) {
            return "";
        }
        return extreme(Comparator.GREATER).toString();
    }

    public String minString() {
        if (len() == 0 || type != Type.STRING) {
            return "";
        }
        return extreme(Comparator.LESS).toString();
    }

    private Element extreme(Comparator comparator) {
        Element best = values.elem(0);
        for (int i = 1; i < len(); i++) {
            Element element = values.elem(i);
            if (comparator.test(element, best)) {
                best = element;
            }
        }
        return best;
    }

    /**
     * The smallest value whose cumulative rank reaches {@code p * len()}, NaN cells ignored.
     *
     * @param p fraction in {@code [0, 1]}; other values give NaN
     */
    public double quantile(double p) {
        if (len() == 0 || type == Type.STRING || type == Type.BOOL || !(p >= 0 && p <= 1)) {
            return Double.NaN;
        }
        double[] ordered = subset(order(false)).floats();
        if (p == 0) {
            return ordered[0];
        }
        // NaN cells sort last
        int count = 0;
        while (count < ordered.length && !Double.isNaN(ordered[count])) {
            count++;
        }
        if (count == 0) {
            return Double.NaN;
        }
        int rank = (int) Math.ceil(p * count);
        return ordered[Math.max(1, Math.min(count, rank)) - 1];
    }

    // ==================== Cross-Series ====================

    /**
     * Row-wise maximum of equal-length INT, FLOAT or STRING Series. If any input is
     * FLOAT, values are compared as doubles and the result is FLOAT.
     *
     * @param name result name; {@code "max"} when empty
     */
    public static Series max(String name, Series... series) {
        return pick(name, "max", Comparator.GREATER, series);
    }

    /**
     * Row-wise minimum, see {@link #max(String, Series...)}.
     */
    public static Series min(String name, Series... series) {
        return pick(name, "min", Comparator.LESS, series);
    }

    private static Series pick(String name, String defaultName, Comparator comparator, Series... series) {
        String resultName = name == null || name.isEmpty() ? defaultName : name;
        if (series == null || series.length == 0) {
            return failed(resultName, "no series provided");
        }
        int length = series[0].len();
        Series floatSeries = null;
        for (Series s : series) {
            if (s.len() != length) {
                return failed(resultName, "all series must have the same length");
            }
            if (s.type != Type.INT && s.type != Type.FLOAT && s.type != Type.STRING) {
                return failed(resultName, "series of type " + s.type + " cannot be compared");
            }
            if (s.type == Type.FLOAT) {
                floatSeries = s;
            }
        }
        boolean numeric = floatSeries != null;
        Series result = new Series(resultName, numeric ? Type.FLOAT : series[0].type,
                (numeric ? floatSeries : series[0]).values.copy(), null);

        for (int i = 0; i < length; i++) {
            Element target = series[0].values.elem(i);
            for (Series s : series) {
                Element candidate = s.values.elem(i);
                boolean wins = numeric
                        ? compareDoubles(comparator, target.toDouble(), candidate.toDouble())
                        : comparator.test(target, candidate);
                if (!wins) {
                    target = candidate;
                }
            }
            result.values.set(i, target);
        }
        return result;
    }

    private static boolean compareDoubles(Comparator comparator, double a, double b) {
        return comparator == Comparator.GREATER ? a > b : a < b;
    }

    private static Series failed(String name, String message) {
        return new Series(name, Type.FLOAT, ColumnValues.allocate(Type.FLOAT, 0), new SeriesException(message));
    }

    // ==================== Iteration ====================

    public ValuesIterator valuesIterator() {
        return valuesIterator(IterationOptions.defaults());
    }

    public ValuesIterator valuesIterator(IterationOptions options) {
        return new ValuesIterator(this, options);
    }

    // ==================== Rendering ====================

    /**
     * Multi-line description: name (when set), type, length and values.
     */
    public String str() {
        List<String> lines = new ArrayList<>();
        if (!name.isEmpty()) {
            lines.add("Name: " + name);
        }
        lines.add("Type: " + type);
        lines.add("Length: " + len());
        if (len() != 0) {
            lines.add("Values: " + this);
        }
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "[" + String.join(" ", records()) + "]";
    }
}

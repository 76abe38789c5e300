/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.frame.series.Series;
import dev.frame.series.Type;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for DataFrame construction, column and row operations and aggregation.
 */
public class DataFrameTest {

    private static DataFrame numbers() {
        return DataFrame.of(
                Series.of(new long[]{ 1, 2, 3, 4, 5 }, Type.INT, "A"),
                Series.of(new long[]{ 5, 4, 3, 2, 1 }, Type.INT, "B"),
                Series.of(new double[]{ 1.1, 2.2, 3.3, 4.4, 5.5 }, Type.FLOAT, "C"),
                Series.of(new String[]{ "a", "b", "c", "d", "e" }, Type.STRING, "D"),
                Series.of(new long[]{ 3, 3, 4, 3, 3 }, Type.INT, "F"));
    }

    private static List<Row> drain(RowsIterator iterator) {
        List<Row> rows = new ArrayList<>();
        iterator.forEachRemaining(rows::add);
        return rows;
    }

    // ==================== Construction ====================

    @Test
    void testConstruction() {
        DataFrame df = numbers();
        assertThat(df.error()).isNull();
        assertThat(df.nrow()).isEqualTo(5);
        assertThat(df.ncol()).isEqualTo(5);
        assertThat(df.names()).containsExactly("A", "B", "C", "D", "F");
        assertThat(df.types()).containsExactly(Type.INT, Type.INT, Type.FLOAT, Type.STRING, Type.INT);
    }

    @Test
    void testUnnamedColumnsGetPositionalNames() {
        DataFrame df = DataFrame.of(Series.ofInts(new long[]{ 1 }), Series.ofStrings(new String[]{ "a" }));
        assertThat(df.names()).containsExactly("X0", "X1");
    }

    @Test
    void testInputSeriesAreCopied() {
        Series a = Series.of(new long[]{ 1 }, Type.INT, "a");
        DataFrame df = DataFrame.of(a);
        a.append(2);
        assertThat(df.nrow()).isEqualTo(1);
    }

    @Test
    void testConstructionErrors() {
        assertThat(DataFrame.of(Series.of(new long[]{ 1 }, Type.INT, "a"), Series.of(new long[]{ 1, 2 }, Type.INT, "b")).error())
                .hasMessage("arguments have different dimensions");
        assertThat(DataFrame.of(Series.of(new long[]{ 1 }, Type.INT, "a"), Series.of(new long[]{ 2 }, Type.INT, "a")).error())
                .hasMessage("duplicated column name: a");
        assertThat(DataFrame.of(Series.ofInts(new long[]{ 1 }).div(0)).error())
                .hasMessage("series 0 has errors: division by zero");
    }

    // ==================== Accessors ====================

    @Test
    void testColAndRow() {
        DataFrame df = numbers();
        assertThat(df.col("C").floats()).containsExactly(1.1, 2.2, 3.3, 4.4, 5.5);
        assertThat(df.col("Z").error()).hasMessage("unknown column name: Z");
        assertThat(df.row(1)).containsExactly(entry("A", 2L), entry("B", 4L), entry("C", 2.2), entry("D", "b"), entry("F", 3L));
        assertThat(df.elem(4, 3).toString()).isEqualTo("e");
    }

    @Test
    void testRecords() {
        DataFrame df = DataFrame.of(Series.of(new long[]{ 1, 2 }, Type.INT, "x"), Series.of(new Object[]{ "a", null }, Type.STRING, "y"));
        assertThat(df.records()).containsExactly(List.of("x", "y"), List.of("1", "a"), List.of("2", "NaN"));
    }

    @Test
    void testEqual() {
        assertThat(numbers().equal(numbers())).isTrue();
        assertThat(numbers().equal(numbers().select("A", "B"))).isFalse();
    }

    // ==================== Column Operations ====================

    @Test
    void testMutate() {
        DataFrame df = numbers().select("A", "B");
        DataFrame replaced = df.mutate(Series.of(new long[]{ 0, 0, 0, 0, 0 }, Type.INT, "A"));
        assertThat(replaced.names()).containsExactly("A", "B");
        assertThat(replaced.col("A").records()).containsOnly("0");

        DataFrame appended = df.mutate(Series.of(new String[]{ "v", "w", "x", "y", "z" }, Type.STRING, "G"));
        assertThat(appended.names()).containsExactly("A", "B", "G");
        assertThat(df.names()).containsExactly("A", "B");

        assertThat(df.mutate(Series.of(new long[]{ 1 }, Type.INT, "G")).error()).hasMessage("mutate: wrong dimensions");
    }

    @Test
    void testSelect() {
        DataFrame df = numbers().select(List.of("D", "A"));
        assertThat(df.names()).containsExactly("D", "A");
        assertThat(numbers().select("A", "Q").error()).hasMessage("select: column name \"Q\" not found");
    }

    @Test
    void testConcatUnionsColumns() {
        DataFrame top = DataFrame.of(Series.of(new long[]{ 1, 2 }, Type.INT, "a"), Series.of(new String[]{ "x", "y" }, Type.STRING, "b"));
        DataFrame bottom = DataFrame.of(Series.of(new long[]{ 3 }, Type.INT, "a"), Series.of(new double[]{ 1.5 }, Type.FLOAT, "c"));
        DataFrame df = top.concat(bottom);
        assertThat(df.names()).containsExactly("a", "b", "c");
        assertThat(df.col("a").records()).containsExactly("1", "2", "3");
        assertThat(df.col("b").records()).containsExactly("x", "y", "NaN");
        assertThat(df.col("c").records()).containsExactly("NaN", "NaN", "1.5");
    }

    @Test
    void testConcatWithEmptyFrames() {
        DataFrame df = numbers();
        assertThat(DataFrame.of().concat(df).equal(df)).isTrue();
        assertThat(df.concat(DataFrame.of()).equal(df)).isTrue();
        assertThat(DataFrame.concat(df, df).nrow()).isEqualTo(10);
        assertThat(DataFrame.concat().ncol()).isZero();
    }

    // ==================== Row Operations ====================

    @Test
    void testSubset() {
        DataFrame df = numbers().subset(new int[]{ 4, 0 });
        assertThat(df.col("D").records()).containsExactly("e", "a");
        assertThat(numbers().subset(new int[]{ 9 }).error()).hasMessage("indexing error: index out of range");
    }

    @Test
    void testDistinct() {
        DataFrame df = DataFrame.of(
                Series.of(new long[]{ 1, 1, 2, 1 }, Type.INT, "k"),
                Series.of(new String[]{ "a", "a", "b", "c" }, Type.STRING, "v"));
        DataFrame distinct = df.distinct();
        assertThat(distinct.nrow()).isEqualTo(3);
        assertThat(distinct.col("v").records()).containsExactly("a", "b", "c");
    }

    @Test
    void testCrossJoin() {
        DataFrame left = DataFrame.of(Series.of(new long[]{ 1, 2 }, Type.INT, "a"));
        DataFrame right = DataFrame.of(
                Series.of(new String[]{ "x", "y", "z" }, Type.STRING, "a"),
                Series.of(new long[]{ 7, 8, 9 }, Type.INT, "b"));
        DataFrame joined = left.crossJoin(right);
        assertThat(joined.nrow()).isEqualTo(6);
        assertThat(joined.names()).containsExactly("a", "a_1", "b");
        assertThat(joined.col("a").records()).containsExactly("1", "1", "1", "2", "2", "2");
        assertThat(joined.col("a_1").records()).containsExactly("x", "y", "z", "x", "y", "z");

        DataFrame suffixed = left.crossJoin(right, JoinOptions.defaults().withRightSuffix("_r"));
        assertThat(suffixed.names()).containsExactly("a", "a_r", "b");
    }

    @Test
    void testCrossJoinWithEmptyRight() {
        DataFrame left = DataFrame.of(Series.of(new long[]{ 1, 2 }, Type.INT, "a"));
        DataFrame right = DataFrame.of(Series.of(new String[0], Type.STRING, "b"));
        DataFrame joined = left.crossJoin(right);
        assertThat(joined.nrow()).isZero();
        assertThat(joined.names()).containsExactly("a");
    }

    @Test
    void testJoinOptionsRejectEmptySuffix() {
        assertThatThrownBy(() -> new JoinOptions(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testAntiJoin() {
        DataFrame left = DataFrame.of(
                Series.of(new long[]{ 1, 2, 3 }, Type.INT, "id"),
                Series.of(new String[]{ "a", "b", "c" }, Type.STRING, "name"));
        DataFrame right = DataFrame.of(Series.of(new long[]{ 2, 4 }, Type.INT, "id"));
        DataFrame result = DataFrame.antiJoin(left, right, "id");
        assertThat(result.col("name").records()).containsExactly("a", "c");
        assertThat(DataFrame.antiJoin(left, right, "name").error())
                .hasMessage("anti join: key column \"name\" not found");
    }

    // ==================== Iteration ====================

    @Test
    void testRowsIteratorDefaults() {
        DataFrame df = numbers().select("A", "C", "D");
        List<Row> rows = drain(df.rowsIterator());
        assertThat(rows).hasSize(5);
        assertThat(rows.get(0).index()).isZero();
        assertThat(rows.get(0).data()).isEqualTo(Map.of("A", 1L, "C", 1.1, "D", "a"));
        assertThat(rows.get(2).index()).isEqualTo(2);
    }

    @Test
    void testRowsIteratorOptions() {
        DataFrame df = numbers();
        List<Row> selected = drain(df.rowsIterator(RowIterationOptions.defaults().withSelectedColumns("D", "missing")));
        assertThat(selected.get(1).data()).containsOnlyKeys("D");

        List<Row> noIndex = drain(df.rowsIterator(RowIterationOptions.defaults().withRowIndex(false)));
        assertThat(noIndex).extracting(Row::index).containsOnly(-1);

        List<Row> noData = drain(df.rowsIterator(RowIterationOptions.defaults().withRowData(false)));
        assertThat(noData.get(0).data()).isEmpty();
        assertThat(noData.get(3).index()).isEqualTo(3);
    }

    // ==================== Aggregation ====================

    private static DataFrame sales() {
        return DataFrame.of(
                Series.of(new String[]{ "a", "b", "a", "b", "c" }, Type.STRING, "category"),
                Series.of(new double[]{ 1, 2, 3, 4, 5 }, Type.FLOAT, "value"),
                Series.of(new long[]{ 10, 20, 30, 40, 50 }, Type.INT, "units"));
    }

    @Test
    void testGroupAggregate() {
        GroupAggregation aggregation = GroupAggregation.groupOn("category")
                .aggregateOn(List.of(Aggregation.MEAN, Aggregation.MAX, Aggregation.COUNT), List.of("value", "value", "units"));
        DataFrame result = DataFrame.groupAggregate(sales(), aggregation);
        assertThat(result.error()).isNull();
        assertThat(result.names()).containsExactly("category", "units_COUNT", "value_MAX", "value_MEAN");
        assertThat(result.col("category").records()).containsExactly("a", "b", "c");
        assertThat(result.col("value_MEAN").floats()).containsExactly(2.0, 3.0, 5.0);
        assertThat(result.col("value_MAX").floats()).containsExactly(3.0, 4.0, 5.0);
        assertThat(result.col("units_COUNT").floats()).containsExactly(2.0, 2.0, 1.0);
        assertThat(result.types()).containsExactly(Type.STRING, Type.FLOAT, Type.FLOAT, Type.FLOAT);
    }

    @Test
    void testGroupAggregateWithLeftJoin() {
        DataFrame target = DataFrame.of(Series.of(new String[]{ "c", "a", "z" }, Type.STRING, "cat"));
        GroupAggregation aggregation = GroupAggregation.groupOn("category")
                .aggregateOn(List.of(Aggregation.SUM), List.of("units"))
                .withLeftJoin(target, "cat");
        DataFrame result = DataFrame.groupAggregate(sales(), aggregation);
        assertThat(result.names()).containsExactly("cat", "units_SUM");
        assertThat(result.col("units_SUM").records()).containsExactly("50", "40", "NaN");
    }

    @Test
    void testGroupAggregateMissingColumn() {
        GroupAggregation aggregation = GroupAggregation.groupOn("nope")
                .aggregateOn(List.of(Aggregation.SUM), List.of("units"));
        assertThat(DataFrame.groupAggregate(sales(), aggregation).error())
                .hasMessage("group aggregate: column \"nope\" not found");
    }

    @Test
    void testGroupAggregationValidation() {
        assertThatThrownBy(GroupAggregation::groupOn)
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GroupAggregation.groupOn("a").aggregateOn(List.of(Aggregation.SUM), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GroupAggregation.groupOn("a").withLeftJoin(sales(), "a", "b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Row-wise Extremes ====================

    @Test
    void testMaxInColumns() {
        DataFrame df = numbers();
        assertThat(DataFrame.maxInColumns(df, "NEWC", "A", "B").records()).containsExactly("5", "4", "3", "4", "5");
        assertThat(DataFrame.maxInColumns(df, "NEWC", "A", "B", "F").records()).containsExactly("5", "4", "4", "4", "5");
        assertThat(DataFrame.maxInColumns(df, "A", "A", "C").records()).containsExactly("1", "2", "3", "4", "5");
        assertThat(DataFrame.maxInColumns(df, "NC", "C", "A").records()).containsExactly("1.1", "2.2", "3.3", "4.4", "5.5");
        assertThat(DataFrame.maxInColumns(df, "A", "A", "D", "B").records()).containsExactly("5", "4", "3", "4", "5");
    }

    @Test
    void testMinInColumns() {
        DataFrame df = numbers();
        Series min = DataFrame.minInColumns(df, "A", "A", "B");
        assertThat(min.type()).isEqualTo(Type.INT);
        assertThat(min.name()).isEqualTo("A");
        assertThat(min.records()).containsExactly("1", "2", "3", "2", "1");
        assertThat(DataFrame.minInColumns(df, "A", "A", "C").records()).containsExactly("1", "2", "3", "4", "5");
    }

    @Test
    void testExtremesWithoutUsableColumns() {
        DataFrame df = numbers();
        Series none = DataFrame.maxInColumns(df, "E", "E");
        assertThat(none.type()).isEqualTo(Type.FLOAT);
        assertThat(none.records()).containsExactly("NaN");
        assertThat(DataFrame.minInColumns(df, "E", "D").records()).containsExactly("NaN");
    }

    @Test
    void testToString() {
        DataFrame df = DataFrame.of(Series.of(new long[]{ 1 }, Type.INT, "x"));
        assertThat(df.toString()).isEqualTo("[1x1] DataFrame\nx\n1");
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import java.util.List;
import java.util.Objects;

/**
 * Settings of a grouped aggregation: the key columns, the (aggregation, column) pairs and
 * an optional frame the results are joined back onto.
 *
 * <pre>{@code
 * GroupAggregation.groupOn("category")
 *         .aggregateOn(List.of(Aggregation.MEAN, Aggregation.MAX), List.of("value", "pct"))
 *         .withLeftJoin(df, "category");
 * }</pre>
 */
public final class GroupAggregation {

    private final List<String> keys;
    private final List<Aggregation> aggregations;
    private final List<String> columns;
    private final DataFrame joinFrame;
    private final List<String> joinKeys;

    private GroupAggregation(List<String> keys, List<Aggregation> aggregations, List<String> columns,
                             DataFrame joinFrame, List<String> joinKeys) {
        this.keys = keys;
        this.aggregations = aggregations;
        this.columns = columns;
        this.joinFrame = joinFrame;
        this.joinKeys = joinKeys;
    }

    public static GroupAggregation groupOn(String... keys) {
        if (keys == null || keys.length == 0) {
            throw new IllegalArgumentException("At least one group key is required");
        }
        return new GroupAggregation(List.of(keys), List.of(), List.of(), null, List.of());
    }

    /**
     * Aggregates {@code columns.get(i)} with {@code aggregations.get(i)}.
     */
    public GroupAggregation aggregateOn(List<Aggregation> aggregations, List<String> columns) {
        if (aggregations.size() != columns.size()) {
            throw new IllegalArgumentException("Got " + aggregations.size() + " aggregations for " + columns.size() + " columns");
        }
        return new GroupAggregation(keys, List.copyOf(aggregations), List.copyOf(columns), joinFrame, joinKeys);
    }

    /**
     * Joins the aggregates onto every row of {@code frame}, matching {@code joinKeys}
     * positionally against the group keys.
     */
    public GroupAggregation withLeftJoin(DataFrame frame, String... joinKeys) {
        Objects.requireNonNull(frame, "frame");
        if (joinKeys.length != keys.size()) {
            throw new IllegalArgumentException("Expected " + keys.size() + " join keys but got " + joinKeys.length);
        }
        return new GroupAggregation(keys, aggregations, columns, frame, List.of(joinKeys));
    }

    List<String> keys() {
        return keys;
    }

    List<Aggregation> aggregations() {
        return aggregations;
    }

    List<String> columns() {
        return columns;
    }

    DataFrame joinFrame() {
        return joinFrame;
    }

    List<String> joinKeys() {
        return joinKeys;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import dev.frame.series.Series;

/**
 * Aggregations available to {@link DataFrame#groupAggregate(DataFrame, GroupAggregation)}.
 * Each produces one FLOAT value per group.
 */
public enum Aggregation {
    MEAN,
    MAX,
    MIN,
    SUM,
    COUNT,
    STD,
    MEDIAN;

    double apply(Series group) {
        return switch (this) {
            case MEAN -> group.mean();
            case MAX -> group.max();
            case MIN -> group.min();
            case SUM -> group.sum();
            case COUNT -> group.len();
            case STD -> group.stdDev();
            case MEDIAN -> group.median();
        };
    }

    /**
     * Name of the result column for {@code column}, e.g. {@code value_MEAN}.
     */
    public String columnName(String column) {
        return column + "_" + name();
    }
}

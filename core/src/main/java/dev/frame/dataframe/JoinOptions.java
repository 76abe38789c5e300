/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

/**
 * Options of {@link DataFrame#crossJoin(DataFrame, JoinOptions)}.
 *
 * @param rightSuffix appended to right-hand column names that clash with left-hand ones
 */
public record JoinOptions(String rightSuffix) {

    public static final String DEFAULT_RIGHT_SUFFIX = "_1";

    public JoinOptions {
        if (rightSuffix == null || rightSuffix.isEmpty()) {
            throw new IllegalArgumentException("Right suffix must not be empty");
        }
    }

    public static JoinOptions defaults() {
        return new JoinOptions(DEFAULT_RIGHT_SUFFIX);
    }

    public JoinOptions withRightSuffix(String rightSuffix) {
        return new JoinOptions(rightSuffix);
    }
}

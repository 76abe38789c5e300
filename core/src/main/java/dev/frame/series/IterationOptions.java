/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

/**
 * Options for {@link Series#valuesIterator(IterationOptions)}.
 *
 * @param step distance between visited cells; 0 is treated as 1
 * @param reverse walk from the last cell to the first
 * @param skipNaN skip NA cells
 * @param onlyUnique yield only the first occurrence of each value
 */
public record IterationOptions(int step, boolean reverse, boolean skipNaN, boolean onlyUnique) {

    public IterationOptions {
        if (step < 0) {
            throw new IllegalArgumentException("Step must not be negative: " + step);
        }
        if (step == 0) {
            step = 1;
        }
    }

    public static IterationOptions defaults() {
        return new IterationOptions(1, false, false, false);
    }

    public IterationOptions withStep(int step) {
        return new IterationOptions(step, reverse, skipNaN, onlyUnique);
    }

    public IterationOptions withReverse(boolean reverse) {
        return new IterationOptions(step, reverse, skipNaN, onlyUnique);
    }

    public IterationOptions withSkipNaN(boolean skipNaN) {
        return new IterationOptions(step, reverse, skipNaN, onlyUnique);
    }

    public IterationOptions withOnlyUnique(boolean onlyUnique) {
        return new IterationOptions(step, reverse, skipNaN, onlyUnique);
    }
}

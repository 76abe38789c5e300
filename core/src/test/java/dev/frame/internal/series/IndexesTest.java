/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.series;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.frame.series.Series;
import dev.frame.series.SeriesException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the accepted index argument forms.
 */
public class IndexesTest {

    @Test
    void testScalarAndArrays() {
        assertThat(Indexes.resolve(2, 3)).containsExactly(2);
        assertThat(Indexes.resolve(1L, 3)).containsExactly(1);
        assertThat(Indexes.resolve(new int[]{ 2, 0, 2 }, 3)).containsExactly(2, 0, 2);
        assertThat(Indexes.resolve(List.of(0, 1L), 3)).containsExactly(0, 1);
    }

    @Test
    void testBooleanMask() {
        assertThat(Indexes.resolve(new boolean[]{ true, false, true }, 3)).containsExactly(0, 2);
        assertThatThrownBy(() -> Indexes.resolve(new boolean[]{ true }, 3))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: index dimensions mismatch");
    }

    @Test
    void testSeriesIndexes() {
        assertThat(Indexes.resolve(Series.ofInts(new long[]{ 1, 0 }), 2)).containsExactly(1, 0);
        assertThat(Indexes.resolve(Series.ofBools(new boolean[]{ false, true }), 2)).containsExactly(1);
        assertThatThrownBy(() -> Indexes.resolve(Series.ofInts(new Object[]{ 1, null }), 2))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: indexes contain NaN");
        assertThatThrownBy(() -> Indexes.resolve(Series.ofStrings(new String[]{ "0" }), 2))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: unknown indexing mode");
    }

    @Test
    void testPoisonedSeriesIndexes() {
        Series poisoned = Series.ofInts(new long[]{ 1 }).div(0);
        assertThatThrownBy(() -> Indexes.resolve(poisoned, 2))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: new values has errors: division by zero");
    }

    @Test
    void testOutOfRange() {
        assertThatThrownBy(() -> Indexes.resolve(3, 3))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: index out of range");
        assertThatThrownBy(() -> Indexes.resolve(-1, 3))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: index out of range");
        assertThatThrownBy(() -> Indexes.resolve(Long.MAX_VALUE, 3))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: index out of range");
    }

    @Test
    void testUnknownMode() {
        assertThatThrownBy(() -> Indexes.resolve("0", 3))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: unknown indexing mode");
        assertThatThrownBy(() -> Indexes.resolve(List.of("0"), 3))
                .isInstanceOf(SeriesException.class)
                .hasMessage("indexing error: unknown indexing mode");
    }
}

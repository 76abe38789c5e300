/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for element-wise arithmetic between Series and scalars.
 */
public class SeriesArithmeticTest {

    @Test
    void testIntPlusIntScalarStaysInt() {
        Series s = Series.of(new long[]{ 1, 2, 3 }, Type.INT, "x");
        Series result = s.add(1);
        assertThat(result.error()).isNull();
        assertThat(result.type()).isEqualTo(Type.INT);
        assertThat(result.name()).isEqualTo("x_add_int");
        assertThat(result.records()).containsExactly("2", "3", "4");
        assertThat(s.records()).containsExactly("1", "2", "3");
    }

    @Test
    void testIntPlusFloatScalarGivesFloat() {
        Series result = Series.of(new long[]{ 1, 2 }, Type.INT, "x").add(0.5);
        assertThat(result.type()).isEqualTo(Type.FLOAT);
        assertThat(result.name()).isEqualTo("x_add_double");
        assertThat(result.floats()).containsExactly(1.5, 2.5);
    }

    @Test
    void testExplicitName() {
        Series result = Series.ofInts(new long[]{ 2 }).mul(3L, "tripled");
        assertThat(result.name()).isEqualTo("tripled");
        assertThat(result.records()).containsExactly("6");
    }

    @Test
    void testAddThenSubRestoresFloats() {
        double[] values = { 0.1, -3.25, 1e6, 42.0 };
        Series s = Series.ofFloats(values);
        Series roundTrip = s.add(7.3).sub(7.3);
        double[] result = roundTrip.floats();
        for (int i = 0; i < values.length; i++) {
            assertThat(result[i]).isCloseTo(values[i], within(1e-9));
        }
    }

    @Test
    void testIntegerDivisionTruncates() {
        Series result = Series.ofInts(new long[]{ 7, -7 }).div(2);
        assertThat(result.type()).isEqualTo(Type.INT);
        assertThat(result.records()).containsExactly("3", "-3");
    }

    @Test
    void testDivisionByZero() {
        Series s = Series.ofInts(new long[]{ 1, 2, 3 });
        Series result = s.div(0);
        assertThat(result.error()).hasMessage("division by zero");
        assertThat(result.len()).isEqualTo(3);
        assertThat(result.type()).isEqualTo(Type.INT);

        Series floats = Series.ofFloats(new double[]{ 1.0, 2.0 }).div(Series.ofFloats(new double[]{ 1.0, 0.0 }));
        assertThat(floats.error()).hasMessage("division by zero");
        assertThat(floats.len()).isEqualTo(2);
    }

    @Test
    void testIntegerOverflowWraps() {
        Series result = Series.ofInts(new long[]{ Long.MAX_VALUE }).add(1L);
        assertThat(result.val(0)).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void testSeriesOperands() {
        Series a = Series.of(new long[]{ 1, 2, 3 }, Type.INT, "a");
        Series b = Series.of(new long[]{ 10, 20, 30 }, Type.INT, "b");
        Series sum = a.add(b);
        assertThat(sum.type()).isEqualTo(Type.INT);
        assertThat(sum.name()).isEqualTo("a_add_b");
        assertThat(sum.records()).containsExactly("11", "22", "33");

        Series c = Series.of(new double[]{ 0.5, 0.5, 0.5 }, Type.FLOAT, "c");
        Series mixed = a.mul(c);
        assertThat(mixed.type()).isEqualTo(Type.FLOAT);
        assertThat(mixed.floats()).containsExactly(0.5, 1.0, 1.5);
    }

    @Test
    void testLengthMismatch() {
        Series a = Series.ofInts(new long[]{ 1, 2, 3 });
        Series result = a.add(Series.ofInts(new long[]{ 1, 2 }));
        assertThat(result.error()).hasMessageContaining("different lengths");
        assertThat(result.len()).isEqualTo(3);
    }

    @Test
    void testNonNumericReceiver() {
        Series result = Series.ofStrings(new String[]{ "a" }).add(1);
        assertThat(result.error()).hasMessage("cannot perform arithmetic operation on series of type string");
    }

    @Test
    void testNonNumericOperand() {
        Series a = Series.ofInts(new long[]{ 1 });
        assertThat(a.add(Series.ofStrings(new String[]{ "1" })).error())
                .hasMessage("cannot perform arithmetic operation between series of different types");
        assertThat(a.add("1").error())
                .hasMessage("unsupported type for arithmetic operation: java.lang.String");
    }

    @Test
    void testMissingCellPoisons() {
        Series ints = Series.ofInts(new Object[]{ 1, null });
        assertThat(ints.add(1).error()).hasMessage("unsupported type for arithmetic operation: NaN");

        Series floats = Series.ofFloats(new double[]{ 1.0, Double.NaN });
        assertThat(floats.add(1.0).error()).hasMessage("unsupported type for arithmetic operation: NaN");
    }

    @Test
    void testOperandErrorPropagates() {
        Series poisoned = Series.ofInts(new long[]{ 1 }).div(0);
        Series result = Series.ofInts(new long[]{ 1 }).add(poisoned);
        assertThat(result.error()).hasMessage("division by zero");
    }

    @Test
    void testPoisonedReceiverIsReturnedUnchanged() {
        Series poisoned = Series.ofInts(new long[]{ 1, 2 }).div(0);
        assertThat(poisoned.add(1)).isSameAs(poisoned);
    }
}

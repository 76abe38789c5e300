/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.internal.series;

import java.util.Collection;

import dev.frame.series.Element;
import dev.frame.series.Series;
import dev.frame.series.SeriesException;
import dev.frame.series.Type;

/**
 * Resolves the index argument of {@code subset} and {@code set} into cell positions.
 * <p>
 * Accepted forms: a single {@link Number}, an {@code int[]}, a collection of numbers,
 * a {@code boolean[]} mask, or an INT or BOOL Series.
 * </p>
 */
public final class Indexes {

    private Indexes() {
    }

    /**
     * @param indexes the index argument
     * @param length length of the Series being indexed
     * @return cell positions, each within {@code [0, length)}
     * @throws SeriesException if the argument is malformed or out of range
     */
    public static int[] resolve(Object indexes, int length) {
        int[] positions = positions(indexes, length);
        for (int position : positions) {
            if (position < 0 || position >= length) {
                throw new SeriesException("indexing error: index out of range");
            }
        }
        return positions;
    }

    private static int[] positions(Object indexes, int length) {
        if (isIntegral(indexes)) {
            return new int[]{ position(((Number) indexes).longValue()) };
        }
        if (indexes instanceof int[] ints) {
            return ints.clone();
        }
        if (indexes instanceof boolean[] mask) {
            return fromMask(mask, length);
        }
        if (indexes instanceof Collection<?> collection) {
            int[] result = new int[collection.size()];
            int i = 0;
            for (Object item : collection) {
                if (!isIntegral(item)) {
                    throw new SeriesException("indexing error: unknown indexing mode");
                }
                result[i++] = position(((Number) item).longValue());
            }
            return result;
        }
        if (indexes instanceof Series series) {
            return fromSeries(series, length);
        }
        throw new SeriesException("indexing error: unknown indexing mode");
    }

    private static int[] fromSeries(Series series, int length) {
        if (series.error() != null) {
            throw new SeriesException("indexing error: new values has errors: " + series.error().getMessage(), series.error());
        }
        if (series.type() != Type.INT && series.type() != Type.BOOL) {
            throw new SeriesException("indexing error: unknown indexing mode");
        }
        for (int i = 0; i < series.len(); i++) {
            Element element = series.elem(i);
            if (element.isNA() || element.val() == null) {
                throw new SeriesException("indexing error: indexes contain NaN");
            }
        }
        if (series.type() == Type.BOOL) {
            return fromMask(series.bools(), length);
        }
        long[] values = series.ints();
        int[] result = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = position(values[i]);
        }
        return result;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }

    private static int position(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new SeriesException("indexing error: index out of range");
        }
        return (int) value;
    }

    private static int[] fromMask(boolean[] mask, int length) {
        if (mask.length != length) {
            throw new SeriesException("indexing error: index dimensions mismatch");
        }
        int count = 0;
        for (boolean b : mask) {
            if (b) {
                count++;
            }
        }
        int[] result = new int[count];
        int j = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                result[j++] = i;
            }
        }
        return result;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Single-pass iterator over the cells of a Series. Not restartable: ask the Series
 * for a new one to iterate again.
 */
public final class ValuesIterator implements Iterator<IndexedValue> {

    private final Series series;
    private final IterationOptions options;
    private final Set<Object> seen = new HashSet<>();
    private int index;
    private IndexedValue pending;

    ValuesIterator(Series series, IterationOptions options) {
        this.series = series;
        this.options = options;
        this.index = options.reverse() ? series.len() - 1 : 0;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public IndexedValue next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Series iterator is exhausted");
        }
        IndexedValue result = pending;
        pending = null;
        return result;
    }

    private IndexedValue advance() {
        while (index >= 0 && index < series.len()) {
            int current = index;
            index += options.reverse() ? -options.step() : options.step();

            if (options.skipNaN() && series.elem(current).isNA()) {
                continue;
            }
            Object value = series.val(current);
            if (options.onlyUnique() && !seen.add(value)) {
                continue;
            }
            return new IndexedValue(current, value);
        }
        return null;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import dev.frame.series.Series;

/**
 * Single-pass iterator over the rows of a {@link DataFrame}.
 */
public final class RowsIterator implements Iterator<Row> {

    private final List<Series> columns;
    private final int nrow;
    private final RowIterationOptions options;
    private int next;

    RowsIterator(DataFrame frame, RowIterationOptions options) {
        this.options = options;
        this.nrow = frame.nrow();
        this.columns = new ArrayList<>();
        if (options.selectedColumns() == null) {
            for (String name : frame.names()) {
                columns.add(frame.col(name));
            }
        }
        else {
            for (String name : options.selectedColumns()) {
                if (frame.names().contains(name)) {
                    columns.add(frame.col(name));
                }
            }
        }
    }

    @Override
    public boolean hasNext() {
        return next < nrow;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows");
        }
        int current = next++;
        Map<String, Object> data = new LinkedHashMap<>();
        if (options.rowData()) {
            for (Series column : columns) {
                data.put(column.name(), column.val(current));
            }
        }
        return new Row(options.rowIndex() ? current : -1, data);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import java.util.List;

/**
 * Options of {@link DataFrame#rowsIterator(RowIterationOptions)}.
 *
 * @param rowIndex report row positions; when false every row reports {@code -1}
 * @param rowData report cell values; when false every row has an empty map
 * @param selectedColumns columns to report, {@code null} for all; unknown names are ignored
 */
public record RowIterationOptions(boolean rowIndex, boolean rowData, List<String> selectedColumns) {

    public RowIterationOptions {
        selectedColumns = selectedColumns == null ? null : List.copyOf(selectedColumns);
    }

    public static RowIterationOptions defaults() {
        return new RowIterationOptions(true, true, null);
    }

    public RowIterationOptions withRowIndex(boolean rowIndex) {
        return new RowIterationOptions(rowIndex, rowData, selectedColumns);
    }

    public RowIterationOptions withRowData(boolean rowData) {
        return new RowIterationOptions(rowIndex, rowData, selectedColumns);
    }

    public RowIterationOptions withSelectedColumns(String... columns) {
        return new RowIterationOptions(rowIndex, rowData, List.of(columns));
    }
}

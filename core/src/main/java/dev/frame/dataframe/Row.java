/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

import java.util.Map;

/**
 * One row produced by a {@link RowsIterator}.
 *
 * @param index row position, or {@code -1} when not requested
 * @param data column name to native cell value, in column order
 */
public record Row(int index, Map<String, Object> data) {
}

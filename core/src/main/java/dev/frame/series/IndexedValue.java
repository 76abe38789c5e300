/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

/**
 * One step of a {@link ValuesIterator}: the cell position and its native value.
 *
 * @param index position of the cell in the Series
 * @param value native value, {@code null} for NA and missing cells
 */
public record IndexedValue(int index, Object value) {
}

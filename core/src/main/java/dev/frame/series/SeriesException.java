/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.series;

/**
 * Failure attached to a {@link Series}. Once a Series carries one, most operations
 * on it return the Series unchanged so that call chains can be checked at the end.
 */
public class SeriesException extends RuntimeException {

    public SeriesException(String message) {
        super(message);
    }

    public SeriesException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.dataframe;

/**
 * Failure attached to a {@link DataFrame}; operations on a frame carrying one return
 * the frame unchanged.
 */
public class DataFrameException extends RuntimeException {

    public DataFrameException(String message) {
        super(message);
    }

    public DataFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}

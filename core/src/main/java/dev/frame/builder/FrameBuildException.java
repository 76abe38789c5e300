/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.builder;

import dev.frame.dataframe.DataFrame;

/**
 * Thrown when a {@link FrameBuilder} conversion fails.
 */
public class FrameBuildException extends RuntimeException {

    private final transient DataFrame frame;

    public FrameBuildException(String message) {
        this(message, null, null);
    }

    public FrameBuildException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public FrameBuildException(String message, Throwable cause, DataFrame frame) {
        super(message, cause);
        this.frame = frame;
    }

    /**
     * The frame being assembled when the failure occurred, with the same failure as its
     * {@link DataFrame#error()}; {@code null} if none was assembled yet.
     */
    public DataFrame frame() {
        return frame;
    }
}

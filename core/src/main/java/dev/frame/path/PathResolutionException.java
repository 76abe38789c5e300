/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.frame.path;

/**
 * Thrown when a dotted path cannot be followed through a value.
 */
public class PathResolutionException extends RuntimeException {

    /**
     * Why resolution stopped.
     */
    public enum Reason {
        EMPTY_PATH,
        INVALID_VALUE,
        NIL_POINTER,
        CIRCULAR_REFERENCE,
        FIELD_NOT_FOUND,
        KEY_NOT_FOUND,
        INVALID_INDEX,
        INDEX_OUT_OF_BOUNDS,
        NIL_INTERFACE,
        UNSUPPORTED_TYPE
    }

    private final Reason reason;
    private final String segment;

    public PathResolutionException(Reason reason, String segment, String message) {
        super(message);
        this.reason = reason;
        this.segment = segment;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The path segment being processed when resolution failed.
     */
    public String segment() {
        return segment;
    }
}

package com.largomodo.imageconvert.core;

/**
 * Failure categories reported by image loading and saving.
 */
public enum ErrorKind {
    /** Unreadable/unwritable path, closed channel, or nothing to encode. */
    INVALID_ARGUMENT,
    /** Structurally malformed or unsupported on-disk layout (including truncated data). */
    INTERNAL_ERROR,
    /** Channel-level I/O failure without a more specific cause. */
    UNKNOWN
}

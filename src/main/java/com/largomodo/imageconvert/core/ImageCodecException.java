package com.largomodo.imageconvert.core;

import java.io.IOException;
import java.util.Objects;

/**
 * Thrown when an image cannot be decoded from or encoded to its binary form.
 * <p>
 * Single failure type for every codec: callers branch on {@link #kind()} instead of
 * catching per-format exceptions. Format violations are deterministic, so a failed
 * call is never retried internally.
 */
public class ImageCodecException extends IOException {

    private final ErrorKind kind;

    /**
     * Constructs exception with failure category and descriptive message.
     *
     * @param kind    Failure category
     * @param message Details about the failure
     */
    public ImageCodecException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Constructs exception with failure category, message and underlying cause.
     */
    public ImageCodecException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ImageCodecException invalidArgument(String message) {
        return new ImageCodecException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static ImageCodecException internalError(String message) {
        return new ImageCodecException(ErrorKind.INTERNAL_ERROR, message);
    }

    public ErrorKind kind() {
        return kind;
    }
}

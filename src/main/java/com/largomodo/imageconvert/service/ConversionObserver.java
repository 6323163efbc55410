package com.largomodo.imageconvert.service;

import java.nio.file.Path;

/**
 * Observer interface for image conversion lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only the
 * events they care about. Callbacks may arrive from several worker threads in batch mode.
 * </p>
 * <pre>{@code
 * ConversionObserver observer = new ConversionObserver() {
 *     @Override
 *     public void onSuccess(Path image, Path output) {
 *         System.out.println("Wrote " + output);
 *     }
 * };
 * }</pre>
 *
 * @see ImageConverter
 */
public interface ConversionObserver {

    /** Shared no-op instance. */
    ConversionObserver NONE = new ConversionObserver() {
    };

    /**
     * Called when conversion of an image begins.
     *
     * @param image the source file
     */
    default void onStart(Path image) {}

    /**
     * Called when an image has been written.
     *
     * @param image  the source file
     * @param output the file that was written
     */
    default void onSuccess(Path image, Path output) {}

    /**
     * Called when conversion fails, before the exception propagates.
     *
     * @param image the source file
     * @param e     the cause
     */
    default void onFailure(Path image, Exception e) {}
}

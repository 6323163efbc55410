package com.largomodo.imageconvert.core;

import java.util.Objects;

/**
 * Converts between the on-disk blue-green-red(-alpha) order used by BMP and TGA and the
 * in-memory red-green-blue(-alpha) order of {@link PixelBuffer}.
 * <p>
 * The conversion swaps byte 0 and byte 2 of each pixel group and leaves any further bytes
 * (alpha) untouched, so applying it twice restores the input.
 */
public final class ChannelOrder {

    private ChannelOrder() {
    }

    /**
     * Swaps the first and third byte of {@code pixelCount} consecutive pixel groups in place.
     *
     * @param data          sample bytes
     * @param offset        index of the first byte of the first pixel
     * @param pixelCount    number of pixels to convert
     * @param bytesPerPixel group size, at least 3
     * @throws IllegalArgumentException  if {@code bytesPerPixel < 3}
     * @throws IndexOutOfBoundsException if the range exceeds {@code data}
     */
    public static void swapRedBlue(byte[] data, int offset, int pixelCount, int bytesPerPixel) {
        if (bytesPerPixel < 3) {
            throw new IllegalArgumentException("Channel swap needs at least 3 bytes per pixel, got " + bytesPerPixel);
        }
        Objects.checkFromIndexSize(offset, pixelCount * bytesPerPixel, data.length);
        int end = offset + pixelCount * bytesPerPixel;
        for (int i = offset; i < end; i += bytesPerPixel) {
            byte tmp = data[i];
            data[i] = data[i + 2];
            data[i + 2] = tmp;
        }
    }

    /**
     * Swaps every pixel of {@code data}, which must hold whole pixel groups only.
     */
    public static void swapRedBlue(byte[] data, int bytesPerPixel) {
        if (data.length % bytesPerPixel != 0) {
            throw new IllegalArgumentException(
                    "Data length " + data.length + " is not a multiple of " + bytesPerPixel);
        }
        swapRedBlue(data, 0, data.length / bytesPerPixel, bytesPerPixel);
    }
}

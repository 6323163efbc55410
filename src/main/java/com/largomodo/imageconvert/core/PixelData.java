package com.largomodo.imageconvert.core;

import java.nio.ByteBuffer;

/**
 * Read access to a {@code [row][col][channel]} sample buffer.
 * <p>
 * This is what {@link Image#data()} hands out. It has no mutators; only the owning codec writes
 * samples, through its {@link PixelBuffer}.
 */
public interface PixelData {

    int height();

    int width();

    int channels();

    int size();

    boolean isEmpty();

    /**
     * @return number of bytes in one row ({@code width * channels}, never padded)
     */
    int rowStride();

    /**
     * @return sample value in the range 0..255
     */
    int get(int row, int col, int channel);

    /**
     * Copies one full row into {@code dst} starting at {@code offset}.
     */
    void readRow(int row, byte[] dst, int offset);

    /**
     * @return copy of all samples in buffer order
     */
    byte[] toByteArray();

    /**
     * @return read-only view over the samples (no copy)
     */
    ByteBuffer asReadOnlyBuffer();
}

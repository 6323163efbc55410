package com.largomodo.imageconvert.core;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * Dense three-axis sample buffer addressed as {@code [row][col][channel]}.
 * <p>
 * Layout is row-major with interleaved channels: sample {@code (r, c, ch)} lives at
 * {@code (r * width + c) * channels + ch}. All samples are unsigned 8-bit values.
 * <p>
 * Every accessor checks its indices against the current dimensions, so codecs can express
 * scanline addressing (pitch, direction, channel offset) without raw offset arithmetic
 * escaping the buffer.
 * <p>
 * Not thread-safe. A buffer belongs to the {@link Image} that allocated it; everyone else sees
 * it through {@link #readOnlyView()}.
 */
public final class PixelBuffer implements PixelData {

    private static final byte[] EMPTY = new byte[0];

    private final ReadOnlyView view = new ReadOnlyView();

    private int height;
    private int width;
    private int channels;
    private byte[] samples = EMPTY;

    /**
     * Reallocates the buffer for the given dimensions. Previous contents are discarded and the
     * new samples are zero.
     *
     * @throws IllegalArgumentException if a dimension is negative or the total size overflows
     */
    public void resize(int height, int width, int channels) {
        if (height < 0 || width < 0 || channels < 0) {
            throw new IllegalArgumentException(
                    "Dimensions must not be negative: " + height + "x" + width + "x" + channels);
        }
        long size = (long) height * width * channels;
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Pixel buffer too large: " + size + " bytes");
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.samples = size == 0 ? EMPTY : new byte[(int) size];
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int channels() {
        return channels;
    }

    @Override
    public int size() {
        return samples.length;
    }

    @Override
    public boolean isEmpty() {
        return samples.length == 0;
    }

    @Override
    public int rowStride() {
        return width * channels;
    }

    @Override
    public int get(int row, int col, int channel) {
        return Byte.toUnsignedInt(samples[index(row, col, channel)]);
    }

    /**
     * Stores the low 8 bits of {@code value}.
     */
    public void set(int row, int col, int channel, int value) {
        samples[index(row, col, channel)] = (byte) value;
    }

    @Override
    public void readRow(int row, byte[] dst, int offset) {
        Objects.checkIndex(row, height);
        Objects.checkFromIndexSize(offset, rowStride(), dst.length);
        System.arraycopy(samples, row * rowStride(), dst, offset, rowStride());
    }

    /**
     * Overwrites one full row from {@code src} starting at {@code offset}.
     */
    public void writeRow(int row, byte[] src, int offset) {
        Objects.checkIndex(row, height);
        Objects.checkFromIndexSize(offset, rowStride(), src.length);
        System.arraycopy(src, offset, samples, row * rowStride(), rowStride());
    }

    /**
     * Replaces the whole buffer contents. Length must match the current dimensions.
     */
    public void copyFrom(byte[] src) {
        if (src.length != samples.length) {
            throw new IllegalArgumentException(
                    "Expected " + samples.length + " samples, got " + src.length);
        }
        System.arraycopy(src, 0, samples, 0, src.length);
    }

    @Override
    public byte[] toByteArray() {
        return samples.clone();
    }

    @Override
    public ByteBuffer asReadOnlyBuffer() {
        return ByteBuffer.wrap(samples).asReadOnlyBuffer();
    }

    /**
     * @return live view of this buffer without mutators; it follows later {@code resize} calls
     */
    public PixelData readOnlyView() {
        return view;
    }

    private int index(int row, int col, int channel) {
        Objects.checkIndex(row, height);
        Objects.checkIndex(col, width);
        Objects.checkIndex(channel, channels);
        return (row * width + col) * channels + channel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PixelBuffer that = (PixelBuffer) o;
        return height == that.height &&
                width == that.width &&
                channels == that.channels &&
                Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(height, width, channels);
        result = 31 * result + Arrays.hashCode(samples);
        return result;
    }

    @Override
    public String toString() {
        return "PixelBuffer{" +
                "height=" + height +
                ", width=" + width +
                ", channels=" + channels +
                '}';
    }

    private final class ReadOnlyView implements PixelData {

        @Override
        public int height() {
            return height;
        }

        @Override
        public int width() {
            return width;
        }

        @Override
        public int channels() {
            return channels;
        }

        @Override
        public int size() {
            return PixelBuffer.this.size();
        }

        @Override
        public boolean isEmpty() {
            return PixelBuffer.this.isEmpty();
        }

        @Override
        public int rowStride() {
            return PixelBuffer.this.rowStride();
        }

        @Override
        public int get(int row, int col, int channel) {
            return PixelBuffer.this.get(row, col, channel);
        }

        @Override
        public void readRow(int row, byte[] dst, int offset) {
            PixelBuffer.this.readRow(row, dst, offset);
        }

        @Override
        public byte[] toByteArray() {
            return PixelBuffer.this.toByteArray();
        }

        @Override
        public ByteBuffer asReadOnlyBuffer() {
            return PixelBuffer.this.asReadOnlyBuffer();
        }

        private PixelBuffer owner() {
            return PixelBuffer.this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return PixelBuffer.this.equals(((ReadOnlyView) o).owner());
        }

        @Override
        public int hashCode() {
            return PixelBuffer.this.hashCode();
        }

        @Override
        public String toString() {
            return PixelBuffer.this.toString();
        }
    }
}

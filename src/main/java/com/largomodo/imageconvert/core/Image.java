package com.largomodo.imageconvert.core;

import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raster image bound to one on-disk codec.
 * <p>
 * Pairs format metadata (pixel format, width, height) with a {@link PixelBuffer}. Concrete
 * subclasses implement the two channel primitives; path and byte-array variants are provided
 * here and delegate to them.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@code load} replaces metadata and buffer in a single pass. If it throws, the buffer
 *       contents are unspecified and must not be read.</li>
 *   <li>{@code save} reads the buffer without modifying it.</li>
 *   <li>Every failure is an {@link ImageCodecException} carrying an {@link ErrorKind}.</li>
 * </ul>
 * <p>
 * Instances are not thread-safe; independent instances may be used concurrently.
 */
public abstract class Image {

    protected PixelFormat format = PixelFormat.GRAYSCALE;
    protected int width;
    protected int height;
    protected final PixelBuffer buffer = new PixelBuffer();

    /**
     * Decodes the image from the channel's current position.
     *
     * @param channel readable, seekable source
     * @throws ImageCodecException if the channel is closed, the layout is malformed or
     *                             unsupported, or the read fails
     */
    public abstract void load(SeekableByteChannel channel) throws ImageCodecException;

    /**
     * Encodes the image at the channel's current position.
     *
     * @param channel writable target
     * @throws ImageCodecException if the channel is closed, the image cannot be represented in
     *                             this format, or the write fails
     */
    public abstract void save(WritableByteChannel channel) throws ImageCodecException;

    /**
     * @return registry extension handled by this codec (lowercase, no leading dot)
     */
    public abstract String extension();

    /**
     * Loads the image from a file.
     *
     * @throws ImageCodecException {@link ErrorKind#INVALID_ARGUMENT} if the file cannot be opened
     */
    public void load(Path path) throws ImageCodecException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw ImageCodecException.invalidArgument("Can not open: " + path);
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            load(channel);
        } catch (ImageCodecException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.INVALID_ARGUMENT, "Can not open: " + path, e);
        }
    }

    /**
     * Loads the image from an in-memory encoded copy.
     */
    public void load(byte[] encoded) throws ImageCodecException {
        Objects.requireNonNull(encoded, "encoded must not be null");
        load(new SeekableInMemoryByteChannel(encoded));
    }

    /**
     * Saves the image to a file, creating or truncating it.
     *
     * @throws ImageCodecException {@link ErrorKind#INVALID_ARGUMENT} if the file cannot be opened
     */
    public void save(Path path) throws ImageCodecException {
        Objects.requireNonNull(path, "path must not be null");
        FileChannel channel;
        try {
            channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.INVALID_ARGUMENT, "Can not open: " + path, e);
        }
        try (channel) {
            save(channel);
        } catch (ImageCodecException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.UNKNOWN, "Can not close: " + path, e);
        }
    }

    /**
     * @return encoded form of the image
     */
    public byte[] toByteArray() throws ImageCodecException {
        SeekableInMemoryByteChannel channel = new SeekableInMemoryByteChannel();
        save(channel);
        return Arrays.copyOf(channel.array(), (int) channel.size());
    }

    /**
     * Replaces metadata and samples with caller-supplied data, typically before {@code save}.
     *
     * @param format  sample layout of {@code samples}
     * @param width   image width in pixels
     * @param height  image height in pixels
     * @param samples row-major, channel-interleaved samples in red-green-blue(-alpha) order
     * @throws IllegalArgumentException if dimensions are negative or the length does not match
     */
    public void setPixels(PixelFormat format, int width, int height, byte[] samples) {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimensions must not be negative: " + width + "x" + height);
        }
        long expected = (long) width * height * format.channels();
        if (samples.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " samples for " + width + "x" + height + " " + format +
                            ", got " + samples.length);
        }
        allocate(format, width, height);
        buffer.copyFrom(samples);
    }

    /**
     * Sets metadata and reallocates the buffer to match.
     */
    protected void allocate(PixelFormat format, int width, int height) {
        this.format = format;
        this.width = width;
        this.height = height;
        buffer.resize(height, width, format.channels());
    }

    public PixelFormat format() {
        return format;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * @return read-only view of the samples, reflecting later loads
     */
    public PixelData data() {
        return buffer.readOnlyView();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "format=" + format +
                ", width=" + width +
                ", height=" + height +
                '}';
    }
}

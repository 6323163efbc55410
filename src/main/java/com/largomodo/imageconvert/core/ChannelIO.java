package com.largomodo.imageconvert.core;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channel;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * Channel read/write helpers shared by the codecs.
 * <p>
 * Translates channel-level outcomes into {@link ImageCodecException}: end of data before the
 * requested byte count is {@link ErrorKind#INTERNAL_ERROR} (the file is shorter than its header
 * declares), any other {@link IOException} is {@link ErrorKind#UNKNOWN} with the cause attached.
 */
public final class ChannelIO {

    private ChannelIO() {
    }

    /**
     * Fails with {@link ErrorKind#INVALID_ARGUMENT} unless the channel is open.
     */
    public static void ensureOpen(Channel channel) throws ImageCodecException {
        if (channel == null || !channel.isOpen()) {
            throw ImageCodecException.invalidArgument("Channel is closed or missing");
        }
    }

    /**
     * Reads exactly {@code size} bytes.
     *
     * @return little-endian buffer positioned at 0 with {@code size} bytes remaining
     * @throws ImageCodecException if the channel ends early or fails
     */
    public static ByteBuffer readFully(ReadableByteChannel channel, int size) throws ImageCodecException {
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        readFully(channel, buffer);
        buffer.flip();
        return buffer;
    }

    /**
     * Fills {@code dst} completely.
     *
     * @throws ImageCodecException if the channel ends early or fails
     */
    public static void readFully(ReadableByteChannel channel, byte[] dst) throws ImageCodecException {
        readFully(channel, ByteBuffer.wrap(dst));
    }

    private static void readFully(ReadableByteChannel channel, ByteBuffer buffer) throws ImageCodecException {
        int requested = buffer.remaining();
        try {
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) == -1) {
                    throw ImageCodecException.internalError(
                            "Truncated data: expected " + requested + " bytes, got " + (requested - buffer.remaining()));
                }
            }
        } catch (ImageCodecException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.UNKNOWN, "Read failed: " + e.getMessage(), e);
        }
    }

    /**
     * Writes all remaining bytes of {@code buffer}.
     */
    public static void writeFully(WritableByteChannel channel, ByteBuffer buffer) throws ImageCodecException {
        try {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.UNKNOWN, "Write failed: " + e.getMessage(), e);
        }
    }

    /**
     * @return current channel position
     */
    public static long position(SeekableByteChannel channel) throws ImageCodecException {
        try {
            return channel.position();
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.UNKNOWN, "Cannot query channel position: " + e.getMessage(), e);
        }
    }

    /**
     * @return current channel size in bytes
     */
    public static long size(SeekableByteChannel channel) throws ImageCodecException {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.UNKNOWN, "Cannot query channel size: " + e.getMessage(), e);
        }
    }

    /**
     * Fails with {@link ErrorKind#INTERNAL_ERROR} unless {@code length} bytes exist at {@code from}.
     * Lets decoders reject a truncated stream before allocating for its declared dimensions.
     */
    public static void requireAvailable(SeekableByteChannel channel, long from, long length) throws ImageCodecException {
        long size = size(channel);
        if (from + length > size) {
            throw ImageCodecException.internalError(
                    "Truncated data: need " + length + " bytes at offset " + from + ", stream has " + size);
        }
    }

    /**
     * Moves to an absolute position. Seeking past the end is allowed; the next read fails.
     */
    public static void seek(SeekableByteChannel channel, long position) throws ImageCodecException {
        if (position < 0) {
            throw ImageCodecException.internalError("Negative seek position: " + position);
        }
        try {
            channel.position(position);
        } catch (IOException e) {
            throw new ImageCodecException(ErrorKind.UNKNOWN, "Cannot seek to " + position + ": " + e.getMessage(), e);
        }
    }

    /**
     * Advances the position by {@code count} bytes.
     */
    public static void skip(SeekableByteChannel channel, long count) throws ImageCodecException {
        if (count > 0) {
            seek(channel, position(channel) + count);
        }
    }
}

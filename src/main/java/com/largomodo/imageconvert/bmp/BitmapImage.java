package com.largomodo.imageconvert.bmp;

import com.largomodo.imageconvert.core.ChannelIO;
import com.largomodo.imageconvert.core.ChannelOrder;
import com.largomodo.imageconvert.core.ErrorKind;
import com.largomodo.imageconvert.core.Image;
import com.largomodo.imageconvert.core.ImageCodecException;
import com.largomodo.imageconvert.core.PixelFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * Windows Bitmap (BMP) codec.
 * <p>
 * Decoding handles:
 * <ul>
 *   <li>12-byte (OS/2) and 40-byte DIB headers</li>
 *   <li>Uncompressed 24 bit (RGB) and 32 bit (RGBA) pixels</li>
 *   <li>Scanlines padded to 4 bytes</li>
 *   <li>Bottom-to-top (positive height) and top-to-bottom (negative height) row order</li>
 * </ul>
 * Indexed (1 to 8 bit), 16 bit and compressed files are rejected with INTERNAL_ERROR.
 * <p>
 * Encoding always writes a 40-byte header, positive height and bottom-to-top rows.
 * Grayscale images cannot be encoded since no color table is emitted.
 * <p>
 * The pixel array offset is relative to the channel position at which {@code load} starts, so
 * a bitmap embedded in a larger stream decodes correctly.
 */
public class BitmapImage extends Image {

    public static final String EXTENSION = "bmp";

    private static final Logger log = LoggerFactory.getLogger(BitmapImage.class);

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public void load(SeekableByteChannel channel) throws ImageCodecException {
        ChannelIO.ensureOpen(channel);
        long start = ChannelIO.position(channel);

        BmpHeader header = BmpHeader.read(channel);
        DibHeader dib = header.dib();
        if (!dib.isSupported()) {
            log.debug("Rejecting bitmap: {}", header);
            throw ImageCodecException.internalError("Error while decoding BMP header: unsupported "
                    + dib.bitsPerPixel() + " bpp, compression " + DibHeader.Compression.describe(dib.compression()));
        }
        if (dib.width() <= 0 || dib.height() == 0) {
            throw ImageCodecException.internalError(
                    "Invalid bitmap dimensions: " + dib.width() + "x" + dib.height());
        }

        long pixelStart = start + Integer.toUnsignedLong(header.fileHeader().pixelOffset());
        long pitch = dib.rowPitch();
        ChannelIO.requireAvailable(channel, pixelStart, pitch * dib.absoluteHeight());

        PixelFormat pixelFormat = dib.bitsPerPixel() == 32 ? PixelFormat.RGBA : PixelFormat.RGB;
        try {
            allocate(pixelFormat, dib.width(), dib.absoluteHeight());
        } catch (IllegalArgumentException e) {
            throw new ImageCodecException(ErrorKind.INTERNAL_ERROR, "Error while decoding BMP: " + e.getMessage(), e);
        }
        log.debug("Decoding {}x{} bitmap, {} bpp, {}", width, height, dib.bitsPerPixel(),
                dib.isTopDown() ? "top-down" : "bottom-up");

        ChannelIO.seek(channel, pixelStart);
        decodePixels(channel, dib, (int) pitch);
    }

    /**
     * Reads {@code height} padded scanlines and stores them in buffer order.
     * <p>
     * Bottom-up files fill the buffer from the last row backwards; top-down files from row 0.
     */
    private void decodePixels(SeekableByteChannel channel, DibHeader dib, int pitch) throws ImageCodecException {
        int bytesPerPixel = switch (dib.bitsPerPixel()) {
            case 24 -> 3;
            case 32 -> 4;
            default -> throw ImageCodecException.internalError("Invalid pixel format: " + dib.bitsPerPixel() + " bpp");
        };

        byte[] scanline = new byte[pitch];
        byte[] row = new byte[buffer.rowStride()];
        boolean bottomUp = !dib.isTopDown();

        for (int k = 0; k < height; k++) {
            ChannelIO.readFully(channel, scanline);
            System.arraycopy(scanline, 0, row, 0, width * bytesPerPixel);
            ChannelOrder.swapRedBlue(row, 0, width, bytesPerPixel);
            int target = bottomUp ? height - 1 - k : k;
            buffer.writeRow(target, row, 0);
        }
    }

    @Override
    public void save(WritableByteChannel channel) throws ImageCodecException {
        ChannelIO.ensureOpen(channel);
        if (buffer.isEmpty()) {
            throw ImageCodecException.invalidArgument("No pixel data to encode");
        }
        if (format == PixelFormat.GRAYSCALE) {
            // needs an emitted color table; not supported
            throw ImageCodecException.internalError("Grayscale bitmap encoding is not supported");
        }

        int channels = format.channels();
        int step = width * channels;
        int fileStep = (step + 3) & ~3;
        long fileSize = BmpHeader.ENCODED_SIZE + (long) height * fileStep;
        if (fileSize > Integer.MAX_VALUE) {
            throw ImageCodecException.invalidArgument("Image too large for BMP: " + fileSize + " bytes");
        }

        BmpHeader header = BmpHeader.forImage(width, height, channels, fileStep);
        ByteBuffer out = ByteBuffer.allocate((int) fileSize).order(ByteOrder.LITTLE_ENDIAN);
        header.writeTo(out);

        // Bytes past 'step' are never written and stay zero (row padding)
        byte[] row = new byte[fileStep];
        for (int r = height - 1; r >= 0; r--) {
            buffer.readRow(r, row, 0);
            ChannelOrder.swapRedBlue(row, 0, width, channels);
            out.put(row);
        }
        out.flip();
        ChannelIO.writeFully(channel, out);
        log.debug("Encoded {}x{} {} bitmap, {} bytes", width, height, format, fileSize);
    }
}

package com.largomodo.imageconvert.tga;

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
 * Truevision TGA codec for uncompressed true-color (type 2) and grayscale (type 3) images.
 * <p>
 * Pixels are stored without row padding, color samples in blue-green-red(-alpha) order. Rows
 * are copied into the buffer in file order; the origin bits of the descriptor are not applied.
 * Saved files carry a top-left origin, no ID field and no color map.
 * <p>
 * Run-length encoded and color-mapped image types are rejected with INTERNAL_ERROR.
 */
public class TrueVisionImage extends Image {

    public static final String EXTENSION = "tga";

    private static final Logger log = LoggerFactory.getLogger(TrueVisionImage.class);

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public void load(SeekableByteChannel channel) throws ImageCodecException {
        ChannelIO.ensureOpen(channel);

        TgaHeader header = TgaHeader.read(ChannelIO.readFully(channel, TgaHeader.SIZE));
        if (!header.isSupportedType()) {
            log.debug("Rejecting TGA: {}", header);
            throw ImageCodecException.internalError("Unsupported TGA image type: " + header.imageType());
        }

        TgaHeader.ImageSpec spec = header.image();
        PixelFormat pixelFormat = spec.pixelDepth() % 8 == 0
                ? PixelFormat.fromChannels(spec.pixelDepth() / 8).orElse(null)
                : null;
        if (pixelFormat == null) {
            throw ImageCodecException.internalError("Unsupported TGA pixel depth: " + spec.pixelDepth());
        }
        if (spec.width() == 0 || spec.height() == 0) {
            throw ImageCodecException.internalError("Invalid TGA dimensions: " + spec.width() + "x" + spec.height());
        }

        ChannelIO.skip(channel, header.idLength() + header.colorMapDataSize());

        long pixelBytes = (long) spec.width() * spec.height() * pixelFormat.channels();
        ChannelIO.requireAvailable(channel, ChannelIO.position(channel), pixelBytes);
        try {
            allocate(pixelFormat, spec.width(), spec.height());
        } catch (IllegalArgumentException e) {
            throw new ImageCodecException(ErrorKind.INTERNAL_ERROR, "Error while decoding TGA: " + e.getMessage(), e);
        }
        log.debug("Decoding {}x{} TGA, type {}, {} alpha bits, {} origin", width, height, header.imageType(),
                spec.alphaBits(), spec.isTopLeftOrigin() ? "top-left" : "bottom-left");

        byte[] row = new byte[buffer.rowStride()];
        for (int k = 0; k < height; k++) {
            ChannelIO.readFully(channel, row);
            if (format.isColor()) {
                ChannelOrder.swapRedBlue(row, 0, width, format.channels());
            }
            buffer.writeRow(k, row, 0);
        }
    }

    @Override
    public void save(WritableByteChannel channel) throws ImageCodecException {
        ChannelIO.ensureOpen(channel);
        if (buffer.isEmpty()) {
            throw ImageCodecException.invalidArgument("No pixel data to encode");
        }
        if (width > TgaHeader.MAX_DIMENSION || height > TgaHeader.MAX_DIMENSION) {
            throw ImageCodecException.invalidArgument(
                    "Image too large for TGA: " + width + "x" + height + " (max " + TgaHeader.MAX_DIMENSION + ")");
        }

        byte[] pixels = buffer.toByteArray();
        if (format.isColor()) {
            ChannelOrder.swapRedBlue(pixels, format.channels());
        }

        ByteBuffer out = ByteBuffer.allocate(TgaHeader.SIZE).order(ByteOrder.LITTLE_ENDIAN);
        TgaHeader.forImage(format, width, height).writeTo(out);
        out.flip();
        ChannelIO.writeFully(channel, out);
        ChannelIO.writeFully(channel, ByteBuffer.wrap(pixels));
        log.debug("Encoded {}x{} {} TGA, {} bytes", width, height, format, TgaHeader.SIZE + pixels.length);
    }
}

package com.largomodo.imageconvert.bmp;

import com.largomodo.imageconvert.core.ChannelIO;
import com.largomodo.imageconvert.core.ImageCodecException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;

/**
 * Device-independent bitmap header describing image geometry and pixel encoding.
 * <p>
 * Two on-disk variants are recognised, selected by the leading size field:
 * <ul>
 *   <li>{@value #CORE_HEADER_SIZE} bytes (OS/2 BITMAPCOREHEADER): signed 16-bit width, height,
 *       planes and bit count. Compression is implicitly {@link Compression#RGB}.</li>
 *   <li>{@value #INFO_HEADER_SIZE} bytes (BITMAPINFOHEADER): 32-bit width and height, 16-bit
 *       planes and bit count, then compression, raw size, resolutions, palette size and
 *       important color count as 32-bit values.</li>
 * </ul>
 * A positive height means rows are stored bottom-to-top; a negative height means top-to-bottom.
 * Only the 40-byte variant is ever written.
 */
public record DibHeader(
        int size,
        int width,
        int height,
        int planes,
        int bitsPerPixel,
        int compression,
        int rawImageSize,
        int horizontalResolution,
        int verticalResolution,
        int paletteColors,
        int importantColors
) {

    public static final int CORE_HEADER_SIZE = 12;
    public static final int INFO_HEADER_SIZE = 40;

    /**
     * Compression codes of the 40-byte header.
     */
    public enum Compression {
        RGB(0),
        RLE8(1),
        RLE4(2),
        BITFIELDS(3);

        private final int code;

        Compression(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static String describe(int code) {
            for (Compression c : values()) {
                if (c.code == code) {
                    return c.name();
                }
            }
            return "UNKNOWN(" + code + ")";
        }
    }

    /**
     * Reads the size field, then the variant it selects.
     *
     * @throws ImageCodecException INTERNAL_ERROR for any size other than 12 or 40, or truncated data
     */
    public static DibHeader read(ReadableByteChannel channel) throws ImageCodecException {
        int size = ChannelIO.readFully(channel, Integer.BYTES).getInt();
        return switch (size) {
            case CORE_HEADER_SIZE -> readCore(ChannelIO.readFully(channel, CORE_HEADER_SIZE - Integer.BYTES));
            case INFO_HEADER_SIZE -> readInfo(ChannelIO.readFully(channel, INFO_HEADER_SIZE - Integer.BYTES));
            default -> throw ImageCodecException.internalError("Unsupported bitmap format: DIB header size " + size);
        };
    }

    private static DibHeader readCore(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        short width = buffer.getShort();
        short height = buffer.getShort();
        short planes = buffer.getShort();
        short bpp = buffer.getShort();
        return new DibHeader(CORE_HEADER_SIZE, width, height, planes, bpp,
                Compression.RGB.code(), 0, 0, 0, 0, 0);
    }

    private static DibHeader readInfo(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        int width = buffer.getInt();
        int height = buffer.getInt();
        short planes = buffer.getShort();
        short bpp = buffer.getShort();
        int compression = buffer.getInt();
        int rawImageSize = buffer.getInt();
        int hRes = buffer.getInt();
        int vRes = buffer.getInt();
        int paletteColors = buffer.getInt();
        int importantColors = buffer.getInt();
        return new DibHeader(INFO_HEADER_SIZE, width, height, planes, bpp,
                compression, rawImageSize, hRes, vRes, paletteColors, importantColors);
    }

    /**
     * 40-byte header for an uncompressed image with bottom-to-top rows.
     *
     * @param width        image width
     * @param height       image height (stored positive)
     * @param bitsPerPixel 24 or 32
     */
    public static DibHeader forImage(int width, int height, int bitsPerPixel) {
        int rawImageSize = (int) (((long) width * height * bitsPerPixel) / 8);
        return new DibHeader(INFO_HEADER_SIZE, width, height, 1, bitsPerPixel,
                Compression.RGB.code(), rawImageSize, 0, 0, 0, 0);
    }

    /**
     * Only uncompressed 24 and 32 bit color is decodable.
     */
    public boolean isSupported() {
        boolean colorDepth = bitsPerPixel == 24 || bitsPerPixel == 32;
        if (size == INFO_HEADER_SIZE) {
            return colorDepth && compression == Compression.RGB.code();
        }
        return colorDepth;
    }

    /**
     * @return true when a color table follows the header (1 to 8 bits per pixel)
     */
    public boolean hasColorTable() {
        return bitsPerPixel > 0 && bitsPerPixel <= 8;
    }

    /**
     * @return color table entries: the palette field, or {@code 1 << bpp} when it is zero
     */
    public int colorTableEntries() {
        if (!hasColorTable()) {
            return 0;
        }
        return paletteColors == 0 ? 1 << bitsPerPixel : paletteColors;
    }

    /**
     * @return true if rows are stored top-to-bottom
     */
    public boolean isTopDown() {
        return height < 0;
    }

    public int absoluteHeight() {
        return Math.abs(height);
    }

    /**
     * @return bytes between consecutive scanlines, padded to a 4-byte boundary
     */
    public long rowPitch() {
        return (((long) width * bitsPerPixel + 31) / 32) * 4;
    }

    /**
     * Writes the 40-byte form at the buffer's position.
     */
    public void writeTo(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(INFO_HEADER_SIZE);
        buffer.putInt(width);
        buffer.putInt(height);
        buffer.putShort((short) planes);
        buffer.putShort((short) bitsPerPixel);
        buffer.putInt(compression);
        buffer.putInt(rawImageSize);
        buffer.putInt(horizontalResolution);
        buffer.putInt(verticalResolution);
        buffer.putInt(paletteColors);
        buffer.putInt(importantColors);
    }
}

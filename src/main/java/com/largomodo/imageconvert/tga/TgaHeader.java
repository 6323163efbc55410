package com.largomodo.imageconvert.tga;

import com.largomodo.imageconvert.core.PixelFormat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The fixed 18-byte header of a Truevision TGA file.
 * <p>
 * Layout (little-endian):
 * <pre>
 * 0x00  1  ID field length
 * 0x01  1  color map type (0 = none, 1 = present)
 * 0x02  1  image type
 * 0x03  5  color map specification
 * 0x08 10  image specification
 * </pre>
 * The ID field and color map data (if any) follow the header, then the pixel data.
 *
 * @param idLength     bytes of the image ID field after the header
 * @param colorMapType 0 or 1
 * @param imageType    2 = uncompressed true-color, 3 = uncompressed grayscale
 * @param colorMap     color map specification
 * @param image        image specification
 */
public record TgaHeader(
        int idLength,
        int colorMapType,
        int imageType,
        ColorMapSpec colorMap,
        ImageSpec image
) {

    public static final int SIZE = 18;

    public static final int IMAGE_TYPE_TRUECOLOR = 2;
    public static final int IMAGE_TYPE_GRAYSCALE = 3;

    /** Descriptor bit 5: rows stored top-to-bottom. */
    public static final int DESCRIPTOR_TOP_LEFT = 0x20;

    /** Descriptor bits 0-3: attribute (alpha) bits per pixel. */
    public static final int DESCRIPTOR_ALPHA_MASK = 0x0F;

    /** Largest width or height the 16-bit fields can hold. */
    public static final int MAX_DIMENSION = 0xFFFF;

    /**
     * @param firstIndex   index of the first color map entry
     * @param entryCount   number of color map entries
     * @param bitsPerEntry bits per color map entry
     */
    public record ColorMapSpec(int firstIndex, int entryCount, int bitsPerEntry) {

        static final ColorMapSpec NONE = new ColorMapSpec(0, 0, 0);
    }

    /**
     * @param xOrigin    horizontal origin
     * @param yOrigin    vertical origin
     * @param width      width in pixels
     * @param height     height in pixels
     * @param pixelDepth bits per pixel
     * @param descriptor alpha bits and origin flags
     */
    public record ImageSpec(int xOrigin, int yOrigin, int width, int height, int pixelDepth, int descriptor) {

        public boolean isTopLeftOrigin() {
            return (descriptor & DESCRIPTOR_TOP_LEFT) != 0;
        }

        public int alphaBits() {
            return descriptor & DESCRIPTOR_ALPHA_MASK;
        }
    }

    /**
     * Parses the next {@link #SIZE} bytes of {@code buffer}. All fields are unsigned.
     */
    public static TgaHeader read(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        int idLength = Byte.toUnsignedInt(buffer.get());
        int colorMapType = Byte.toUnsignedInt(buffer.get());
        int imageType = Byte.toUnsignedInt(buffer.get());

        ColorMapSpec colorMap = new ColorMapSpec(
                Short.toUnsignedInt(buffer.getShort()),
                Short.toUnsignedInt(buffer.getShort()),
                Byte.toUnsignedInt(buffer.get()));

        ImageSpec image = new ImageSpec(
                Short.toUnsignedInt(buffer.getShort()),
                Short.toUnsignedInt(buffer.getShort()),
                Short.toUnsignedInt(buffer.getShort()),
                Short.toUnsignedInt(buffer.getShort()),
                Byte.toUnsignedInt(buffer.get()),
                Byte.toUnsignedInt(buffer.get()));

        return new TgaHeader(idLength, colorMapType, imageType, colorMap, image);
    }

    /**
     * Header for an uncompressed image with top-left origin and no ID or color map.
     */
    public static TgaHeader forImage(PixelFormat format, int width, int height) {
        int imageType = format == PixelFormat.GRAYSCALE ? IMAGE_TYPE_GRAYSCALE : IMAGE_TYPE_TRUECOLOR;
        int alphaBits = format == PixelFormat.RGBA ? 8 : 0;
        ImageSpec image = new ImageSpec(0, 0, width, height, format.channels() * 8, DESCRIPTOR_TOP_LEFT | alphaBits);
        return new TgaHeader(0, 0, imageType, ColorMapSpec.NONE, image);
    }

    public boolean isSupportedType() {
        return imageType == IMAGE_TYPE_TRUECOLOR || imageType == IMAGE_TYPE_GRAYSCALE;
    }

    /**
     * @return bytes of color map data between the ID field and the pixels
     */
    public long colorMapDataSize() {
        if (colorMapType != 1) {
            return 0;
        }
        return (long) colorMap.entryCount() * ((colorMap.bitsPerEntry() + 7) / 8);
    }

    /**
     * Writes the {@link #SIZE} header bytes at the buffer's position.
     */
    public void writeTo(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) idLength);
        buffer.put((byte) colorMapType);
        buffer.put((byte) imageType);
        buffer.putShort((short) colorMap.firstIndex());
        buffer.putShort((short) colorMap.entryCount());
        buffer.put((byte) colorMap.bitsPerEntry());
        buffer.putShort((short) image.xOrigin());
        buffer.putShort((short) image.yOrigin());
        buffer.putShort((short) image.width());
        buffer.putShort((short) image.height());
        buffer.put((byte) image.pixelDepth());
        buffer.put((byte) image.descriptor());
    }
}

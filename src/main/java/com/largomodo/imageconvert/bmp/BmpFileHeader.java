package com.largomodo.imageconvert.bmp;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The 14-byte BITMAPFILEHEADER that starts every BMP file.
 * <p>
 * Layout (little-endian):
 * <pre>
 * 0x00  2  signature ("BM")
 * 0x02  4  file size in bytes
 * 0x06  4  reserved (ignored on read, zero on write)
 * 0x0A  4  offset of the pixel array from the start of the file
 * </pre>
 *
 * @param signature   first two bytes as an unsigned little-endian short ("BM" = 0x4D42)
 * @param fileSize    declared file size
 * @param reserved    reserved field, carried through unchanged on read
 * @param pixelOffset pixel array offset relative to the start of this header
 */
public record BmpFileHeader(int signature, int fileSize, int reserved, int pixelOffset) {

    public static final int SIZE = 14;

    /** "BM" read as a little-endian short. */
    public static final int SIGNATURE_BM = 'B' | ('M' << 8);

    /**
     * Parses the header from the next {@link #SIZE} bytes of {@code buffer}.
     */
    public static BmpFileHeader read(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        int signature = Short.toUnsignedInt(buffer.getShort());
        int fileSize = buffer.getInt();
        int reserved = buffer.getInt();
        int pixelOffset = buffer.getInt();
        return new BmpFileHeader(signature, fileSize, reserved, pixelOffset);
    }

    /**
     * Header for a freshly encoded file.
     */
    public static BmpFileHeader of(int fileSize, int pixelOffset) {
        return new BmpFileHeader(SIGNATURE_BM, fileSize, 0, pixelOffset);
    }

    public boolean hasValidSignature() {
        return signature == SIGNATURE_BM;
    }

    /**
     * Writes the {@link #SIZE} header bytes at the buffer's position.
     */
    public void writeTo(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        buffer.putShort((short) signature);
        buffer.putInt(fileSize);
        buffer.putInt(0);
        buffer.putInt(pixelOffset);
    }

    /**
     * @return signature as printable text (for diagnostics)
     */
    public String signatureText() {
        return new String(new char[]{(char) (signature & 0xFF), (char) ((signature >> 8) & 0xFF)});
    }
}

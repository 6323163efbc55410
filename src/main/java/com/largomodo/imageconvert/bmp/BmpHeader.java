package com.largomodo.imageconvert.bmp;

import com.largomodo.imageconvert.core.ChannelIO;
import com.largomodo.imageconvert.core.ImageCodecException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;
import java.util.Arrays;
import java.util.Objects;

/**
 * Everything in a BMP file before the pixel array: file header, DIB header and the optional
 * color table.
 * <p>
 * The color table holds 32-bit BGRx entries and is present only for 1 to 8 bits per pixel.
 * It is parsed so the stream stays aligned, but indexed pixels are never expanded from it.
 *
 * @param fileHeader 14-byte file header
 * @param dib        DIB header (12 or 40 bytes on disk)
 * @param colorTable BGRx palette entries, empty for true-color images
 */
public record BmpHeader(BmpFileHeader fileHeader, DibHeader dib, int[] colorTable) {

    /** File header plus a 40-byte DIB header, without color table. */
    public static final int ENCODED_SIZE = BmpFileHeader.SIZE + DibHeader.INFO_HEADER_SIZE;

    private static final int MAX_COLOR_TABLE_ENTRIES = 256;

    public BmpHeader {
        Objects.requireNonNull(fileHeader, "fileHeader must not be null");
        Objects.requireNonNull(dib, "dib must not be null");
        colorTable = colorTable == null ? new int[0] : colorTable.clone();
    }

    /**
     * @return copy of the palette entries
     */
    @Override
    public int[] colorTable() {
        return colorTable.clone();
    }

    /**
     * Reads file header, DIB header and color table from the channel's current position.
     *
     * @throws ImageCodecException INTERNAL_ERROR on a wrong signature, unknown DIB size, oversized
     *                             color table or truncated data
     */
    public static BmpHeader read(ReadableByteChannel channel) throws ImageCodecException {
        BmpFileHeader fileHeader = BmpFileHeader.read(ChannelIO.readFully(channel, BmpFileHeader.SIZE));
        if (!fileHeader.hasValidSignature()) {
            throw ImageCodecException.internalError(
                    "Not a bitmap file: signature '" + fileHeader.signatureText() + "'");
        }

        DibHeader dib = DibHeader.read(channel);

        int[] table = new int[0];
        if (dib.hasColorTable()) {
            int entries = dib.colorTableEntries();
            if (entries < 0 || entries > MAX_COLOR_TABLE_ENTRIES) {
                throw ImageCodecException.internalError("Invalid color table size: " + entries);
            }
            ByteBuffer raw = ChannelIO.readFully(channel, entries * Integer.BYTES);
            table = new int[entries];
            for (int i = 0; i < entries; i++) {
                table[i] = raw.getInt();
            }
        }
        return new BmpHeader(fileHeader, dib, table);
    }

    /**
     * Header for an uncompressed true-color image with padded bottom-to-top rows.
     *
     * @param width    image width
     * @param height   image height
     * @param channels 3 or 4
     * @param fileStep padded bytes per row
     */
    public static BmpHeader forImage(int width, int height, int channels, int fileStep) {
        int fileSize = ENCODED_SIZE + height * fileStep;
        return new BmpHeader(
                BmpFileHeader.of(fileSize, ENCODED_SIZE),
                DibHeader.forImage(width, height, channels * 8),
                new int[0]);
    }

    /**
     * Writes file header, DIB header and color table at the buffer's position.
     */
    public void writeTo(ByteBuffer buffer) {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        fileHeader.writeTo(buffer);
        dib.writeTo(buffer);
        for (int entry : colorTable) {
            buffer.putInt(entry);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BmpHeader that = (BmpHeader) o;
        return fileHeader.equals(that.fileHeader) &&
                dib.equals(that.dib) &&
                Arrays.equals(colorTable, that.colorTable);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(fileHeader, dib);
        result = 31 * result + Arrays.hashCode(colorTable);
        return result;
    }

    @Override
    public String toString() {
        return "BmpHeader{" +
                "fileHeader=" + fileHeader +
                ", dib=" + dib +
                ", colorTableEntries=" + colorTable.length +
                '}';
    }
}

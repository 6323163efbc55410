package com.largomodo.imageconvert.tga;

import com.largomodo.imageconvert.TestImages;
import com.largomodo.imageconvert.core.ErrorKind;
import com.largomodo.imageconvert.core.ImageCodecException;
import com.largomodo.imageconvert.core.PixelFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TrueVisionImageTest {

    private static final byte[] NO_ID = new byte[0];

    @ParameterizedTest
    @CsvSource({
            "3, 2, GRAYSCALE",
            "3, 2, RGB",
            "3, 2, RGBA",
            "17, 5, RGB",
            "1, 1, GRAYSCALE"
    })
    void roundTripPreservesPixels(int width, int height, PixelFormat format) throws ImageCodecException {
        byte[] samples = TestImages.pattern(width, height, format.channels());
        TrueVisionImage original = new TrueVisionImage();
        original.setPixels(format, width, height, samples);

        TrueVisionImage decoded = new TrueVisionImage();
        decoded.load(original.toByteArray());

        assertEquals(format, decoded.format());
        assertEquals(width, decoded.width());
        assertEquals(height, decoded.height());
        assertArrayEquals(samples, decoded.data().toByteArray());
    }

    @Test
    void encodedHeaderFieldsForRgba() throws ImageCodecException {
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(PixelFormat.RGBA, 3, 2, TestImages.pattern(3, 2, 4));

        byte[] tga = image.toByteArray();

        assertEquals(18 + 24, tga.length, "Header plus unpadded pixels");
        assertEquals(0, tga[0], "No ID field");
        assertEquals(0, tga[1], "No color map");
        assertEquals(2, tga[2], "True-color image type");
        assertEquals(0, TestImages.u16(tga, 8), "X origin");
        assertEquals(0, TestImages.u16(tga, 10), "Y origin");
        assertEquals(3, TestImages.u16(tga, 12), "Width");
        assertEquals(2, TestImages.u16(tga, 14), "Height");
        assertEquals(32, tga[16], "Pixel depth");
        assertEquals(0x28, tga[17], "Top-left origin with 8 alpha bits");
    }

    @Test
    void encodedHeaderFieldsForGrayscale() throws ImageCodecException {
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(PixelFormat.GRAYSCALE, 2, 2, new byte[]{1, 2, 3, 4});

        byte[] tga = image.toByteArray();

        assertEquals(3, tga[2], "Grayscale image type");
        assertEquals(8, tga[16]);
        assertEquals(0x20, tga[17]);
        assertArrayEquals(new byte[]{1, 2, 3, 4}, Arrays.copyOfRange(tga, 18, 22), "Gray samples written as-is");
    }

    @Test
    void colorSamplesWrittenAsBgr() throws ImageCodecException {
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(PixelFormat.RGB, 2, 1, new byte[]{1, 2, 3, 4, 5, 6});

        byte[] tga = image.toByteArray();

        assertArrayEquals(new byte[]{3, 2, 1, 6, 5, 4}, Arrays.copyOfRange(tga, 18, 24));
    }

    @Test
    void bottomLeftDescriptorKeepsFileRowOrder() throws ImageCodecException {
        byte[] tga = TestImages.tga(3, 1, 2, 8, 0x00, NO_ID, new byte[]{10, 20});

        TrueVisionImage image = new TrueVisionImage();
        image.load(tga);

        assertEquals(10, image.data().get(0, 0, 0), "First stored row lands in row 0");
        assertEquals(20, image.data().get(1, 0, 0));
    }

    @ParameterizedTest
    @CsvSource({"0x00", "0x20"})
    void originBitDoesNotReorderRows(String descriptor) throws ImageCodecException {
        byte[] pixels = {9, 8, 7, 3, 2, 1};
        byte[] tga = TestImages.tga(2, 1, 2, 24, Integer.decode(descriptor), NO_ID, pixels);

        TrueVisionImage image = new TrueVisionImage();
        image.load(tga);

        assertArrayEquals(new byte[]{7, 8, 9, 1, 2, 3}, image.data().toByteArray());
    }

    @Test
    void imageIdFieldIsSkipped() throws ImageCodecException {
        byte[] id = "created by a scanner".getBytes(java.nio.charset.StandardCharsets.US_ASCII);
        byte[] tga = TestImages.tga(3, 2, 1, 8, 0x20, id, new byte[]{42, 43});

        TrueVisionImage image = new TrueVisionImage();
        image.load(tga);

        assertEquals(PixelFormat.GRAYSCALE, image.format());
        assertArrayEquals(new byte[]{42, 43}, image.data().toByteArray());
    }

    @Test
    void colorMapDataIsSkipped() throws ImageCodecException {
        byte[] tga = TestImages.tga(2, 1, 1, 24, 0x20, NO_ID, new byte[]{0, 0, 0, 0, 0, 0, 3, 2, 1});
        tga[1] = 1;         // color map present
        tga[5] = 2;         // two entries
        tga[7] = 24;        // 3 bytes each

        TrueVisionImage image = new TrueVisionImage();
        image.load(tga);

        assertArrayEquals(new byte[]{1, 2, 3}, image.data().toByteArray());
    }

    @Test
    void runLengthEncodedTypeIsInternalError() {
        byte[] tga = TestImages.tga(10, 1, 1, 24, 0x20, NO_ID, new byte[3]);

        ImageCodecException e = assertThrows(ImageCodecException.class, () -> new TrueVisionImage().load(tga));

        assertEquals(ErrorKind.INTERNAL_ERROR, e.kind());
        assertTrue(e.getMessage().contains("10"), e.getMessage());
    }

    @Test
    void colorMappedTypeIsInternalError() {
        byte[] tga = TestImages.tga(1, 1, 1, 8, 0x20, NO_ID, new byte[1]);

        ImageCodecException e = assertThrows(ImageCodecException.class, () -> new TrueVisionImage().load(tga));

        assertEquals(ErrorKind.INTERNAL_ERROR, e.kind());
    }

    @Test
    void sixteenBitDepthIsInternalError() {
        byte[] tga = TestImages.tga(2, 1, 1, 16, 0x20, NO_ID, new byte[2]);

        ImageCodecException e = assertThrows(ImageCodecException.class, () -> new TrueVisionImage().load(tga));

        assertEquals(ErrorKind.INTERNAL_ERROR, e.kind());
    }

    @Test
    void zeroDimensionIsInternalError() {
        byte[] tga = TestImages.tga(2, 0, 1, 24, 0x20, NO_ID, new byte[0]);

        ImageCodecException e = assertThrows(ImageCodecException.class, () -> new TrueVisionImage().load(tga));

        assertEquals(ErrorKind.INTERNAL_ERROR, e.kind());
    }

    @Test
    void truncatedPixelsAreInternalError() {
        byte[] tga = TestImages.tga(2, 2, 2, 24, 0x20, NO_ID, new byte[11]);

        ImageCodecException e = assertThrows(ImageCodecException.class, () -> new TrueVisionImage().load(tga));

        assertEquals(ErrorKind.INTERNAL_ERROR, e.kind());
    }

    @Test
    void truncatedHeaderIsInternalError() {
        ImageCodecException e = assertThrows(ImageCodecException.class,
                () -> new TrueVisionImage().load(new byte[10]));

        assertEquals(ErrorKind.INTERNAL_ERROR, e.kind());
    }

    @Test
    void oversizedImageIsInvalidArgument() {
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(PixelFormat.GRAYSCALE, 65536, 1, new byte[65536]);

        ImageCodecException e = assertThrows(ImageCodecException.class, image::toByteArray);

        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    @Test
    void emptyImageIsInvalidArgument() {
        ImageCodecException e = assertThrows(ImageCodecException.class, () -> new TrueVisionImage().toByteArray());

        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    @Test
    void maximumWidthStillEncodes() throws ImageCodecException {
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(PixelFormat.GRAYSCALE, 65535, 1, new byte[65535]);

        byte[] tga = image.toByteArray();

        assertEquals(65535, TestImages.u16(tga, 12));
    }
}

package com.largomodo.imageconvert.tga;

import com.largomodo.imageconvert.core.ImageCodecException;
import com.largomodo.imageconvert.core.PixelFormat;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TrueVisionRoundTripPropertiesTest {

    @Property(tries = 200)
    void decodeOfEncodeIsIdentity(@ForAll @IntRange(min = 1, max = 40) int width,
                                  @ForAll @IntRange(min = 1, max = 40) int height,
                                  @ForAll("formats") PixelFormat format,
                                  @ForAll long seed) throws ImageCodecException {
        byte[] samples = new byte[width * height * format.channels()];
        new Random(seed).nextBytes(samples);
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(format, width, height, samples);

        TrueVisionImage decoded = new TrueVisionImage();
        decoded.load(image.toByteArray());

        assertEquals(format, decoded.format());
        assertEquals(width, decoded.width());
        assertEquals(height, decoded.height());
        assertArrayEquals(samples, decoded.data().toByteArray());
    }

    @Example
    void randomSixteenBySixteenRgbaSurvives() throws ImageCodecException {
        byte[] samples = new byte[16 * 16 * 4];
        new Random(16).nextBytes(samples);
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(PixelFormat.RGBA, 16, 16, samples);

        TrueVisionImage decoded = new TrueVisionImage();
        decoded.load(image.toByteArray());

        assertArrayEquals(samples, decoded.data().toByteArray());
    }

    @Property
    void encodedSizeHasNoPadding(@ForAll @IntRange(min = 1, max = 64) int width,
                                 @ForAll @IntRange(min = 1, max = 8) int height,
                                 @ForAll("formats") PixelFormat format) throws ImageCodecException {
        TrueVisionImage image = new TrueVisionImage();
        image.setPixels(format, width, height, new byte[width * height * format.channels()]);

        assertEquals(TgaHeader.SIZE + width * height * format.channels(), image.toByteArray().length);
    }

    @Provide
    Arbitrary<PixelFormat> formats() {
        return Arbitraries.of(PixelFormat.values());
    }
}

package com.largomodo.imageconvert.core;

import java.util.Optional;

/**
 * In-memory sample layout of an image: number of interleaved 8-bit channels per pixel.
 * <p>
 * Color formats are always stored red-green-blue(-alpha); on-disk byte orders are
 * converted by the codecs.
 */
public enum PixelFormat {
    GRAYSCALE(1),
    RGB(3),
    RGBA(4);

    private final int channels;

    PixelFormat(int channels) {
        this.channels = channels;
    }

    /**
     * Maps a channel count back to its format.
     *
     * @param channels number of interleaved samples per pixel
     * @return matching format, or empty for any count other than 1, 3 or 4
     */
    public static Optional<PixelFormat> fromChannels(int channels) {
        return switch (channels) {
            case 1 -> Optional.of(GRAYSCALE);
            case 3 -> Optional.of(RGB);
            case 4 -> Optional.of(RGBA);
            default -> Optional.empty();
        };
    }

    public int channels() {
        return channels;
    }

    public boolean isColor() {
        return this != GRAYSCALE;
    }
}

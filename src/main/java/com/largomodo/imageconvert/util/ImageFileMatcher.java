package com.largomodo.imageconvert.util;

import com.largomodo.imageconvert.registry.CodecRegistry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * File name helpers for picking a codec by extension.
 * <p>
 * Extensions are taken after the last dot and lowercased, so "Photo.BMP" and "photo.bmp" resolve
 * to the same codec. Dot-files (".bmp") have no extension.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public class ImageFileMatcher {

    private ImageFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path file path (may be null)
     * @return lowercase extension without the dot, or an empty string if there is none
     */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String filename = path.getFileName().toString();
        int lastDot = filename.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Strips the extension: "photo.final.bmp" → "photo.final".
     *
     * @throws IllegalArgumentException if path has no file name
     */
    public static String baseName(Path path) {
        if (path == null || path.getFileName() == null) {
            throw new IllegalArgumentException("Path has no file name: " + path);
        }
        String filename = path.getFileName().toString();
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 ? filename.substring(0, lastDot) : filename;
    }

    /**
     * Check if path is a regular file with an extension the registry can decode.
     * Returns false for directories, even when named like an image ("shots.bmp").
     */
    public static boolean isSupported(Path path, CodecRegistry registry) {
        if (path == null || !Files.isRegularFile(path)) {
            return false;
        }
        String extension = extensionOf(path);
        return !extension.isEmpty() && registry.supports(extension);
    }
}

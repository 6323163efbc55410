package com.largomodo.imageconvert.registry;

import com.largomodo.imageconvert.core.Image;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Registry entry binding a file extension to the factory of its {@link Image} codec.
 * <p>
 * The registry compares descriptors by identity: two descriptors with the same extension are
 * distinct entries, and lookup returns whichever was registered first.
 *
 * @param extension file extension without leading dot, matched case-sensitively
 * @param factory   creates a fresh, empty image for every call
 */
public record CodecDescriptor(String extension, Supplier<? extends Image> factory) {

    public CodecDescriptor {
        Objects.requireNonNull(extension, "extension must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (extension.isEmpty() || extension.startsWith(".")) {
            throw new IllegalArgumentException("Extension must be non-empty and have no leading dot: '" + extension + "'");
        }
    }

    /**
     * @return new image instance from the factory
     */
    public Image create() {
        return Objects.requireNonNull(factory.get(), () -> "Factory for '" + extension + "' returned null");
    }
}

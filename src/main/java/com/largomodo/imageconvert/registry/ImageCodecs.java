package com.largomodo.imageconvert.registry;

import com.largomodo.imageconvert.bmp.BitmapImage;
import com.largomodo.imageconvert.core.Image;
import com.largomodo.imageconvert.tga.TrueVisionImage;

import java.util.List;
import java.util.Optional;

/**
 * Process-wide default codec registry.
 * <p>
 * Built once, on first use, from the explicit {@link #BUILT_IN} list and sealed before it is
 * published. Registration order is the list order, which is also the lookup order.
 */
public final class ImageCodecs {

    public static final CodecDescriptor BMP = new CodecDescriptor(BitmapImage.EXTENSION, BitmapImage::new);
    public static final CodecDescriptor TGA = new CodecDescriptor(TrueVisionImage.EXTENSION, TrueVisionImage::new);

    /**
     * Built-in codecs in registration order.
     */
    public static final List<CodecDescriptor> BUILT_IN = List.of(BMP, TGA);

    private ImageCodecs() {
    }

    /**
     * @return the sealed default registry
     */
    public static CodecRegistry registry() {
        return Holder.INSTANCE;
    }

    /**
     * Shortcut for {@code registry().createByExtension(extension)}.
     */
    public static Optional<Image> createByExtension(String extension) {
        return registry().createByExtension(extension);
    }

    /**
     * Creates an unsealed registry pre-populated with the built-in codecs, for callers that add
     * their own formats.
     */
    public static CodecRegistry newRegistry() {
        CodecRegistry registry = new CodecRegistry();
        for (CodecDescriptor descriptor : BUILT_IN) {
            registry.register(descriptor);
        }
        return registry;
    }

    private static final class Holder {
        private static final CodecRegistry INSTANCE = createDefault();

        private static CodecRegistry createDefault() {
            CodecRegistry registry = newRegistry();
            registry.seal();
            return registry;
        }
    }
}

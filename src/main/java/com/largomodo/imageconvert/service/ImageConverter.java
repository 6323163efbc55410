package com.largomodo.imageconvert.service;

import com.largomodo.imageconvert.core.Image;
import com.largomodo.imageconvert.core.ImageCodecException;
import com.largomodo.imageconvert.registry.CodecRegistry;
import com.largomodo.imageconvert.util.ImageFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Load-then-save pipeline for a single image file.
 * <p>
 * Workflow:
 * <ol>
 *   <li>Resolve the source codec from the input's extension</li>
 *   <li>Resolve the target codec (same extension when none is requested)</li>
 *   <li>Decode the input</li>
 *   <li>Hand the pixels to the target codec and encode into the output directory</li>
 * </ol>
 * Re-saving in the source format writes {@code <name>_save.<ext>} so the input is never
 * overwritten in place; a format change writes {@code <name>.<ext>}.
 * <p>
 * Holds no per-call state. Safe to share across batch workers as long as the registry is.
 */
public class ImageConverter {

    static final String SAME_FORMAT_SUFFIX = "_save";

    private static final Logger log = LoggerFactory.getLogger(ImageConverter.class);

    private final CodecRegistry registry;
    private final ConversionObserver observer;

    public ImageConverter(CodecRegistry registry) {
        this(registry, ConversionObserver.NONE);
    }

    /**
     * @param registry codec lookup for both source and target
     * @param observer lifecycle callbacks (use {@link ConversionObserver#NONE} for none)
     */
    public ImageConverter(CodecRegistry registry, ConversionObserver observer) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    /**
     * Converts one image file.
     *
     * @param input           source image; its extension selects the decoder
     * @param outputDir       existing directory for the result
     * @param targetExtension registered extension to encode as, or null to keep the source format
     * @return path of the written file
     * @throws ImageCodecException INVALID_ARGUMENT for an unregistered extension or unopenable
     *                             file, otherwise whatever the codecs report
     */
    public Path convert(Path input, Path outputDir, String targetExtension) throws ImageCodecException {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(outputDir, "outputDir must not be null");

        observer.onStart(input);
        try {
            Path output = doConvert(input, outputDir, targetExtension);
            observer.onSuccess(input, output);
            return output;
        } catch (ImageCodecException | RuntimeException e) {
            observer.onFailure(input, e);
            throw e;
        }
    }

    private Path doConvert(Path input, Path outputDir, String targetExtension) throws ImageCodecException {
        String sourceExtension = ImageFileMatcher.extensionOf(input);
        String target = targetExtension == null ? sourceExtension : targetExtension;

        Image source = createCodec(sourceExtension, input);
        Image destination = target.equals(sourceExtension) ? source : createCodec(target, input);

        source.load(input);
        log.debug("Loaded {}", source);

        if (destination != source) {
            destination.setPixels(source.format(), source.width(), source.height(), source.data().toByteArray());
        }

        String suffix = target.equals(sourceExtension) ? SAME_FORMAT_SUFFIX : "";
        Path output = outputDir.resolve(ImageFileMatcher.baseName(input) + suffix + "." + target);
        destination.save(output);
        log.debug("Saved {} as {}", input.getFileName(), output);
        return output;
    }

    private Image createCodec(String extension, Path input) throws ImageCodecException {
        if (extension.isEmpty()) {
            throw ImageCodecException.invalidArgument("No file extension: " + input);
        }
        return registry.createByExtension(extension)
                .orElseThrow(() -> ImageCodecException.invalidArgument(
                        "No codec registered for extension '" + extension + "' (known: " + registry.extensions() + ")"));
    }
}

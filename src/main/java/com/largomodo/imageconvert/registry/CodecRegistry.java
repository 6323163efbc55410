package com.largomodo.imageconvert.registry;

import com.largomodo.imageconvert.core.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extension-keyed table of image codecs.
 * <p>
 * Two phases: descriptors are registered, then the registry is sealed and only read. Sealing
 * happens explicitly through {@link #seal()} or implicitly on the first lookup, so no lookup
 * can observe a partially populated table.
 * <p>
 * Lookup is a linear scan in registration order; the first descriptor whose extension matches
 * wins. Thread-safe.
 *
 * @see ImageCodecs#registry()
 */
public class CodecRegistry {

    private static final Logger log = LoggerFactory.getLogger(CodecRegistry.class);

    private final List<CodecDescriptor> descriptors = new ArrayList<>();
    private boolean sealed;

    /**
     * Adds a descriptor unless the same instance is already present.
     *
     * @param descriptor entry to add
     * @return true if added, false if this exact instance was registered before
     * @throws IllegalStateException if the registry is sealed
     */
    public synchronized boolean register(CodecDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("Descriptor cannot be null");
        }
        if (sealed) {
            throw new IllegalStateException("Registry is sealed, cannot register '" + descriptor.extension() + "'");
        }
        for (CodecDescriptor existing : descriptors) {
            if (existing == descriptor) {
                log.debug("Codec '{}' already registered, ignoring", descriptor.extension());
                return false;
            }
        }
        descriptors.add(descriptor);
        log.debug("Registered codec '{}'", descriptor.extension());
        return true;
    }

    /**
     * Ends the registration phase. Idempotent.
     */
    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    /**
     * Creates a fresh image for the given extension.
     *
     * @param extension extension without leading dot (case-sensitive)
     * @return new image, or empty if no codec handles the extension
     * @throws IllegalArgumentException if extension is null
     */
    public synchronized Optional<Image> createByExtension(String extension) {
        if (extension == null) {
            throw new IllegalArgumentException("Extension cannot be null");
        }
        sealed = true;
        for (CodecDescriptor descriptor : descriptors) {
            if (descriptor.extension().equals(extension)) {
                return Optional.of(descriptor.create());
            }
        }
        return Optional.empty();
    }

    /**
     * @return true if a codec handles the extension
     */
    public synchronized boolean supports(String extension) {
        return extension != null && descriptors.stream().anyMatch(d -> d.extension().equals(extension));
    }

    /**
     * @return registered extensions in registration order
     */
    public synchronized List<String> extensions() {
        return descriptors.stream().map(CodecDescriptor::extension).toList();
    }
}

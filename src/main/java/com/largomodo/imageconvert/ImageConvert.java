package com.largomodo.imageconvert;

import com.largomodo.imageconvert.core.ImageCodecException;
import com.largomodo.imageconvert.registry.CodecRegistry;
import com.largomodo.imageconvert.registry.ImageCodecs;
import com.largomodo.imageconvert.service.ConversionObserver;
import com.largomodo.imageconvert.service.ImageConverter;
import com.largomodo.imageconvert.util.ImageFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * CLI entry point for BMP/TGA image conversion.
 * <p>
 * Accepts a single positional input path (file or directory) and determines processing mode by
 * inspecting it at runtime.
 * <p>
 * Smart defaults:
 * - File input without -o: outputs to current working directory
 * - Directory input without -o: outputs to <input>/output subdirectory
 * - No -f: re-saves in the input's own format as <name>_save.<ext>
 */
@Command(
        name = "imageconvert",
        mixinStandardHelpOptions = true,
        resourceBundle = "imageconvert.imageconvert",
        version = "${bundle:application.version}",
        header = "Loads BMP and TGA images and saves them again, optionally in the other format.",
        description = {
                "Decodes uncompressed 24/32-bit BMP and uncompressed true-color or grayscale TGA files" +
                        " and re-encodes them.",
                "",
                "It supports recursive directory processing and batch conversion."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, unsupported image, etc.)",
                "2:Invalid command line arguments"
        }
)
public class ImageConvert implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImageConvert.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = {
                    "The source image (.bmp, .tga) to convert, or a directory to process.",
                    "If a directory is provided, the tool scans it recursively for supported images and " +
                            "converts them in batch mode, preserving the directory structure."
            })
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory for converted images.",
                    "If omitted, defaults apply:",
                    "  - Single file input: Defaults to the current directory ('.').",
                    "  - Directory input: Defaults to a folder named 'output' inside the input directory.",
                    "Necessary subdirectories will be created automatically."
            })
    File outputDir;

    @Option(names = {"-f", "--format"},
            description = {
                    "Target format extension (bmp, tga).",
                    "If omitted, each image is saved in its own format."
            })
    String format;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new ImageConvert());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    /**
     * Execute batch conversion with concurrent execution and fail-soft error handling.
     * <p>
     * Fixed thread pool sized to CPU cores. Bounded queue provides backpressure and
     * CallerRunsPolicy throttles submission when it is full. Each worker uses its own codec
     * instances; only the sealed registry is shared.
     *
     * @return number of failed images
     */
    private static int runBatch(Config config, CodecRegistry registry) {
        Path inputRoot = config.input();
        Path outputRoot = config.outputDir();

        final AtomicInteger successCount = new AtomicInteger(0);
        final AtomicInteger failCount = new AtomicInteger(0);

        ConversionObserver observer = new ConversionObserver() {
            @Override
            public void onSuccess(Path image, Path output) {
                successCount.incrementAndGet();
                log.info("Converted {} -> {}", inputRoot.relativize(image), outputRoot.relativize(output));
            }

            @Override
            public void onFailure(Path image, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(image), e.getMessage());
            }
        };
        ImageConverter converter = new ImageConverter(registry, observer);

        int coreCount = Runtime.getRuntime().availableProcessors();
        ExecutorService executor = new ThreadPoolExecutor(
                coreCount,
                coreCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * coreCount),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        try (Stream<Path> stream = Files.walk(inputRoot)) {
            stream.filter(path -> !path.startsWith(outputRoot))
                    .filter(path -> ImageFileMatcher.isSupported(path, registry))
                    .forEach(imagePath -> executor.submit(() -> {
                        MDC.put("image", imagePath.getFileName().toString());
                        try {
                            Path targetDir = outputRoot.resolve(inputRoot.relativize(imagePath.getParent()));
                            Files.createDirectories(targetDir);
                            converter.convert(imagePath, targetDir, config.format());
                        } catch (ImageCodecException e) {
                            // already reported through the observer
                            log.debug("Conversion failed", e);
                        } catch (IOException e) {
                            observer.onFailure(imagePath, e);
                        } finally {
                            MDC.clear();
                        }
                        return null;
                    }));
        } catch (UncheckedIOException e) {
            log.error("WARNING: Directory traversal interrupted - {}", e.getCause().getMessage());
            failCount.incrementAndGet();
        } catch (IOException e) {
            log.error("ERROR: Cannot traverse input directory: {}", e.getMessage());
            failCount.incrementAndGet();
        } finally {
            // Two-phase shutdown: graceful then forceful
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Batch complete: {} successful, {} failed", successCount.get(), failCount.get());
        return failCount.get();
    }

    /**
     * Execute single-file conversion with fail-fast error handling.
     *
     * @throws IOException if the input is not a supported image or conversion fails
     */
    private static void runSingleFile(Config config, CodecRegistry registry) throws IOException {
        Path input = config.input();

        if (!Files.isRegularFile(input)) {
            throw new IOException("Input path is not a file: " + input);
        }

        ImageConverter converter = new ImageConverter(registry);
        MDC.put("image", input.getFileName().toString());
        try {
            Path output = converter.convert(input, config.outputDir(), config.format());
            log.info("Conversion complete: {} -> {}", input.getFileName(), output);
        } finally {
            MDC.clear();
        }
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        CodecRegistry registry = ImageCodecs.registry();

        if (format != null) {
            format = format.startsWith(".") ? format.substring(1) : format;
            format = format.toLowerCase(Locale.ROOT);
            if (!registry.supports(format)) {
                throw new ParameterException(spec.commandLine(),
                        "Unsupported target format: " + format + " (supported: " + registry.extensions() + ")");
            }
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }

        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }

        if (inputPath.isFile() && !registry.supports(ImageFileMatcher.extensionOf(inputPath.toPath()))) {
            throw new ParameterException(spec.commandLine(),
                    "Input file is not a supported image (" + registry.extensions() + "): " + inputPath.getAbsolutePath());
        }

        if (outputDir == null) {
            if (inputPath.isFile()) {
                outputDir = new File(".");
            } else {
                outputDir = new File(inputPath, "output");
            }
        }

        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (outputDir.exists() && !outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }

        Files.createDirectories(outputDir.toPath());

        Config config = new Config(
                inputPath.toPath().toAbsolutePath().normalize(),
                outputDir.toPath().toAbsolutePath().normalize(),
                format);

        if (inputPath.isFile()) {
            runSingleFile(config, registry);
            return 0;
        }
        return runBatch(config, registry) == 0 ? 0 : 1;
    }

    /**
     * Resolved arguments for runBatch/runSingleFile.
     *
     * @param format target extension, null to keep each input's own
     */
    private record Config(Path input, Path outputDir, String format) {
    }
}

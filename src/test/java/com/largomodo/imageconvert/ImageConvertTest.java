package com.largomodo.imageconvert;

import com.largomodo.imageconvert.bmp.BitmapImage;
import com.largomodo.imageconvert.core.PixelFormat;
import com.largomodo.imageconvert.tga.TrueVisionImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParameterException;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ImageConvert CLI argument parsing and execution.
 * <p>
 * Focus: Positional parameters, smart output defaults, target format validation, exit codes.
 * Parsing tests use CommandLine.parseArgs() to populate ImageConvert fields directly.
 */
class ImageConvertTest {

    @TempDir
    Path tempDir;

    @Test
    void testPositionalParameterFile() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("test.bmp"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(testFile.toAbsolutePath().toString());

        assertEquals(testFile.toAbsolutePath().toString(), imageConvert.inputPath.getAbsolutePath());
        assertNull(imageConvert.format, "No -f keeps each input's format");
    }

    @Test
    void testFormatOption() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("test.bmp"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs("-f", "tga", testFile.toString());

        assertEquals("tga", imageConvert.format);
    }

    @Test
    void testSmartDefaultOutputForFile() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("test.bmp"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(testFile.toAbsolutePath().toString());

        assertNull(imageConvert.outputDir, "outputDir should be null until call() computes smart defaults");

        // Empty file fails to decode, after defaults are computed and before anything is written
        assertThrows(IOException.class, imageConvert::call);

        assertEquals(new File(".").getCanonicalPath(), imageConvert.outputDir.getCanonicalPath(),
                "File input should default outputDir to current directory");
    }

    @Test
    void testSmartDefaultOutputForDirectory() throws Exception {
        Path testDir = Files.createDirectory(tempDir.resolve("images"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(testDir.toAbsolutePath().toString());
        imageConvert.call();

        assertEquals(testDir.resolve("output").toFile().getCanonicalPath(), imageConvert.outputDir.getCanonicalPath(),
                "Directory input should default outputDir to input/output");
        assertTrue(Files.isDirectory(testDir.resolve("output")));
    }

    @Test
    void testExplicitOutputOverridesDefaults() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("test.bmp"));
        Path explicitOutput = tempDir.resolve("custom-output");

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(testFile.toAbsolutePath().toString(),
                "-o", explicitOutput.toAbsolutePath().toString());

        assertEquals(explicitOutput.toAbsolutePath().toString(), imageConvert.outputDir.getAbsolutePath());
    }

    @Test
    void testNonExistentInputPathThrowsException() {
        File nonExistentFile = tempDir.resolve("nonexistent.bmp").toFile();

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(nonExistentFile.getAbsolutePath());

        ParameterException exception = assertThrows(ParameterException.class, imageConvert::call);
        assertTrue(exception.getMessage().contains("Input path does not exist"));
    }

    @Test
    void testUnsupportedTargetFormatThrowsException() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("test.bmp"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs("-f", "png", testFile.toString());

        ParameterException exception = assertThrows(ParameterException.class, imageConvert::call);
        assertTrue(exception.getMessage().contains("Unsupported target format"));
    }

    @Test
    void testUnsupportedInputFileThrowsException() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("notes.txt"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(testFile.toString());

        ParameterException exception = assertThrows(ParameterException.class, imageConvert::call);
        assertTrue(exception.getMessage().contains("not a supported image"));
    }

    @Test
    void testOutputPathIsFileThrowsException() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("test.bmp"));
        Path blocker = Files.createFile(tempDir.resolve("blocker"));

        ImageConvert imageConvert = new ImageConvert();
        new CommandLine(imageConvert).parseArgs(testFile.toString(), "-o", blocker.toString());

        ParameterException exception = assertThrows(ParameterException.class, imageConvert::call);
        assertTrue(exception.getMessage().contains("must be a directory"));
    }

    @Test
    void testInvalidArgumentsExitCode() {
        int exitCode = execute("-f", "png", tempDir.toString());

        assertEquals(2, exitCode);
    }

    @Test
    void testSingleFileSameFormat() throws IOException {
        Path input = writeBmp(tempDir.resolve("photo.bmp"));
        Path out = tempDir.resolve("out");

        int exitCode = execute(input.toString(), "-o", out.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(out.resolve("photo_save.bmp")));
    }

    @Test
    void testSingleFileCrossFormat() throws IOException {
        Path input = writeBmp(tempDir.resolve("photo.bmp"));
        Path out = tempDir.resolve("out");

        int exitCode = execute(input.toString(), "-o", out.toString(), "--format", ".TGA");

        assertEquals(0, exitCode);
        TrueVisionImage tga = new TrueVisionImage();
        tga.load(out.resolve("photo.tga"));
        assertEquals(PixelFormat.RGB, tga.format());
        assertEquals(4, tga.width());
    }

    @Test
    void testCorruptFileExitCode() throws IOException {
        Path input = Files.write(tempDir.resolve("broken.bmp"), new byte[]{'B', 'M', 1, 2, 3});

        int exitCode = execute(input.toString(), "-o", tempDir.resolve("out").toString());

        assertEquals(1, exitCode);
    }

    @Test
    void testBatchPreservesDirectoryStructure() throws IOException {
        Path inputDir = Files.createDirectory(tempDir.resolve("input"));
        writeBmp(inputDir.resolve("a.bmp"));
        writeBmp(Files.createDirectory(inputDir.resolve("sub")).resolve("b.bmp"));
        Files.writeString(inputDir.resolve("notes.txt"), "ignored");

        int exitCode = execute(inputDir.toString(), "-f", "tga");

        assertEquals(0, exitCode);
        Path outputDir = inputDir.resolve("output");
        assertTrue(Files.exists(outputDir.resolve("a.tga")));
        assertTrue(Files.exists(outputDir.resolve("sub").resolve("b.tga")));
        assertFalse(Files.exists(outputDir.resolve("notes.tga")));
    }

    @Test
    void testBatchContinuesPastFailures() throws IOException {
        Path inputDir = Files.createDirectory(tempDir.resolve("input"));
        Path outputDir = tempDir.resolve("converted");
        writeBmp(inputDir.resolve("good.bmp"));
        Files.write(inputDir.resolve("bad.bmp"), new byte[10]);

        int exitCode = execute(inputDir.toString(), "-o", outputDir.toString());

        assertEquals(1, exitCode, "Any failed image makes the batch exit non-zero");
        assertTrue(Files.exists(outputDir.resolve("good_save.bmp")));
        assertFalse(Files.exists(outputDir.resolve("bad_save.bmp")));
    }

    @Test
    void testBatchSkipsItsOwnOutput() throws IOException {
        Path inputDir = Files.createDirectory(tempDir.resolve("input"));
        writeBmp(inputDir.resolve("a.bmp"));

        assertEquals(0, execute(inputDir.toString()));
        assertEquals(0, execute(inputDir.toString()));

        assertFalse(Files.exists(inputDir.resolve("output").resolve("output")),
                "Second run must not convert the first run's output");
    }

    @Test
    void testVersionFromBundle() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new ImageConvert());
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("--version");

        assertEquals(0, exitCode);
        assertFalse(out.toString().isBlank());
    }

    private static int execute(String... args) {
        CommandLine cmd = new CommandLine(new ImageConvert());
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private static Path writeBmp(Path file) throws IOException {
        BitmapImage image = new BitmapImage();
        image.setPixels(PixelFormat.RGB, 4, 2, TestImages.pattern(4, 2, 3));
        image.save(file);
        return file;
    }
}

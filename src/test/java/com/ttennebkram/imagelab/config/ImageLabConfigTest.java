package com.ttennebkram.imagelab.config;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.processing.ChainMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ImageLabConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    public void clearOverride() {
        System.clearProperty(ImageLabConfig.CONFIG_PROPERTY);
    }

    @Test
    public void testClasspathDefaults() throws IOException {
        ImageLabConfig config = ImageLabConfig.load();
        assertEquals(ChainMode.APPLY_TO_ORIGINAL, config.getChainMode());
        assertEquals(90, config.getJpegQuality());
        assertEquals(ExportFormat.PNG, config.getDefaultExportFormat());
        assertEquals(Paths.get("exports"), config.getExportDirectory());
        assertEquals(640, config.getCamera().getWidth());
        assertEquals(480, config.getCamera().getHeight());
        assertEquals(10.0, config.getCamera().getFps());
        assertTrue(config.getCamera().isMirror());
    }

    @Test
    public void testOverrideFileIsMerged() throws IOException {
        Path file = tempDir.resolve("override.json");
        Files.write(file, "{\"jpegQuality\": 50, \"chainMode\": \"APPLY_TO_PROCESSED\", \"camera\": {\"fps\": 30}}"
                .getBytes(StandardCharsets.UTF_8));
        System.setProperty(ImageLabConfig.CONFIG_PROPERTY, file.toString());

        ImageLabConfig config = ImageLabConfig.load();
        assertEquals(50, config.getJpegQuality());
        assertEquals(ChainMode.APPLY_TO_PROCESSED, config.getChainMode());
        assertEquals(30.0, config.getCamera().getFps());
        assertEquals(640, config.getCamera().getWidth());
    }

    @Test
    public void testMissingOverrideFile() {
        System.setProperty(ImageLabConfig.CONFIG_PROPERTY, tempDir.resolve("absent.json").toString());
        assertThrows(IOException.class, ImageLabConfig::load);
    }

    @Test
    public void testOutOfRangeValuesAreClamped() throws IOException {
        ImageLabConfig config = ImageLabConfig.fromJson("{\"jpegQuality\": 500, \"defaultExportFormat\": \"gif\","
                + " \"chainMode\": \"SIDEWAYS\", \"camera\": {\"width\": 0, \"index\": -3, \"fps\": 1000}}");
        assertEquals(100, config.getJpegQuality());
        assertEquals(ExportFormat.PNG, config.getDefaultExportFormat());
        assertEquals(ChainMode.APPLY_TO_ORIGINAL, config.getChainMode());
        assertEquals(1, config.getCamera().getWidth());
        assertEquals(0, config.getCamera().getIndex());
        assertEquals(60.0, config.getCamera().getFps());
        assertEquals(480, config.getCamera().getHeight());
    }

    @Test
    public void testInvalidJson() {
        assertThrows(IOException.class, () -> ImageLabConfig.fromJson("{\"jpegQuality\": "));
        assertThrows(IOException.class, () -> ImageLabConfig.fromJson("[1, 2]"));
        assertThrows(IOException.class, () -> ImageLabConfig.fromJson("{\"jpegQuality\": \"high\"}"));
    }

    @Test
    public void testAllowedFiles() throws IOException {
        ImageLabConfig config = ImageLabConfig.fromJson("{}");
        assertTrue(config.isAllowedFile("holiday.JPG"));
        assertTrue(config.isAllowedFile("scan.tiff"));
        assertFalse(config.isAllowedFile("notes.txt"));
        assertFalse(config.isAllowedFile("png"));

        ImageLabConfig restricted = ImageLabConfig.fromJson("{\"allowedExtensions\": [\"png\"]}");
        assertEquals(1, restricted.getAllowedExtensions().size());
        assertFalse(restricted.isAllowedFile("a.bmp"));
    }

    @Test
    public void testJsonRoundTrip() throws IOException {
        ImageLabConfig config = ImageLabConfig.fromJson("{\"jpegQuality\": 42}");
        assertEquals(42, ImageLabConfig.fromJson(config.toJson()).getJpegQuality());
    }
}

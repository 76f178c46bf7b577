package com.ttennebkram.imagelab.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.imagelab.errors.UnsupportedFormatException;
import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.processing.ChainMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application settings.
 *
 * Defaults come from {@code imagelab.json} on the classpath. A file named by the
 * {@code imagelab.config} system property overrides individual keys. Values out of
 * range are clamped with a warning rather than rejected.
 */
public class ImageLabConfig {

    private static final Logger logger = LoggerFactory.getLogger(ImageLabConfig.class);

    public static final String RESOURCE = "imagelab.json";
    public static final String CONFIG_PROPERTY = "imagelab.config";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private ChainMode chainMode = ChainMode.APPLY_TO_ORIGINAL;
    private int jpegQuality = 90;
    private String defaultExportFormat = "png";
    private String exportDirectory = "exports";
    private List<String> allowedExtensions = new ArrayList<>(Arrays.asList("png", "jpg", "jpeg", "bmp", "tif", "tiff"));
    private Camera camera = new Camera();

    /**
     * Camera settings for the preview loop.
     */
    public static class Camera {
        private int index = 0;
        private int width = 640;
        private int height = 480;
        private double fps = 10.0;
        private boolean mirror = true;

        public int getIndex() {
            return index;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }

        public double getFps() {
            return fps;
        }

        public boolean isMirror() {
            return mirror;
        }
    }

    /**
     * Classpath defaults plus the optional override file.
     *
     * @throws IOException if the override file cannot be read or is not valid JSON
     */
    public static ImageLabConfig load() throws IOException {
        JsonObject merged = new JsonObject();
        try (InputStream in = ImageLabConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.warn("{} not found on the classpath, using built-in defaults", RESOURCE);
            } else {
                merge(merged, parse(new InputStreamReader(in, StandardCharsets.UTF_8), RESOURCE));
            }
        }

        String overridePath = System.getProperty(CONFIG_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            Path path = Paths.get(overridePath);
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                merge(merged, parse(reader, path.toString()));
            }
            logger.info("Configuration overridden from {}", path);
        }
        return fromJson(merged);
    }

    /**
     * Settings from a JSON document; keys that are absent keep their defaults.
     *
     * @throws IOException if the text is not a JSON object
     */
    public static ImageLabConfig fromJson(String json) throws IOException {
        return fromJson(parse(new java.io.StringReader(json), "configuration"));
    }

    private static ImageLabConfig fromJson(JsonObject json) throws IOException {
        ImageLabConfig config;
        try {
            config = GSON.fromJson(json, ImageLabConfig.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new ImageLabConfig();
        }
        config.validate();
        return config;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private static JsonObject parse(Reader reader, String source) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new IOException("Invalid configuration in " + source + ": not a JSON object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copy the keys of overrides onto base, merging nested objects.
     */
    private static void merge(JsonObject base, JsonObject overrides) {
        for (Map.Entry<String, JsonElement> entry : overrides.entrySet()) {
            JsonElement existing = base.get(entry.getKey());
            if (existing != null && existing.isJsonObject() && entry.getValue().isJsonObject()) {
                merge(existing.getAsJsonObject(), entry.getValue().getAsJsonObject());
            } else {
                base.add(entry.getKey(), entry.getValue());
            }
        }
    }

    private void validate() {
        if (chainMode == null) {
            logger.warn("Unknown chainMode, using {}", ChainMode.APPLY_TO_ORIGINAL);
            chainMode = ChainMode.APPLY_TO_ORIGINAL;
        }
        jpegQuality = clamp("jpegQuality", jpegQuality, 1, 100);
        try {
            ExportFormat.fromName(defaultExportFormat);
        } catch (UnsupportedFormatException e) {
            logger.warn("{}, using png", e.getMessage());
            defaultExportFormat = "png";
        }
        if (exportDirectory == null || exportDirectory.isBlank()) {
            exportDirectory = "exports";
        }
        if (allowedExtensions == null || allowedExtensions.isEmpty()) {
            logger.warn("No allowedExtensions configured, using defaults");
            allowedExtensions = new ArrayList<>(Arrays.asList("png", "jpg", "jpeg", "bmp", "tif", "tiff"));
        }
        if (camera == null) {
            camera = new Camera();
        }
        camera.index = clamp("camera.index", camera.index, 0, 99);
        camera.width = clamp("camera.width", camera.width, 1, 7680);
        camera.height = clamp("camera.height", camera.height, 1, 4320);
        if (!(camera.fps >= 0.1 && camera.fps <= 60.0)) {
            double clamped = Double.isNaN(camera.fps) ? 10.0 : Math.max(0.1, Math.min(60.0, camera.fps));
            logger.warn("camera.fps {} out of range, using {}", camera.fps, clamped);
            camera.fps = clamped;
        }
    }

    private static int clamp(String key, int value, int min, int max) {
        if (value < min || value > max) {
            int clamped = Math.max(min, Math.min(max, value));
            logger.warn("{} {} out of range [{}, {}], using {}", key, value, min, max, clamped);
            return clamped;
        }
        return value;
    }

    public ChainMode getChainMode() {
        return chainMode;
    }

    public int getJpegQuality() {
        return jpegQuality;
    }

    public ExportFormat getDefaultExportFormat() {
        return ExportFormat.fromName(defaultExportFormat);
    }

    public Path getExportDirectory() {
        return Paths.get(exportDirectory);
    }

    public List<String> getAllowedExtensions() {
        return List.copyOf(allowedExtensions);
    }

    /**
     * Whether a file name has one of the allowed upload extensions.
     */
    public boolean isAllowedFile(String fileName) {
        int dot = fileName == null ? -1 : fileName.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (String allowed : allowedExtensions) {
            if (allowed.equalsIgnoreCase(ext)) {
                return true;
            }
        }
        return false;
    }

    public Camera getCamera() {
        return camera;
    }
}

package com.ttennebkram.imagelab.export;

import com.ttennebkram.imagelab.errors.UnsupportedFormatException;

import java.util.Locale;

/**
 * Container formats the exporter can write.
 */
public enum ExportFormat {
    PNG(".png", "image/png", false),
    JPEG(".jpg", "image/jpeg", true),
    BMP(".bmp", "image/bmp", false);

    private final String extension;
    private final String mimeType;
    private final boolean lossy;

    ExportFormat(String extension, String mimeType, boolean lossy) {
        this.extension = extension;
        this.mimeType = mimeType;
        this.lossy = lossy;
    }

    /**
     * File extension including the dot, as passed to Imgcodecs.
     */
    public String getExtension() {
        return extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * Whether a quality value applies.
     */
    public boolean isLossy() {
        return lossy;
    }

    /**
     * Parse a format name or extension: png, jpg, jpeg or bmp, any case, with or without a dot.
     *
     * @throws UnsupportedFormatException for anything else
     */
    public static ExportFormat fromName(String name) {
        if (name == null) {
            throw new UnsupportedFormatException("null");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith(".")) {
            key = key.substring(1);
        }
        switch (key) {
            case "png":
                return PNG;
            case "jpg":
            case "jpeg":
                return JPEG;
            case "bmp":
                return BMP;
            default:
                throw new UnsupportedFormatException(name);
        }
    }
}

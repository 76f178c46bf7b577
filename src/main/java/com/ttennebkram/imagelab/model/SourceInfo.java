package com.ttennebkram.imagelab.model;

import java.util.Locale;

/**
 * Metadata about an uploaded file, reported as-is.
 */
public final class SourceInfo {

    private final String fileName;
    private final String mimeType;
    private final long byteLength;

    public SourceInfo(String fileName, String mimeType, long byteLength) {
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.byteLength = byteLength;
    }

    public String getFileName() {
        return fileName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public long getByteLength() {
        return byteLength;
    }

    /**
     * Short format label taken from the type string, e.g. "image/png" becomes "PNG".
     * Falls back to the file extension when no type was supplied.
     */
    public String getFormatLabel() {
        String source = mimeType;
        if (source == null || source.isBlank()) {
            source = fileName;
            if (source == null) {
                return "UNKNOWN";
            }
            int dot = source.lastIndexOf('.');
            source = dot >= 0 ? source.substring(dot + 1) : source;
        }
        int slash = source.lastIndexOf('/');
        return source.substring(slash + 1).toUpperCase(Locale.ROOT);
    }

    /**
     * Guess the type string from a file name extension.
     */
    public static SourceInfo forFile(String fileName, long byteLength) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        String mime;
        if (lower.endsWith(".png")) {
            mime = "image/png";
        } else if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            mime = "image/jpeg";
        } else if (lower.endsWith(".bmp")) {
            mime = "image/bmp";
        } else if (lower.endsWith(".tif") || lower.endsWith(".tiff")) {
            mime = "image/tiff";
        } else {
            mime = null;
        }
        return new SourceInfo(fileName, mime, byteLength);
    }

    @Override
    public String toString() {
        return "SourceInfo[" + fileName + ", " + mimeType + ", " + byteLength + " bytes]";
    }
}

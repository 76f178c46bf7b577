package com.ttennebkram.imagelab.export;

/**
 * Bytes of an encoded image together with their container format.
 */
public final class EncodedImage {

    private final ExportFormat format;
    private final byte[] bytes;

    public EncodedImage(ExportFormat format, byte[] bytes) {
        this.format = format;
        this.bytes = bytes.clone();
    }

    public ExportFormat getFormat() {
        return format;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return format + " (" + bytes.length + " bytes)";
    }
}

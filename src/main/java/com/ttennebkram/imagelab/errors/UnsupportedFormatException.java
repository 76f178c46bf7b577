package com.ttennebkram.imagelab.errors;

/**
 * Export format outside PNG, JPEG and BMP.
 */
public class UnsupportedFormatException extends ImageLabException {

    public UnsupportedFormatException(String format) {
        super("Unsupported export format: " + format);
    }
}

package com.ttennebkram.imagelab.errors;

/**
 * The codec failed to encode an image buffer.
 */
public class EncodeException extends ImageLabException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

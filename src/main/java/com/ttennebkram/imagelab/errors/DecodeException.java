package com.ttennebkram.imagelab.errors;

/**
 * Uploaded bytes could not be decoded into an image.
 */
public class DecodeException extends ImageLabException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

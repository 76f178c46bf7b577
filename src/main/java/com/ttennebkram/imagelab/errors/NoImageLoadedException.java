package com.ttennebkram.imagelab.errors;

/**
 * An operation needed an image that has not been loaded.
 */
public class NoImageLoadedException extends ImageLabException {

    public NoImageLoadedException(String message) {
        super(message);
    }

    public NoImageLoadedException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ttennebkram.imagelab.errors;

/**
 * Base class for every failure the image pipeline reports to its caller.
 * All subclasses are unchecked; none of them is transient, so callers show the
 * message rather than retry.
 */
public abstract class ImageLabException extends RuntimeException {

    protected ImageLabException(String message) {
        super(message);
    }

    protected ImageLabException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ttennebkram.imagelab.errors;

/**
 * The input layout is incompatible with an operation and no coercion path exists.
 */
public class UnsupportedChannelCountException extends ImageLabException {

    public UnsupportedChannelCountException(String message) {
        super(message);
    }

    public UnsupportedChannelCountException(String message, Throwable cause) {
        super(message, cause);
    }
}

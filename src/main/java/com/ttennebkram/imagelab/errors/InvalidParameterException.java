package com.ttennebkram.imagelab.errors;

/**
 * A parameter value could not be resolved against its declaration.
 */
public class InvalidParameterException extends ImageLabException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}

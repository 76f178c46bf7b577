package com.ttennebkram.imagelab.errors;

/**
 * An operation has nothing to work with, e.g. stretching the contrast of a constant image.
 * The dispatcher recovers from this by returning the input unchanged.
 */
public class DegenerateInputException extends ImageLabException {

    public DegenerateInputException(String message) {
        super(message);
    }
}

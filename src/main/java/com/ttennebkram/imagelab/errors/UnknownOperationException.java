package com.ttennebkram.imagelab.errors;

/**
 * Thrown when a (category, name) pair is not in the catalog.
 */
public class UnknownOperationException extends ImageLabException {

    public UnknownOperationException(String category, String name) {
        super("Unknown operation: " + category + " / " + name);
    }

    public UnknownOperationException(String message) {
        super(message);
    }
}

package com.ttennebkram.imagelab.errors;

public class DuplicateOperationException extends ImageLabException {

    public DuplicateOperationException(String category, String name) {
        super("Operation already registered: " + category + " / " + name);
    }
}

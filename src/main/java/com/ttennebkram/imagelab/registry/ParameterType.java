package com.ttennebkram.imagelab.registry;

public enum ParameterType {
    /** Whole number, rounded half-up and clamped. */
    INTEGER,
    /** Floating point value, clamped. */
    DECIMAL,
    /** Odd whole number of at least 1, as OpenCV kernels require. */
    KERNEL_SIZE,
    /** One of a fixed list of labels. */
    CHOICE
}

package com.ttennebkram.imagelab.processing;

/**
 * What a newly applied operation works on.
 */
public enum ChainMode {
    /** Each operation recomputes from the original image, replacing the previous result. */
    APPLY_TO_ORIGINAL,
    /** Each operation is applied to the previous result, building a chain. */
    APPLY_TO_PROCESSED
}

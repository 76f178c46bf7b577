package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;

/**
 * Base class for edge detectors. They are declared GRAY8-only, so the dispatcher
 * hands them a grayscale derivation of color input, and their result is GRAY8.
 */
public abstract class EdgeOperation extends OperationBase {

    @Override
    public PixelFormat outputFormat(PixelFormat inputFormat) {
        return PixelFormat.GRAY8;
    }
}

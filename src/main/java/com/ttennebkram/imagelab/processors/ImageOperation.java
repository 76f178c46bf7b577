package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.List;

/**
 * A single image transform backed by OpenCV.
 * Each operation declares:
 * - Its parameter contract (bounds, defaults)
 * - The processing logic (OpenCV calls)
 * - The pixel format of its result
 *
 * Operations hold no state between calls, so one instance serves every invocation.
 */
public interface ImageOperation {

    /**
     * Declared parameters, in the order they are presented to the user.
     */
    default List<ParameterSpec> getParameters() {
        return Collections.emptyList();
    }

    /**
     * Process an input image and return the result.
     *
     * @param input The input Mat, 8-bit, in the layout of the (coerced) input format.
     *              Do not modify or release.
     * @param params Resolved parameter values
     * @return A new 8-bit Mat (caller will release)
     */
    Mat process(Mat input, OperationParams params);

    /**
     * Pixel format of the result for a given input format.
     * Default: unchanged.
     */
    default PixelFormat outputFormat(PixelFormat inputFormat) {
        return inputFormat;
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Base class for operations that combine the image with a second operand.
 *
 * The dispatcher has already converted the second operand to the first one's
 * pixel format. Sizes may still differ: the second operand is always resized
 * to the first, never the reverse, so the result has the first image's size.
 */
public abstract class DualInputOperation extends OperationBase {

    /**
     * Combine two Mats of identical size and type.
     *
     * @return a new Mat; neither input may be modified or released
     */
    protected abstract Mat combine(Mat first, Mat second, OperationParams params);

    /**
     * Process two input images.
     *
     * @param first The primary image (not modified or released)
     * @param second The second operand, same format as first
     */
    public final Mat processDual(Mat first, Mat second, OperationParams params) {
        if (isInvalidInput(first)) {
            return first;
        }
        if (isInvalidInput(second)) {
            return first.clone();
        }
        if (first.size().equals(second.size())) {
            return combine(first, second, params);
        }
        Mat resized = new Mat();
        Imgproc.resize(second, resized, new Size(first.cols(), first.rows()));
        try {
            return combine(first, resized, params);
        } finally {
            resized.release();
        }
    }

    /**
     * Not used: dual-input operations are run through {@link #processDual}.
     */
    @Override
    public Mat process(Mat input, OperationParams params) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " needs a second image");
    }
}

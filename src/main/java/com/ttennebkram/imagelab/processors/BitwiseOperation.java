package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Mat;

/**
 * Base class for two-operand bitwise combinations. They take no parameters.
 */
public abstract class BitwiseOperation extends DualInputOperation {

    /**
     * Apply the Core.bitwise_* call for this operation.
     */
    protected abstract void bitwise(Mat first, Mat second, Mat dst);

    @Override
    protected Mat combine(Mat first, Mat second, OperationParams params) {
        Mat output = new Mat();
        bitwise(first, second, output);
        return output;
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Inverts every bit of the image. Single operand.
 */
@OperationInfo(
    name = "NOT",
    category = Category.BITWISE,
    order = 40,
    description = "Invert all bits\nCore.bitwise_not(src, dst)"
)
public class BitwiseNotOperation extends OperationBase {

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat output = new Mat();
        Core.bitwise_not(input, output);
        return output;
    }
}

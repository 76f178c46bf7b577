package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.core.Core;
import org.opencv.core.Mat;

@OperationInfo(
    name = "OR",
    category = Category.BITWISE,
    order = 20,
    dualInput = true,
    description = "Bits set in either image\nCore.bitwise_or(src1, src2, dst)"
)
public class BitwiseOrOperation extends BitwiseOperation {

    @Override
    protected void bitwise(Mat first, Mat second, Mat dst) {
        Core.bitwise_or(first, second, dst);
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.core.Core;
import org.opencv.core.Mat;

@OperationInfo(
    name = "AND",
    category = Category.BITWISE,
    order = 10,
    dualInput = true,
    description = "Bits set in both images\nCore.bitwise_and(src1, src2, dst)"
)
public class BitwiseAndOperation extends BitwiseOperation {

    @Override
    protected void bitwise(Mat first, Mat second, Mat dst) {
        Core.bitwise_and(first, second, dst);
    }
}

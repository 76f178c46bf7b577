package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.core.Core;
import org.opencv.core.Mat;

@OperationInfo(
    name = "XOR",
    category = Category.BITWISE,
    order = 30,
    dualInput = true,
    description = "Bits set in exactly one image\nCore.bitwise_xor(src1, src2, dst)"
)
public class BitwiseXorOperation extends BitwiseOperation {

    @Override
    protected void bitwise(Mat first, Mat second, Mat dst) {
        Core.bitwise_xor(first, second, dst);
    }
}

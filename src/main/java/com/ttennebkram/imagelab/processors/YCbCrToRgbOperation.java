package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "YCbCr to RGB",
    category = Category.COLOR,
    order = 31,
    inputFormats = PixelFormat.YCBCR8,
    description = "Imgproc.cvtColor(src, dst, COLOR_YCrCb2RGB)"
)
public class YCbCrToRgbOperation extends ColorConversionOperation {

    public YCbCrToRgbOperation() {
        super(Imgproc.COLOR_YCrCb2RGB, PixelFormat.RGB8);
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat ycrcb = swapLastTwoChannels(input);
        Mat output = super.process(ycrcb, params);
        ycrcb.release();
        return output;
    }
}

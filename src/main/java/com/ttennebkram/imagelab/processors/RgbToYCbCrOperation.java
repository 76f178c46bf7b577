package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * OpenCV produces Y, Cr, Cb; the result is reordered to Y, Cb, Cr.
 */
@OperationInfo(
    name = "RGB to YCbCr",
    category = Category.COLOR,
    order = 30,
    inputFormats = PixelFormat.RGB8,
    description = "Luma and chroma differences\nImgproc.cvtColor(src, dst, COLOR_RGB2YCrCb)"
)
public class RgbToYCbCrOperation extends ColorConversionOperation {

    public RgbToYCbCrOperation() {
        super(Imgproc.COLOR_RGB2YCrCb, PixelFormat.YCBCR8);
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat ycrcb = super.process(input, params);
        Mat output = swapLastTwoChannels(ycrcb);
        ycrcb.release();
        return output;
    }
}

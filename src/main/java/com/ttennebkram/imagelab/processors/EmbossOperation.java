package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

/**
 * Relief effect. Flat areas land on mid gray (their value plus 128, saturated).
 */
@OperationInfo(
    name = "Emboss",
    category = Category.FILTER,
    order = 40,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Emboss with a diagonal 3x3 kernel\nImgproc.filter2D(src, dst, -1, kernel, anchor, 128)"
)
public class EmbossOperation extends OperationBase {

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat kernel = new Mat(3, 3, CvType.CV_32F);
        kernel.put(0, 0,
                -2, -1, 0,
                -1, 1, 1,
                0, 1, 2);

        Mat output = new Mat();
        Imgproc.filter2D(input, output, -1, kernel, new Point(-1, -1), 128);
        kernel.release();
        return output;
    }
}

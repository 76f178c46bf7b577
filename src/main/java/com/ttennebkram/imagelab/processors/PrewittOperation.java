package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Prewitt gradient magnitude, saturated to 8 bits.
 */
@OperationInfo(
    name = "Prewitt",
    category = Category.EDGE,
    order = 40,
    inputFormats = PixelFormat.GRAY8,
    description = "Prewitt gradient magnitude\nImgproc.filter2D with [[1,0,-1]]-style kernels + Core.magnitude"
)
public class PrewittOperation extends EdgeOperation {

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat kernelX = new Mat(3, 3, CvType.CV_32F);
        kernelX.put(0, 0,
                1, 0, -1,
                1, 0, -1,
                1, 0, -1);
        Mat kernelY = new Mat(3, 3, CvType.CV_32F);
        kernelY.put(0, 0,
                1, 1, 1,
                0, 0, 0,
                -1, -1, -1);

        Mat gradX = new Mat();
        Mat gradY = new Mat();
        Imgproc.filter2D(input, gradX, CvType.CV_32F, kernelX);
        Imgproc.filter2D(input, gradY, CvType.CV_32F, kernelY);

        Mat magnitude = new Mat();
        Core.magnitude(gradX, gradY, magnitude);

        Mat output = new Mat();
        magnitude.convertTo(output, CvType.CV_8U);

        kernelX.release();
        kernelY.release();
        gradX.release();
        gradY.release();
        magnitude.release();
        return output;
    }
}

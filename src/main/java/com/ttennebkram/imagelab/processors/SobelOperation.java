package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Sobel derivative. With both dx and dy set, the absolute gradients are averaged.
 */
@OperationInfo(
    name = "Sobel",
    category = Category.EDGE,
    order = 10,
    inputFormats = PixelFormat.GRAY8,
    description = "Sobel derivatives\nImgproc.Sobel(src, dst, CV_16S, dx, dy, ksize)"
)
public class SobelOperation extends EdgeOperation {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.kernelSize("kernelSize", 7, 3),
            ParameterSpec.integer("dx", "X Order", 0, 2, 1),
            ParameterSpec.integer("dy", "Y Order", 0, 2, 1));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int ksize = params.getInt("kernelSize");
        int dx = params.getInt("dx");
        int dy = params.getInt("dy");

        // Ensure dx + dy >= 1
        if (dx + dy < 1) {
            dx = 1;
        }

        Mat output = new Mat();
        if (dx > 0 && dy > 0) {
            Mat gradX = new Mat();
            Mat gradY = new Mat();
            Imgproc.Sobel(input, gradX, CvType.CV_16S, dx, 0, ksize);
            Imgproc.Sobel(input, gradY, CvType.CV_16S, 0, dy, ksize);
            Core.convertScaleAbs(gradX, gradX);
            Core.convertScaleAbs(gradY, gradY);
            Core.addWeighted(gradX, 0.5, gradY, 0.5, 0, output);
            gradX.release();
            gradY.release();
        } else {
            Mat grad = new Mat();
            Imgproc.Sobel(input, grad, CvType.CV_16S, dx, dy, ksize);
            Core.convertScaleAbs(grad, output);
            grad.release();
        }
        return output;
    }
}

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

@OperationInfo(
    name = "Laplacian",
    category = Category.EDGE,
    order = 20,
    inputFormats = PixelFormat.GRAY8,
    description = "Absolute Laplacian\nImgproc.Laplacian(src, dst, CV_16S, ksize) + convertScaleAbs"
)
public class LaplacianOperation extends EdgeOperation {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.kernelSize("kernelSize", 7, 3));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat laplacian = new Mat();
        Imgproc.Laplacian(input, laplacian, CvType.CV_16S, params.getInt("kernelSize"));

        Mat output = new Mat();
        Core.convertScaleAbs(laplacian, output);
        laplacian.release();
        return output;
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Canny edge detector. Output pixels are 0 or 255.
 */
@OperationInfo(
    name = "Canny",
    displayName = "Canny Edges",
    category = Category.EDGE,
    order = 30,
    inputFormats = PixelFormat.GRAY8,
    description = "Canny edge detection\nImgproc.Canny(src, dst, threshold1, threshold2, apertureSize)"
)
public class CannyEdgeOperation extends EdgeOperation {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.integer("threshold1", "Threshold 1", 0, 500, 100),
            ParameterSpec.integer("threshold2", "Threshold 2", 0, 500, 200),
            ParameterSpec.choice("apertureSize", "Aperture Size", "3", "3", "5", "7"));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int apertureSize = Integer.parseInt(params.getString("apertureSize"));

        Mat output = new Mat();
        Imgproc.Canny(input, output, params.getInt("threshold1"), params.getInt("threshold2"), apertureSize, false);
        return output;
    }
}

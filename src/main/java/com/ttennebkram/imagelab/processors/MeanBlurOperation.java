package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Mean (box) blur.
 */
@OperationInfo(
    name = "Mean",
    displayName = "Mean Blur",
    category = Category.FILTER,
    order = 10,
    description = "Average over a square kernel\nImgproc.blur(src, dst, ksize)"
)
public class MeanBlurOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.kernelSize("kernelSize", 31, 3));

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
        Mat output = new Mat();
        Imgproc.blur(input, output, new Size(ksize, ksize));
        return output;
    }
}

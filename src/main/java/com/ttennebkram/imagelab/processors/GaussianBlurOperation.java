package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Gaussian blur. A sigma of 0 lets OpenCV derive it from the kernel size.
 */
@OperationInfo(
    name = "Gaussian",
    displayName = "Gaussian Blur",
    category = Category.FILTER,
    order = 20,
    description = "Gaussian blur\nImgproc.GaussianBlur(src, dst, ksize, sigma)"
)
public class GaussianBlurOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.kernelSize("kernelSize", 31, 5),
            ParameterSpec.decimal("sigma", "Sigma (0 = auto)", 0, 10, 0));

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
        Imgproc.GaussianBlur(input, output, new Size(ksize, ksize), params.getDouble("sigma"));
        return output;
    }
}

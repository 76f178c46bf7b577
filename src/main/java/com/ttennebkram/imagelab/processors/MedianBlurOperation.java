package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

@OperationInfo(
    name = "Median",
    displayName = "Median Blur",
    category = Category.FILTER,
    order = 30,
    description = "Median of each neighborhood\nImgproc.medianBlur(src, dst, ksize)"
)
public class MedianBlurOperation extends OperationBase {

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
        Mat output = new Mat();
        Imgproc.medianBlur(input, output, params.getInt("kernelSize"));
        return output;
    }
}

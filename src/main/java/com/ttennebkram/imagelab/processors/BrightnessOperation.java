package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;

import java.util.List;

@OperationInfo(
    name = "Brightness",
    category = Category.ENHANCEMENT,
    order = 40,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Add a constant, saturating at 0 and 255\nMat.convertTo(dst, -1, 1.0, offset)"
)
public class BrightnessOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.integer("offset", "Offset", -100, 100, 0));

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
        input.convertTo(output, -1, 1.0, params.getInt("offset"));
        return output;
    }
}

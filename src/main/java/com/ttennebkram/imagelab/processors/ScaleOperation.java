package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Resize by independent horizontal and vertical factors.
 * Output is round(width * fx) x round(height * fy), at least 1x1.
 */
@OperationInfo(
    name = "Scale",
    category = Category.GEOMETRIC,
    order = 20,
    description = "Resize by factors\nImgproc.resize(src, dst, dsize, 0, 0, interpolation)"
)
public class ScaleOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.decimal("fx", "Scale X", 0.1, 5.0, 1.0),
            ParameterSpec.decimal("fy", "Scale Y", 0.1, 5.0, 1.0),
            ParameterSpec.choice("interpolation", "Interpolation", INTERPOLATION_NAMES[0], INTERPOLATION_NAMES));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int width = Math.max(1, (int) Math.round(input.cols() * params.getDouble("fx")));
        int height = Math.max(1, (int) Math.round(input.rows() * params.getDouble("fy")));

        Mat output = new Mat();
        Imgproc.resize(input, output, new Size(width, height), 0, 0,
                interpolation(params.getString("interpolation")));
        return output;
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Rotation about a point, keeping the canvas size.
 * Positive angles rotate counter-clockwise, as in OpenCV.
 */
@OperationInfo(
    name = "Rotate",
    category = Category.GEOMETRIC,
    order = 10,
    description = "Rotation and uniform scale about a center\nImgproc.getRotationMatrix2D(center, angle, scale) + warpAffine"
)
public class RotateOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.decimal("angle", "Angle", -180, 180, 0),
            ParameterSpec.decimal("scale", "Scale", 0.1, 5.0, 1.0),
            ParameterSpec.decimal("centerX", "Center X (fraction of width)", 0, 1, 0.5),
            ParameterSpec.decimal("centerY", "Center Y (fraction of height)", 0, 1, 0.5),
            borderModeParameter());

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        double angle = params.getDouble("angle");
        double scale = params.getDouble("scale");

        // Identity: copy exactly rather than resample
        if (angle == 0.0 && scale == 1.0) {
            return input.clone();
        }

        Point center = new Point(params.getDouble("centerX") * input.cols(),
                params.getDouble("centerY") * input.rows());
        Mat matrix = Imgproc.getRotationMatrix2D(center, angle, scale);

        Mat output = new Mat();
        Imgproc.warpAffine(input, output, matrix, input.size(), Imgproc.INTER_LINEAR,
                borderMode(params.getString("borderMode")), Scalar.all(0));
        matrix.release();
        return output;
    }
}

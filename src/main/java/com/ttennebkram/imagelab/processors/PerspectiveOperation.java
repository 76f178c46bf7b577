package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

@OperationInfo(
    name = "Perspective",
    category = Category.GEOMETRIC,
    order = 50,
    description = "Perspective warp from four point pairs\nImgproc.getPerspectiveTransform(src, dst) + warpPerspective"
)
public class PerspectiveOperation extends PointWarpOperation {

    private static final List<ParameterSpec> PARAMETERS;

    static {
        List<ParameterSpec> params = new ArrayList<>(pointParameters(new double[][] {
            {10, 10, 5, 5},
            {90, 10, 95, 10},
            {90, 90, 95, 95},
            {10, 90, 5, 90}
        }));
        params.add(borderModeParameter());
        PARAMETERS = List.copyOf(params);
    }

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Point[] src = points(params, "src", 4, input.cols(), input.rows());
        Point[] dst = points(params, "dst", 4, input.cols(), input.rows());
        requireNonCollinear(src, "Source");
        requireNonCollinear(dst, "Target");

        MatOfPoint2f srcMat = toMat(src);
        MatOfPoint2f dstMat = toMat(dst);
        Mat matrix = Imgproc.getPerspectiveTransform(srcMat, dstMat);

        Mat output = new Mat();
        Imgproc.warpPerspective(input, output, matrix, input.size(), Imgproc.INTER_LINEAR,
                borderMode(params.getString("borderMode")), Scalar.all(0));

        srcMat.release();
        dstMat.release();
        matrix.release();
        return output;
    }
}

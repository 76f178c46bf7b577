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
    name = "Affine",
    category = Category.GEOMETRIC,
    order = 40,
    description = "Affine warp from three point pairs\nImgproc.getAffineTransform(src, dst) + warpAffine"
)
public class AffineOperation extends PointWarpOperation {

    private static final List<ParameterSpec> PARAMETERS;

    static {
        List<ParameterSpec> params = new ArrayList<>(pointParameters(new double[][] {
            {10, 10, 10, 20},
            {90, 10, 85, 10},
            {10, 90, 20, 90}
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
        Point[] src = points(params, "src", 3, input.cols(), input.rows());
        Point[] dst = points(params, "dst", 3, input.cols(), input.rows());
        requireNonCollinear(src, "Source");

        MatOfPoint2f srcMat = toMat(src);
        MatOfPoint2f dstMat = toMat(dst);
        Mat matrix = Imgproc.getAffineTransform(srcMat, dstMat);

        Mat output = new Mat();
        Imgproc.warpAffine(input, output, matrix, input.size(), Imgproc.INTER_LINEAR,
                borderMode(params.getString("borderMode")), Scalar.all(0));

        srcMat.release();
        dstMat.release();
        matrix.release();
        return output;
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

@OperationInfo(
    name = "Translate",
    category = Category.GEOMETRIC,
    order = 30,
    description = "Shift by whole pixels, keeping the canvas size\nImgproc.warpAffine(src, dst, [[1,0,tx],[0,1,ty]], dsize)"
)
public class TranslateOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.integer("tx", "Shift X", -2000, 2000, 0),
            ParameterSpec.integer("ty", "Shift Y", -2000, 2000, 0),
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
        int tx = params.getInt("tx");
        int ty = params.getInt("ty");
        if (tx == 0 && ty == 0) {
            return input.clone();
        }

        Mat matrix = new Mat(2, 3, CvType.CV_64F);
        matrix.put(0, 0, 1, 0, tx, 0, 1, ty);

        Mat output = new Mat();
        Imgproc.warpAffine(input, output, matrix, input.size(), Imgproc.INTER_LINEAR,
                borderMode(params.getString("borderMode")), Scalar.all(0));
        matrix.release();
        return output;
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Laplacian sharpening with an adjustable amount.
 * An amount of 1 gives the classic [[0,-1,0],[-1,5,-1],[0,-1,0]] kernel.
 */
@OperationInfo(
    name = "Sharpen",
    category = Category.ENHANCEMENT,
    order = 30,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Sharpen with a 3x3 kernel\nImgproc.filter2D(src, dst, -1, kernel)"
)
public class SharpenOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.decimal("amount", "Amount", 0.1, 3.0, 1.0));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        double a = params.getDouble("amount");
        Mat kernel = new Mat(3, 3, CvType.CV_32F);
        kernel.put(0, 0,
                0, -a, 0,
                -a, 1 + 4 * a, -a,
                0, -a, 0);

        Mat output = new Mat();
        Imgproc.filter2D(input, output, -1, kernel);
        kernel.release();
        return output;
    }
}

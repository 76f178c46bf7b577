package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Warm brown tone. Each output channel is a weighted sum of R, G and B,
 * saturated to 255.
 */
@OperationInfo(
    name = "Sepia",
    category = Category.COLOR,
    order = 60,
    inputFormats = PixelFormat.RGB8,
    description = "Sepia tone\nCore.transform(src, dst, sepiaMatrix)"
)
public class SepiaOperation extends OperationBase {

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        // Rows produce R, G, B
        Mat matrix = new Mat(3, 3, CvType.CV_32F);
        matrix.put(0, 0,
                0.393, 0.769, 0.189,
                0.349, 0.686, 0.168,
                0.272, 0.534, 0.131);

        Mat output = new Mat();
        Core.transform(input, output, matrix);
        matrix.release();
        return output;
    }
}

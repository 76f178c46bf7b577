package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Grayscale conversion computed pixel by pixel.
 * Uses the same 14-bit fixed point BT.601 weights as OpenCV, so results match
 * {@link RgbToGrayscaleOperation}.
 */
@OperationInfo(
    name = "RGB to Grayscale (Manual)",
    category = Category.COLOR,
    order = 50,
    inputFormats = PixelFormat.RGB8,
    description = "Y = (4899 R + 9617 G + 1868 B + 8192) >> 14"
)
public class ManualGrayscaleOperation extends OperationBase {

    private static final int R_WEIGHT = 4899;
    private static final int G_WEIGHT = 9617;
    private static final int B_WEIGHT = 1868;
    private static final int SHIFT = 14;

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int pixels = input.rows() * input.cols();
        byte[] rgb = new byte[pixels * 3];
        input.get(0, 0, rgb);

        byte[] gray = new byte[pixels];
        for (int i = 0, j = 0; i < pixels; i++, j += 3) {
            int r = rgb[j] & 0xFF;
            int g = rgb[j + 1] & 0xFF;
            int b = rgb[j + 2] & 0xFF;
            gray[i] = (byte) ((r * R_WEIGHT + g * G_WEIGHT + b * B_WEIGHT + (1 << (SHIFT - 1))) >> SHIFT);
        }

        Mat output = new Mat(input.rows(), input.cols(), CvType.CV_8UC1);
        output.put(0, 0, gray);
        return output;
    }

    @Override
    public PixelFormat outputFormat(PixelFormat inputFormat) {
        return PixelFormat.GRAY8;
    }
}

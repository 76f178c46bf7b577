package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * HSV conversion computed pixel by pixel with OpenCV's 8-bit ranges.
 * Hue may differ from {@link RgbToHsvOperation} by one step because OpenCV
 * rounds through lookup tables.
 */
@OperationInfo(
    name = "RGB to HSV (Manual)",
    category = Category.COLOR,
    order = 51,
    inputFormats = PixelFormat.RGB8,
    description = "H = hue / 2, S = 255 (max - min) / max, V = max"
)
public class ManualHsvOperation extends OperationBase {

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int pixels = input.rows() * input.cols();
        byte[] rgb = new byte[pixels * 3];
        input.get(0, 0, rgb);

        byte[] hsv = new byte[pixels * 3];
        for (int j = 0; j < rgb.length; j += 3) {
            int r = rgb[j] & 0xFF;
            int g = rgb[j + 1] & 0xFF;
            int b = rgb[j + 2] & 0xFF;
            int max = Math.max(r, Math.max(g, b));
            int min = Math.min(r, Math.min(g, b));
            int delta = max - min;

            double hue = 0;
            if (delta != 0) {
                if (max == r) {
                    hue = 60.0 * (g - b) / delta;
                } else if (max == g) {
                    hue = 120.0 + 60.0 * (b - r) / delta;
                } else {
                    hue = 240.0 + 60.0 * (r - g) / delta;
                }
                if (hue < 0) {
                    hue += 360.0;
                }
            }
            int saturation = max == 0 ? 0 : (int) Math.round(255.0 * delta / max);

            hsv[j] = (byte) ((int) Math.round(hue / 2.0) % 180);
            hsv[j + 1] = (byte) saturation;
            hsv[j + 2] = (byte) max;
        }

        Mat output = new Mat(input.rows(), input.cols(), CvType.CV_8UC3);
        output.put(0, 0, hsv);
        return output;
    }

    @Override
    public PixelFormat outputFormat(PixelFormat inputFormat) {
        return PixelFormat.HSV8;
    }
}

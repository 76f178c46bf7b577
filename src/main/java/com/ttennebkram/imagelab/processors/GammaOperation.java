package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Gamma correction: out = 255 * (in / 255) ^ gamma.
 * Gamma below 1 brightens, above 1 darkens.
 */
@OperationInfo(
    name = "Gamma",
    displayName = "Gamma Correction",
    category = Category.ENHANCEMENT,
    order = 50,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Power-law lookup table\nCore.LUT(src, lut, dst)"
)
public class GammaOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.decimal("gamma", "Gamma", 0.1, 3.0, 1.0));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        double gamma = params.getDouble("gamma");
        byte[] table = new byte[256];
        for (int v = 0; v < 256; v++) {
            table[v] = (byte) Math.min(255, (int) Math.round(Math.pow(v / 255.0, gamma) * 255.0));
        }
        Mat lut = new Mat(1, 256, CvType.CV_8UC1);
        lut.put(0, 0, table);

        Mat output = new Mat();
        Core.LUT(input, lut, output);
        lut.release();
        return output;
    }
}

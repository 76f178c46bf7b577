package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Mirror image. Horizontal swaps left and right, vertical swaps top and bottom.
 */
@OperationInfo(
    name = "Flip",
    category = Category.GEOMETRIC,
    order = 60,
    description = "Mirror around the vertical or horizontal axis\nCore.flip(src, dst, flipCode)"
)
public class FlipOperation extends OperationBase {

    private static final String[] DIRECTION_NAMES = {"Horizontal", "Vertical", "Both"};
    private static final int[] FLIP_CODES = {1, 0, -1};

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.choice("direction", "Direction", DIRECTION_NAMES[0], DIRECTION_NAMES));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        String direction = params.getString("direction");
        int code = FLIP_CODES[0];
        for (int i = 0; i < DIRECTION_NAMES.length; i++) {
            if (DIRECTION_NAMES[i].equals(direction)) {
                code = FLIP_CODES[i];
            }
        }
        Mat output = new Mat();
        Core.flip(input, output, code);
        return output;
    }
}

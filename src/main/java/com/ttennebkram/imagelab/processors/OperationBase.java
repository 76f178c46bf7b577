package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Abstract base class for operations.
 * Provides common parameter declarations and OpenCV constant lookups.
 */
public abstract class OperationBase implements ImageOperation {

    protected static final String[] BORDER_MODE_NAMES = {
        "Constant (black)", "Replicate", "Reflect", "Wrap"
    };
    private static final int[] BORDER_MODES = {
        Core.BORDER_CONSTANT, Core.BORDER_REPLICATE, Core.BORDER_REFLECT, Core.BORDER_WRAP
    };

    protected static final String[] INTERPOLATION_NAMES = {"Linear", "Nearest", "Cubic", "Area"};
    private static final int[] INTERPOLATIONS = {
        Imgproc.INTER_LINEAR, Imgproc.INTER_NEAREST, Imgproc.INTER_CUBIC, Imgproc.INTER_AREA
    };

    protected static final String[] KERNEL_SHAPE_NAMES = {"Rectangle", "Ellipse", "Cross"};
    private static final int[] KERNEL_SHAPES = {
        Imgproc.MORPH_RECT, Imgproc.MORPH_ELLIPSE, Imgproc.MORPH_CROSS
    };

    /**
     * Standard null/empty check for input validation.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    protected static ParameterSpec borderModeParameter() {
        return ParameterSpec.choice("borderMode", "Border Mode", BORDER_MODE_NAMES[0], BORDER_MODE_NAMES);
    }

    protected static ParameterSpec kernelShapeParameter() {
        return ParameterSpec.choice("kernelShape", "Kernel Shape", KERNEL_SHAPE_NAMES[0], KERNEL_SHAPE_NAMES);
    }

    protected static int borderMode(String name) {
        return lookup(BORDER_MODE_NAMES, BORDER_MODES, name);
    }

    protected static int interpolation(String name) {
        return lookup(INTERPOLATION_NAMES, INTERPOLATIONS, name);
    }

    protected static int kernelShape(String name) {
        return lookup(KERNEL_SHAPE_NAMES, KERNEL_SHAPES, name);
    }

    private static int lookup(String[] names, int[] values, String name) {
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(name)) {
                return values[i];
            }
        }
        return values[0];
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Base class for morphology operations built on a structuring element.
 */
public abstract class MorphologyOperation extends OperationBase {

    private final int morphOp;
    private final List<ParameterSpec> parameters;

    /**
     * @param morphOp one of Imgproc.MORPH_*
     * @param withIterations whether the operation exposes an iteration count
     */
    protected MorphologyOperation(int morphOp, boolean withIterations) {
        this.morphOp = morphOp;
        this.parameters = withIterations
                ? List.of(ParameterSpec.kernelSize("kernelSize", 21, 3),
                          ParameterSpec.integer("iterations", "Iterations", 1, 10, 1),
                          kernelShapeParameter())
                : List.of(ParameterSpec.kernelSize("kernelSize", 21, 3),
                          kernelShapeParameter());
    }

    @Override
    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int ksize = params.getInt("kernelSize");
        int iterations = params.has("iterations") ? params.getInt("iterations") : 1;

        Mat kernel = Imgproc.getStructuringElement(kernelShape(params.getString("kernelShape")),
                new Size(ksize, ksize));

        Mat output = new Mat();
        Imgproc.morphologyEx(input, output, morphOp, kernel, new Point(-1, -1), iterations);

        kernel.release();
        return output;
    }
}

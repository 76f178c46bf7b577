package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.export.ImageCodec;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Base class for previews that encode the image and decode it again, so the
 * result shows exactly what the codec keeps. Input is GRAY8 or RGB8.
 */
public abstract class RecompressOperation extends OperationBase {

    private final ExportFormat format;

    protected RecompressOperation(ExportFormat format) {
        this.format = format;
    }

    /**
     * Imgcodecs write parameters as flag/value pairs.
     */
    protected abstract int[] writeParams(OperationParams params);

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        boolean color = input.channels() == 3;
        Mat bgr = input;
        if (color) {
            bgr = new Mat();
            Imgproc.cvtColor(input, bgr, Imgproc.COLOR_RGB2BGR);
        }

        byte[] encoded = ImageCodec.encode(bgr, format, writeParams(params));
        if (color) {
            bgr.release();
        }

        Mat decoded = ImageCodec.decode(encoded, color);
        if (!color) {
            return decoded;
        }
        Mat output = new Mat();
        Imgproc.cvtColor(decoded, output, Imgproc.COLOR_BGR2RGB);
        decoded.release();
        return output;
    }
}

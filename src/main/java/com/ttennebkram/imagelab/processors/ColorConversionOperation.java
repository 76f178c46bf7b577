package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for conversions that are a single cvtColor call.
 * Subclasses declare the accepted input format in their annotation.
 */
public abstract class ColorConversionOperation extends OperationBase {

    private final int conversionCode;
    private final PixelFormat targetFormat;

    protected ColorConversionOperation(int conversionCode, PixelFormat targetFormat) {
        this.conversionCode = conversionCode;
        this.targetFormat = targetFormat;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat output = new Mat();
        Imgproc.cvtColor(input, output, conversionCode);
        return output;
    }

    @Override
    public PixelFormat outputFormat(PixelFormat inputFormat) {
        return targetFormat;
    }

    /**
     * Copy with the second and third channels swapped, e.g. YCrCb to YCbCr.
     */
    protected static Mat swapLastTwoChannels(Mat input) {
        List<Mat> channels = new ArrayList<>();
        Core.split(input, channels);
        Collections.swap(channels, 1, 2);
        Mat output = new Mat();
        Core.merge(channels, output);
        for (Mat m : channels) m.release();
        return output;
    }
}

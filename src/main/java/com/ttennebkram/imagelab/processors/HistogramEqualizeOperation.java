package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Histogram equalization. Color input is equalized on the luma channel only,
 * so hues are preserved.
 */
@OperationInfo(
    name = "Histogram Equalization",
    category = Category.ENHANCEMENT,
    order = 10,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Spread the intensity histogram\nImgproc.equalizeHist(src, dst) on Y of YCrCb"
)
public class HistogramEqualizeOperation extends OperationBase {

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat output = new Mat();
        if (input.channels() == 1) {
            Imgproc.equalizeHist(input, output);
            return output;
        }

        Mat ycrcb = new Mat();
        Imgproc.cvtColor(input, ycrcb, Imgproc.COLOR_RGB2YCrCb);
        List<Mat> channels = new ArrayList<>();
        Core.split(ycrcb, channels);

        Mat luma = new Mat();
        Imgproc.equalizeHist(channels.get(0), luma);
        channels.get(0).release();
        channels.set(0, luma);

        Core.merge(channels, ycrcb);
        Imgproc.cvtColor(ycrcb, output, Imgproc.COLOR_YCrCb2RGB);

        ycrcb.release();
        for (Mat m : channels) m.release();
        return output;
    }
}

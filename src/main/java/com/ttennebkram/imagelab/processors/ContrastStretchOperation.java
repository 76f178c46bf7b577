package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.errors.DegenerateInputException;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Percentile contrast stretch, applied to each channel independently.
 * Values at or below the low percentile map to 0, values at or above the
 * high percentile map to 255, and the range between is stretched linearly.
 *
 * A channel whose percentiles coincide is left as is. If every channel is
 * flat a {@link DegenerateInputException} is thrown.
 */
@OperationInfo(
    name = "Contrast Stretch",
    category = Category.ENHANCEMENT,
    order = 20,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Linear stretch between two percentiles\nCore.LUT(src, lut, dst)"
)
public class ContrastStretchOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.decimal("lowPercentile", "Low Percentile", 0, 49, 0),
            ParameterSpec.decimal("highPercentile", "High Percentile", 51, 100, 100));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        double lowPct = params.getDouble("lowPercentile");
        double highPct = params.getDouble("highPercentile");

        int channels = input.channels();
        int pixels = input.rows() * input.cols();
        byte[] data = new byte[pixels * channels];
        input.get(0, 0, data);

        int[][] histograms = new int[channels][256];
        for (int i = 0; i < data.length; i++) {
            histograms[i % channels][data[i] & 0xFF]++;
        }

        byte[] lut = new byte[256 * channels];
        boolean anyStretched = false;
        for (int c = 0; c < channels; c++) {
            int low = valueAtRank(histograms[c], (long) Math.floor(lowPct / 100.0 * (pixels - 1)));
            int high = valueAtRank(histograms[c], (long) Math.ceil(highPct / 100.0 * (pixels - 1)));
            boolean flat = high <= low;
            anyStretched |= !flat;
            for (int v = 0; v < 256; v++) {
                int mapped;
                if (flat) {
                    mapped = v;
                } else if (v <= low) {
                    mapped = 0;
                } else if (v >= high) {
                    mapped = 255;
                } else {
                    mapped = (int) Math.round((v - low) * 255.0 / (high - low));
                }
                lut[v * channels + c] = (byte) mapped;
            }
        }
        if (!anyStretched) {
            throw new DegenerateInputException("Contrast stretch needs at least two distinct values in a channel");
        }

        Mat lutMat = new Mat(1, 256, CvType.CV_8UC(channels));
        lutMat.put(0, 0, lut);
        Mat output = new Mat();
        Core.LUT(input, lutMat, output);
        lutMat.release();
        return output;
    }

    /**
     * Smallest value whose cumulative count exceeds the given zero-based rank.
     */
    private static int valueAtRank(int[] histogram, long rank) {
        long cumulative = 0;
        for (int v = 0; v < histogram.length; v++) {
            cumulative += histogram[v];
            if (cumulative > rank) {
                return v;
            }
        }
        return histogram.length - 1;
    }
}

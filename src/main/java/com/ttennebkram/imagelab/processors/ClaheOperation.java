package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Contrast Limited Adaptive Histogram Equalization.
 * Color input is equalized on the L channel of Lab.
 */
@OperationInfo(
    name = "CLAHE",
    category = Category.ENHANCEMENT,
    order = 60,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Adaptive histogram equalization\nImgproc.createCLAHE(clipLimit, tileGridSize).apply(src, dst)"
)
public class ClaheOperation extends OperationBase {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.decimal("clipLimit", "Clip Limit", 1.0, 40.0, 2.0),
            ParameterSpec.integer("tileSize", "Tile Grid Size", 2, 32, 8));

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    public Mat process(Mat input, OperationParams params) {
        if (isInvalidInput(input)) {
            return input;
        }
        int tileSize = params.getInt("tileSize");
        CLAHE clahe = Imgproc.createCLAHE(params.getDouble("clipLimit"), new Size(tileSize, tileSize));
        Mat output = new Mat();

        if (input.channels() == 1) {
            clahe.apply(input, output);
            return output;
        }

        Mat lab = new Mat();
        Imgproc.cvtColor(input, lab, Imgproc.COLOR_RGB2Lab);
        List<Mat> labChannels = new ArrayList<>();
        Core.split(lab, labChannels);

        Mat lChannel = new Mat();
        clahe.apply(labChannels.get(0), lChannel);
        labChannels.get(0).release();
        labChannels.set(0, lChannel);

        Core.merge(labChannels, lab);
        Imgproc.cvtColor(lab, output, Imgproc.COLOR_Lab2RGB);

        lab.release();
        for (Mat m : labChannels) m.release();
        return output;
    }
}

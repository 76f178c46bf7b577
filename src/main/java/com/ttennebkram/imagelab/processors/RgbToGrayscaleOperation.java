package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

/**
 * BT.601 luma: 0.299 R + 0.587 G + 0.114 B.
 */
@OperationInfo(
    name = "RGB to Grayscale",
    category = Category.COLOR,
    order = 40,
    inputFormats = PixelFormat.RGB8,
    description = "Luma from BT.601 weights\nImgproc.cvtColor(src, dst, COLOR_RGB2GRAY)"
)
public class RgbToGrayscaleOperation extends ColorConversionOperation {

    public RgbToGrayscaleOperation() {
        super(Imgproc.COLOR_RGB2GRAY, PixelFormat.GRAY8);
    }
}

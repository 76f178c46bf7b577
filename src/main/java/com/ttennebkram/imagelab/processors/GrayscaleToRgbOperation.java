package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "Grayscale to RGB",
    category = Category.COLOR,
    order = 41,
    inputFormats = PixelFormat.GRAY8,
    description = "Replicate luma into three channels\nImgproc.cvtColor(src, dst, COLOR_GRAY2RGB)"
)
public class GrayscaleToRgbOperation extends ColorConversionOperation {

    public GrayscaleToRgbOperation() {
        super(Imgproc.COLOR_GRAY2RGB, PixelFormat.RGB8);
    }
}

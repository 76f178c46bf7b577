package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "RGB to HSV",
    category = Category.COLOR,
    order = 20,
    inputFormats = PixelFormat.RGB8,
    description = "Hue 0-179, saturation and value 0-255\nImgproc.cvtColor(src, dst, COLOR_RGB2HSV)"
)
public class RgbToHsvOperation extends ColorConversionOperation {

    public RgbToHsvOperation() {
        super(Imgproc.COLOR_RGB2HSV, PixelFormat.HSV8);
    }
}

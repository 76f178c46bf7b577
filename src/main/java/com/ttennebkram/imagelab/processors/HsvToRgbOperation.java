package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "HSV to RGB",
    category = Category.COLOR,
    order = 21,
    inputFormats = PixelFormat.HSV8,
    description = "Imgproc.cvtColor(src, dst, COLOR_HSV2RGB)"
)
public class HsvToRgbOperation extends ColorConversionOperation {

    public HsvToRgbOperation() {
        super(Imgproc.COLOR_HSV2RGB, PixelFormat.RGB8);
    }
}

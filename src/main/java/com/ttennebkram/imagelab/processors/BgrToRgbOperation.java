package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "BGR to RGB",
    category = Category.COLOR,
    order = 11,
    inputFormats = PixelFormat.BGR8,
    description = "Swap blue and red channels\nImgproc.cvtColor(src, dst, COLOR_BGR2RGB)"
)
public class BgrToRgbOperation extends ColorConversionOperation {

    public BgrToRgbOperation() {
        super(Imgproc.COLOR_BGR2RGB, PixelFormat.RGB8);
    }
}

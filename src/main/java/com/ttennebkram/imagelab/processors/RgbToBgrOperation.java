package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "RGB to BGR",
    category = Category.COLOR,
    order = 10,
    inputFormats = PixelFormat.RGB8,
    description = "Swap red and blue channels\nImgproc.cvtColor(src, dst, COLOR_RGB2BGR)"
)
public class RgbToBgrOperation extends ColorConversionOperation {

    public RgbToBgrOperation() {
        super(Imgproc.COLOR_RGB2BGR, PixelFormat.BGR8);
    }
}

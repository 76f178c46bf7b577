package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "Erode",
    category = Category.MORPHOLOGY,
    order = 20,
    description = "Shrink bright regions\nImgproc.erode(src, dst, kernel, anchor, iterations)"
)
public class ErodeOperation extends MorphologyOperation {

    public ErodeOperation() {
        super(Imgproc.MORPH_ERODE, true);
    }
}

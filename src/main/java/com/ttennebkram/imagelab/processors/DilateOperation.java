package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "Dilate",
    category = Category.MORPHOLOGY,
    order = 10,
    description = "Expand bright regions\nImgproc.dilate(src, dst, kernel, anchor, iterations)"
)
public class DilateOperation extends MorphologyOperation {

    public DilateOperation() {
        super(Imgproc.MORPH_DILATE, true);
    }
}

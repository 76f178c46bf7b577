package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "Close",
    category = Category.MORPHOLOGY,
    order = 40,
    description = "Dilate then erode, fills small dark holes\nImgproc.morphologyEx(src, dst, MORPH_CLOSE, kernel)"
)
public class MorphCloseOperation extends MorphologyOperation {

    public MorphCloseOperation() {
        super(Imgproc.MORPH_CLOSE, false);
    }
}

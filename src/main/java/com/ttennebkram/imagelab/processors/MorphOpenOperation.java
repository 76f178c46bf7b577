package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.registry.Category;
import org.opencv.imgproc.Imgproc;

@OperationInfo(
    name = "Open",
    category = Category.MORPHOLOGY,
    order = 30,
    description = "Erode then dilate, removes small bright specks\nImgproc.morphologyEx(src, dst, MORPH_OPEN, kernel)"
)
public class MorphOpenOperation extends MorphologyOperation {

    public MorphOpenOperation() {
        super(Imgproc.MORPH_OPEN, false);
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;

@OperationInfo(
    name = "BMP",
    displayName = "BMP (Uncompressed)",
    category = Category.COMPRESSION,
    order = 30,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Uncompressed BMP round trip\nImgcodecs.imencode(\".bmp\", src, buf) + imdecode"
)
public class BmpRecompressOperation extends RecompressOperation {

    public BmpRecompressOperation() {
        super(ExportFormat.BMP);
    }

    @Override
    protected int[] writeParams(OperationParams params) {
        return new int[0];
    }
}

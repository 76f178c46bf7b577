package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.imgcodecs.Imgcodecs;

import java.util.List;

/**
 * PNG round trip. Lossless, so pixels come back unchanged at any compression level.
 */
@OperationInfo(
    name = "PNG",
    displayName = "PNG Compression",
    category = Category.COMPRESSION,
    order = 20,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Lossless PNG round trip\nImgcodecs.imencode(\".png\", src, buf, IMWRITE_PNG_COMPRESSION) + imdecode"
)
public class PngRecompressOperation extends RecompressOperation {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.integer("compression", "Compression Level", 0, 9, 3));

    public PngRecompressOperation() {
        super(ExportFormat.PNG);
    }

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected int[] writeParams(OperationParams params) {
        return new int[] {Imgcodecs.IMWRITE_PNG_COMPRESSION, params.getInt("compression")};
    }
}

package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import org.opencv.imgcodecs.Imgcodecs;

import java.util.List;

/**
 * JPEG round trip. Lower quality shows stronger block artifacts.
 */
@OperationInfo(
    name = "JPEG",
    displayName = "JPEG Compression",
    category = Category.COMPRESSION,
    order = 10,
    inputFormats = {PixelFormat.GRAY8, PixelFormat.RGB8},
    description = "Lossy JPEG round trip\nImgcodecs.imencode(\".jpg\", src, buf, IMWRITE_JPEG_QUALITY) + imdecode"
)
public class JpegRecompressOperation extends RecompressOperation {

    private static final List<ParameterSpec> PARAMETERS = List.of(
            ParameterSpec.integer("quality", "Quality", 1, 100, 90));

    public JpegRecompressOperation() {
        super(ExportFormat.JPEG);
    }

    @Override
    public List<ParameterSpec> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected int[] writeParams(OperationParams params) {
        return new int[] {Imgcodecs.IMWRITE_JPEG_QUALITY, params.getInt("quality")};
    }
}

package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.errors.UnsupportedChannelCountException;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.OperationSpec;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implicit conversions applied before an operation that does not accept the
 * input's pixel format.
 *
 * Operations are only ever coerced to RGB8 or GRAY8. Explicit conversions with
 * {@link #toFormat} reach every pixel format. Everything goes through RGB8;
 * GRAY8 is derived from RGB8 with BT.601 weights.
 */
public final class Coercions {

    private Coercions() {
    }

    /**
     * Input as the operation needs it: unchanged if accepted, otherwise RGB8 if
     * accepted, otherwise GRAY8 if accepted.
     *
     * @throws UnsupportedChannelCountException if no coercion path exists
     */
    public static ImageBuffer coerceFor(OperationSpec spec, ImageBuffer input) {
        PixelFormat format = input.getPixelFormat();
        if (spec.accepts(format)) {
            return input;
        }
        if (spec.accepts(PixelFormat.RGB8)) {
            return toFormat(input, PixelFormat.RGB8);
        }
        if (spec.accepts(PixelFormat.GRAY8)) {
            return toFormat(input, PixelFormat.GRAY8);
        }
        throw new UnsupportedChannelCountException(spec.getName() + " does not accept " + format
                + " and no conversion is available (accepts " + spec.getInputFormats() + ")");
    }

    /**
     * Convert a buffer to any pixel format by way of RGB8. Converting to RGBA8
     * adds an opaque alpha channel.
     *
     * @throws UnsupportedChannelCountException for a format with no conversion
     */
    public static ImageBuffer toFormat(ImageBuffer input, PixelFormat target) {
        if (input.getPixelFormat() == target) {
            return input;
        }

        Mat rgb = toRgbMat(input);
        try {
            if (target == PixelFormat.RGB8) {
                return MatConverter.toBuffer(rgb, PixelFormat.RGB8);
            }
            Mat converted = fromRgbMat(rgb, target);
            try {
                return MatConverter.toBuffer(converted, target);
            } finally {
                converted.release();
            }
        } finally {
            rgb.release();
        }
    }

    private static Mat fromRgbMat(Mat rgb, PixelFormat target) {
        Mat output = new Mat();
        switch (target) {
            case GRAY8:
                Imgproc.cvtColor(rgb, output, Imgproc.COLOR_RGB2GRAY);
                return output;
            case BGR8:
                Imgproc.cvtColor(rgb, output, Imgproc.COLOR_RGB2BGR);
                return output;
            case HSV8:
                Imgproc.cvtColor(rgb, output, Imgproc.COLOR_RGB2HSV);
                return output;
            case RGBA8:
                Imgproc.cvtColor(rgb, output, Imgproc.COLOR_RGB2RGBA);
                return output;
            case YCBCR8:
                Imgproc.cvtColor(rgb, output, Imgproc.COLOR_RGB2YCrCb);
                Mat ycbcr = swapLastTwo(output);
                output.release();
                return ycbcr;
            default:
                output.release();
                throw new UnsupportedChannelCountException("No conversion from RGB8 to " + target);
        }
    }

    private static Mat toRgbMat(ImageBuffer input) {
        Mat mat = MatConverter.toMat(input);
        int code;
        switch (input.getPixelFormat()) {
            case RGB8:
                return mat;
            case GRAY8:
                code = Imgproc.COLOR_GRAY2RGB;
                break;
            case BGR8:
                code = Imgproc.COLOR_BGR2RGB;
                break;
            case HSV8:
                code = Imgproc.COLOR_HSV2RGB;
                break;
            case RGBA8:
                code = Imgproc.COLOR_RGBA2RGB;
                break;
            case YCBCR8:
                // Stored as Y, Cb, Cr; OpenCV expects Y, Cr, Cb
                Mat ycrcb = swapLastTwo(mat);
                mat.release();
                mat = ycrcb;
                code = Imgproc.COLOR_YCrCb2RGB;
                break;
            default:
                mat.release();
                throw new UnsupportedChannelCountException("No RGB conversion for " + input.getPixelFormat());
        }
        Mat rgb = new Mat();
        Imgproc.cvtColor(mat, rgb, code);
        mat.release();
        return rgb;
    }

    private static Mat swapLastTwo(Mat input) {
        List<Mat> channels = new ArrayList<>();
        Core.split(input, channels);
        Collections.swap(channels, 1, 2);
        Mat output = new Mat();
        Core.merge(channels, output);
        for (Mat m : channels) m.release();
        return output;
    }
}

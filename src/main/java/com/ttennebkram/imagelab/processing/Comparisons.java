package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;

/**
 * Composite views of an original and its processed version. Both are shown as
 * {@link #forDisplay} renders them, with the processed image resized to the
 * original's dimensions.
 */
public final class Comparisons {

    private Comparisons() {
    }

    /**
     * The buffer as an RGB8 view. Three-channel formats keep their raw channels,
     * so an HSV or YCbCr result looks different from its source. GRAY8 and RGBA8
     * are converted.
     */
    public static ImageBuffer forDisplay(ImageBuffer image) {
        if (image.getChannelCount() == 3) {
            return image.withFormat(PixelFormat.RGB8);
        }
        return Coercions.toFormat(image, PixelFormat.RGB8);
    }

    /**
     * Original on the left, processed on the right; twice the original's width.
     */
    public static ImageBuffer sideBySide(ImageBuffer original, ImageBuffer processed) {
        Mat left = MatConverter.toMat(forDisplay(original));
        Mat right = matchSize(processed, left);
        Mat output = new Mat();
        try {
            Core.hconcat(Arrays.asList(left, right), output);
            return MatConverter.toBuffer(output, PixelFormat.RGB8);
        } finally {
            left.release();
            right.release();
            output.release();
        }
    }

    /**
     * Left half from the original, right half from the processed image, same size as the original.
     */
    public static ImageBuffer halfSplit(ImageBuffer original, ImageBuffer processed) {
        Mat output = MatConverter.toMat(forDisplay(original));
        Mat right = matchSize(processed, output);
        try {
            int half = output.cols() / 2;
            Rect rightHalf = new Rect(half, 0, output.cols() - half, output.rows());
            Mat target = output.submat(rightHalf);
            Mat source = right.submat(rightHalf);
            source.copyTo(target);
            target.release();
            source.release();
            return MatConverter.toBuffer(output, PixelFormat.RGB8);
        } finally {
            output.release();
            right.release();
        }
    }

    private static Mat matchSize(ImageBuffer image, Mat reference) {
        Mat mat = MatConverter.toMat(forDisplay(image));
        if (mat.cols() == reference.cols() && mat.rows() == reference.rows()) {
            return mat;
        }
        Mat resized = new Mat();
        Imgproc.resize(mat, resized, new Size(reference.cols(), reference.rows()));
        mat.release();
        return resized;
    }
}

package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.errors.UnsupportedChannelCountException;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Copies pixels between {@link ImageBuffer} and OpenCV Mat.
 *
 * Mats produced by {@link #toMat} keep the buffer's channel order, so an RGB8
 * buffer becomes an RGB Mat. Use {@link #toOpenCvOrder} when handing pixels to
 * Imgcodecs or VideoCapture code that expects BGR.
 */
public final class MatConverter {

    private MatConverter() {
    }

    /**
     * Copy a buffer into a new 8-bit Mat. Caller releases.
     */
    public static Mat toMat(ImageBuffer buffer) {
        Mat mat = new Mat(buffer.getHeight(), buffer.getWidth(), CvType.CV_8UC(buffer.getChannelCount()));
        mat.put(0, 0, buffer.getData());
        return mat;
    }

    /**
     * Copy a buffer into a Mat in OpenCV's native BGR/BGRA order. Caller releases.
     */
    public static Mat toOpenCvOrder(ImageBuffer buffer) {
        Mat mat = toMat(buffer);
        int code;
        switch (buffer.getPixelFormat()) {
            case RGB8:
                code = Imgproc.COLOR_RGB2BGR;
                break;
            case RGBA8:
                code = Imgproc.COLOR_RGBA2BGRA;
                break;
            default:
                return mat;
        }
        Mat converted = new Mat();
        Imgproc.cvtColor(mat, converted, code);
        mat.release();
        return converted;
    }

    /**
     * Copy an 8-bit Mat into a new buffer labelled with the given format.
     *
     * @throws UnsupportedChannelCountException if the Mat's channels do not fit the format
     */
    public static ImageBuffer toBuffer(Mat mat, PixelFormat format) {
        if (mat.depth() != CvType.CV_8U) {
            throw new UnsupportedChannelCountException("Expected an 8-bit image but got " + CvType.typeToString(mat.type()));
        }
        if (mat.channels() != format.getChannels()) {
            throw new UnsupportedChannelCountException("A " + mat.channels() + "-channel image cannot be stored as " + format);
        }
        Mat source = mat.isContinuous() ? mat : mat.clone();
        byte[] data = new byte[(int) (source.total() * source.channels())];
        source.get(0, 0, data);
        if (source != mat) {
            source.release();
        }
        return ImageBuffer.wrap(mat.cols(), mat.rows(), format, data);
    }
}

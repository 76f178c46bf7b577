package com.ttennebkram.imagelab.export;

import com.ttennebkram.imagelab.errors.DecodeException;
import com.ttennebkram.imagelab.errors.EncodeException;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.processing.MatConverter;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * In-memory encode and decode through Imgcodecs.
 */
public final class ImageCodec {

    private ImageCodec() {
    }

    /**
     * Encode a Mat in OpenCV channel order.
     *
     * @param params Imgcodecs flag/value pairs, may be empty
     * @throws EncodeException if OpenCV cannot encode the image
     */
    public static byte[] encode(Mat mat, ExportFormat format, int... params) {
        MatOfByte buffer = new MatOfByte();
        MatOfInt writeParams = new MatOfInt(params);
        try {
            if (!Imgcodecs.imencode(format.getExtension(), mat, buffer, writeParams)) {
                throw new EncodeException("OpenCV could not encode a " + mat.cols() + "x" + mat.rows()
                        + " image as " + format);
            }
            return buffer.toArray();
        } catch (CvException e) {
            throw new EncodeException("Encoding as " + format + " failed: " + e.getMessage(), e);
        } finally {
            buffer.release();
            writeParams.release();
        }
    }

    /**
     * Decode bytes to an 8-bit BGR Mat, or a single-channel Mat when color is false.
     * Caller releases.
     *
     * @throws DecodeException on empty or malformed input
     */
    public static Mat decode(byte[] bytes, boolean color) {
        return decodeRaw(bytes, color ? Imgcodecs.IMREAD_COLOR : Imgcodecs.IMREAD_GRAYSCALE);
    }

    /**
     * Decode an uploaded file. Color images become RGB8 with any alpha channel
     * dropped, grayscale images stay GRAY8, and 16-bit samples are scaled to 8 bits.
     *
     * @throws DecodeException on empty or malformed input
     */
    public static ImageBuffer decodeBuffer(byte[] bytes) {
        Mat mat = decodeRaw(bytes, Imgcodecs.IMREAD_ANYDEPTH | Imgcodecs.IMREAD_ANYCOLOR);
        try {
            if (mat.depth() == CvType.CV_16U) {
                Mat scaled = new Mat();
                mat.convertTo(scaled, CvType.CV_8U, 1.0 / 257.0);
                mat.release();
                mat = scaled;
            } else if (mat.depth() != CvType.CV_8U) {
                throw new DecodeException("Unsupported sample type " + CvType.typeToString(mat.type()));
            }

            switch (mat.channels()) {
                case 1:
                    return MatConverter.toBuffer(mat, PixelFormat.GRAY8);
                case 3:
                    return toRgb(mat, Imgproc.COLOR_BGR2RGB);
                case 4:
                    return toRgb(mat, Imgproc.COLOR_BGRA2RGB);
                default:
                    throw new DecodeException("Unsupported channel count " + mat.channels());
            }
        } finally {
            mat.release();
        }
    }

    private static ImageBuffer toRgb(Mat mat, int code) {
        Mat rgb = new Mat();
        Imgproc.cvtColor(mat, rgb, code);
        try {
            return MatConverter.toBuffer(rgb, PixelFormat.RGB8);
        } finally {
            rgb.release();
        }
    }

    private static Mat decodeRaw(byte[] bytes, int flags) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("No image data");
        }
        MatOfByte buffer = new MatOfByte(bytes);
        try {
            Mat mat = Imgcodecs.imdecode(buffer, flags);
            if (mat == null || mat.empty()) {
                throw new DecodeException("Not a readable image (" + bytes.length + " bytes)");
            }
            return mat;
        } catch (CvException e) {
            throw new DecodeException("Decoding failed: " + e.getMessage(), e);
        } finally {
            buffer.release();
        }
    }
}

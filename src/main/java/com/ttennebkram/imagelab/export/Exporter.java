package com.ttennebkram.imagelab.export;

import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.processing.MatConverter;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Encodes image buffers to PNG, JPEG or BMP and hands them to an {@link ExportSink}.
 *
 * JPEG requires a quality, clamped to 1..100. PNG and BMP take none, and
 * passing one is an error rather than being silently ignored.
 */
public class Exporter {

    private static final Logger logger = LoggerFactory.getLogger(Exporter.class);

    public static final int MIN_QUALITY = 1;
    public static final int MAX_QUALITY = 100;

    private static final String DEFAULT_BASE_NAME = "processed";

    private final ExportSink sink;

    /**
     * Exporter that can only encode; {@link #toDownload} needs a sink.
     */
    public Exporter() {
        this(null);
    }

    public Exporter(ExportSink sink) {
        this.sink = sink;
    }

    /**
     * Encode a buffer.
     *
     * @param quality JPEG quality, required for JPEG and must be null otherwise
     * @throws InvalidParameterException if the quality rule is broken
     * @throws com.ttennebkram.imagelab.errors.EncodeException if the codec fails
     */
    public EncodedImage encode(ImageBuffer buffer, ExportFormat format, Integer quality) {
        if (buffer == null) {
            throw new IllegalArgumentException("Nothing to encode");
        }
        int[] params;
        if (format.isLossy()) {
            if (quality == null) {
                throw new InvalidParameterException(format + " export needs a quality between "
                        + MIN_QUALITY + " and " + MAX_QUALITY);
            }
            int clamped = Math.max(MIN_QUALITY, Math.min(MAX_QUALITY, quality));
            params = new int[] {Imgcodecs.IMWRITE_JPEG_QUALITY, clamped};
        } else {
            if (quality != null) {
                throw new InvalidParameterException(format + " export does not take a quality");
            }
            params = new int[0];
        }

        // HSV8 and YCBCR8 bytes go to the encoder as they are, read as B, G, R
        Mat mat = MatConverter.toOpenCvOrder(buffer);
        if (format == ExportFormat.JPEG && mat.channels() == 4) {
            Mat bgr = new Mat();
            Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_BGRA2BGR);
            mat.release();
            mat = bgr;
        }
        try {
            byte[] bytes = ImageCodec.encode(mat, format, params);
            logger.debug("Encoded {}x{} {} as {} ({} bytes)", buffer.getWidth(), buffer.getHeight(),
                    buffer.getPixelFormat(), format, bytes.length);
            return new EncodedImage(format, bytes);
        } finally {
            mat.release();
        }
    }

    /**
     * Encode with the format given by name (png, jpg, jpeg, bmp).
     *
     * @throws com.ttennebkram.imagelab.errors.UnsupportedFormatException for other names
     */
    public EncodedImage encode(ImageBuffer buffer, String formatName, Integer quality) {
        return encode(buffer, ExportFormat.fromName(formatName), quality);
    }

    /**
     * Hand encoded bytes to the sink under a file name with the matching extension.
     *
     * @return the file name used
     */
    public String toDownload(EncodedImage encoded, String baseName) throws IOException {
        if (sink == null) {
            throw new IllegalStateException("No export sink configured");
        }
        String fileName = fileNameFor(baseName, encoded.getFormat());
        sink.save(fileName, encoded.getBytes());
        return fileName;
    }

    /**
     * Suggested file name: the base name with any image extension replaced by the format's.
     */
    public static String fileNameFor(String baseName, ExportFormat format) {
        String base = baseName == null ? "" : baseName.trim();
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            String ext = base.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (ext.matches("png|jpe?g|bmp|tiff?")) {
                base = base.substring(0, dot);
            }
        }
        if (base.isEmpty()) {
            base = DEFAULT_BASE_NAME;
        }
        return base + format.getExtension();
    }
}

package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.errors.DegenerateInputException;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.NoImageLoadedException;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.processors.DualInputOperation;
import com.ttennebkram.imagelab.processors.ImageOperation;
import com.ttennebkram.imagelab.registry.OperationCatalog;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.OperationSpec;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs catalog operations against image buffers.
 *
 * Every call resolves the raw parameters, coerces the input to a format the
 * operation accepts, runs the OpenCV transform and wraps the result in a new
 * buffer. Inputs are never modified.
 */
public class OperationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(OperationDispatcher.class);

    private final OperationCatalog catalog;

    public OperationDispatcher(OperationCatalog catalog) {
        OpenCvLoader.ensureLoaded();
        this.catalog = catalog;
    }

    public OperationCatalog getCatalog() {
        return catalog;
    }

    /**
     * Apply a single-input operation.
     *
     * @param params raw parameter values by name; missing ones take their default
     */
    public ImageBuffer apply(OperationSpec spec, Map<String, ?> params, ImageBuffer input) {
        return apply(spec, params, input, null);
    }

    /**
     * Apply an operation; the second operand is only used by dual-input operations.
     *
     * @throws NoImageLoadedException if an operand is missing
     * @throws com.ttennebkram.imagelab.errors.InvalidParameterException for bad parameters or
     *         parameters OpenCV rejects
     * @throws com.ttennebkram.imagelab.errors.UnsupportedChannelCountException if the input
     *         cannot be coerced
     */
    public ImageBuffer apply(OperationSpec spec, Map<String, ?> params, ImageBuffer input, ImageBuffer second) {
        if (input == null) {
            throw new NoImageLoadedException("No image to apply " + spec.getName() + " to");
        }
        if (spec.isDualInput() && second == null) {
            throw new NoImageLoadedException(spec.getName() + " needs a second image");
        }

        OperationParams resolved = OperationParams.resolve(spec, params);
        ImageOperation operation = catalog.operationFor(spec);
        ImageBuffer source = Coercions.coerceFor(spec, input);
        if (source != input) {
            logger.debug("Coerced {} to {} for {}", input.getPixelFormat(), source.getPixelFormat(), spec.getKey());
        }

        Mat first = MatConverter.toMat(source);
        Mat other = null;
        Mat output = null;
        try {
            if (spec.isDualInput()) {
                other = MatConverter.toMat(Coercions.toFormat(second, source.getPixelFormat()));
                output = ((DualInputOperation) operation).processDual(first, other, resolved);
            } else {
                output = operation.process(first, resolved);
            }
            PixelFormat outputFormat = operation.outputFormat(source.getPixelFormat());
            return MatConverter.toBuffer(output, outputFormat);
        } catch (DegenerateInputException e) {
            logger.debug("{} left the image unchanged: {}", spec.getKey(), e.getMessage());
            return input;
        } catch (CvException e) {
            throw new InvalidParameterException(spec.getName() + " rejected " + resolved + ": " + e.getMessage(), e);
        } finally {
            if (output != null && output != first && output != other) {
                output.release();
            }
            first.release();
            if (other != null) {
                other.release();
            }
        }
    }
}

package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.errors.NoImageLoadedException;
import com.ttennebkram.imagelab.export.ImageCodec;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.SourceInfo;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.OperationSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Session state: the original image, the processed result and how it was derived.
 *
 * <pre>
 *   EMPTY --load--> LOADED --applyOperation--> PROCESSED
 *                     ^                            |
 *                     +----------reset-------------+
 * </pre>
 *
 * Every method either completes or throws with the state untouched. The original is
 * never replaced by an operation; only {@code load} and {@code clear} change it.
 * Not thread safe: one store belongs to one session.
 */
public class ImageStore {

    private static final Logger logger = LoggerFactory.getLogger(ImageStore.class);

    public enum State {
        EMPTY,
        LOADED,
        PROCESSED
    }

    private final OperationDispatcher dispatcher;

    private ChainMode chainMode;
    private ImageBuffer original;
    private ImageBuffer processed;
    private ImageBuffer secondOperand;
    private SourceInfo sourceInfo;
    private AppliedOperation lastApplied;
    private final List<AppliedOperation> history = new ArrayList<>();

    public ImageStore(OperationDispatcher dispatcher) {
        this(dispatcher, ChainMode.APPLY_TO_ORIGINAL);
    }

    public ImageStore(OperationDispatcher dispatcher, ChainMode chainMode) {
        this.dispatcher = dispatcher;
        this.chainMode = chainMode == null ? ChainMode.APPLY_TO_ORIGINAL : chainMode;
    }

    public State getState() {
        if (original == null) {
            return State.EMPTY;
        }
        return processed == null ? State.LOADED : State.PROCESSED;
    }

    /**
     * Decode and load an image file.
     *
     * @throws com.ttennebkram.imagelab.errors.DecodeException if the bytes are not an image;
     *         the previous state is kept
     */
    public void load(byte[] bytes) {
        load(bytes, null);
    }

    public void load(byte[] bytes, SourceInfo info) {
        ImageBuffer decoded = ImageCodec.decodeBuffer(bytes);
        load(decoded, info != null ? info : new SourceInfo(null, null, bytes.length));
    }

    /**
     * Load an already decoded image, e.g. a camera frame. Clears any processed result.
     */
    public void load(ImageBuffer image, SourceInfo info) {
        if (image == null) {
            throw new IllegalArgumentException("Image is required");
        }
        original = image;
        sourceInfo = info;
        processed = null;
        lastApplied = null;
        history.clear();
        logger.info("Loaded {}x{} {} image{}", image.getWidth(), image.getHeight(), image.getPixelFormat(),
                info != null && info.getFileName() != null ? " from " + info.getFileName() : "");
    }

    public void load(ImageBuffer image) {
        load(image, null);
    }

    /**
     * Decode and keep the second operand used by bitwise operations.
     *
     * @throws com.ttennebkram.imagelab.errors.DecodeException if the bytes are not an image
     */
    public void loadSecondOperand(byte[] bytes) {
        loadSecondOperand(ImageCodec.decodeBuffer(bytes));
    }

    public void loadSecondOperand(ImageBuffer image) {
        secondOperand = image;
        logger.debug("Second operand set to {}", image);
    }

    /**
     * Apply an operation according to the current chain mode and make the result current.
     *
     * @throws NoImageLoadedException if nothing is loaded, or a dual-input operation
     *         has no second operand
     */
    public ImageBuffer applyOperation(OperationSpec spec, Map<String, ?> params) {
        if (original == null) {
            throw new NoImageLoadedException("Load an image before applying " + spec.getName());
        }
        OperationParams resolved = OperationParams.resolve(spec, params);
        boolean chained = chainMode == ChainMode.APPLY_TO_PROCESSED && processed != null;
        ImageBuffer source = chained ? processed : original;

        ImageBuffer result = dispatcher.apply(spec, resolved.asMap(), source, secondOperand);

        AppliedOperation step = new AppliedOperation(spec, resolved);
        if (!chained) {
            history.clear();
        }
        history.add(step);
        lastApplied = step;
        processed = result;
        logger.debug("Applied {} ({} step chain)", step, history.size());
        return result;
    }

    /**
     * Look up an operation by category and name, then apply it.
     *
     * @throws com.ttennebkram.imagelab.errors.UnknownOperationException if absent; state unchanged
     */
    public ImageBuffer applyOperation(String category, String name, Map<String, ?> params) {
        return applyOperation(dispatcher.getCatalog().lookup(category, name), params);
    }

    /**
     * Recompute a saved chain from the original, step by step.
     * An empty chain is the same as {@link #reset()}.
     */
    public ImageBuffer replay(List<AppliedOperation> steps) {
        if (original == null) {
            throw new NoImageLoadedException("Load an image before replaying a recipe");
        }
        if (steps.isEmpty()) {
            reset();
            return original;
        }
        ImageBuffer current = original;
        for (AppliedOperation step : steps) {
            current = dispatcher.apply(step.getSpec(), step.getParams().asMap(), current, secondOperand);
        }
        history.clear();
        history.addAll(steps);
        lastApplied = steps.get(steps.size() - 1);
        processed = current;
        logger.info("Replayed {} steps", steps.size());
        return current;
    }

    /**
     * Discard the processed result, back to the original alone. No effect unless PROCESSED.
     */
    public void reset() {
        processed = null;
        lastApplied = null;
        history.clear();
    }

    /**
     * Forget everything, back to EMPTY. The chain mode is kept.
     */
    public void clear() {
        reset();
        original = null;
        secondOperand = null;
        sourceInfo = null;
    }

    public ChainMode getChainMode() {
        return chainMode;
    }

    /**
     * Switch mode. Existing images and history are kept; the mode applies from the next operation.
     */
    public void setChainMode(ChainMode chainMode) {
        this.chainMode = chainMode == null ? ChainMode.APPLY_TO_ORIGINAL : chainMode;
    }

    /**
     * The original image, or null when EMPTY.
     */
    public ImageBuffer getOriginal() {
        return original;
    }

    /**
     * The processed image, or null unless PROCESSED.
     */
    public ImageBuffer getProcessed() {
        return processed;
    }

    /**
     * The processed image if any, otherwise the original.
     */
    public ImageBuffer getCurrent() {
        return processed != null ? processed : original;
    }

    public ImageBuffer getSecondOperand() {
        return secondOperand;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    public AppliedOperation getLastAppliedOperation() {
        return lastApplied;
    }

    public List<AppliedOperation> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public OperationDispatcher getDispatcher() {
        return dispatcher;
    }
}

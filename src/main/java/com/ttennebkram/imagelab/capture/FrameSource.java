package com.ttennebkram.imagelab.capture;

import com.ttennebkram.imagelab.model.ImageBuffer;

/**
 * A stream of frames, such as a camera. Closing releases the device.
 */
public interface FrameSource extends AutoCloseable {

    /**
     * Next frame, or null when the source has no more frames.
     */
    ImageBuffer nextFrame();

    @Override
    void close();
}

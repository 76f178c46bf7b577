package com.ttennebkram.imagelab.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per JVM.
 */
public final class OpenCvLoader {

    private static final Logger logger = LoggerFactory.getLogger(OpenCvLoader.class);

    private static boolean loaded;

    private OpenCvLoader() {
    }

    public static synchronized void ensureLoaded() {
        if (loaded) {
            return;
        }
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        logger.info("Loaded OpenCV {}", org.opencv.core.Core.VERSION);
    }
}

package com.ttennebkram.imagelab;

import com.ttennebkram.imagelab.fx.ImageLabApp;
import com.ttennebkram.imagelab.processing.OpenCvLoader;
import javafx.application.Application;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.logging.Filter;

/**
 * Entry point. JavaFX refuses to start an Application subclass as the main
 * class of a plain jar, so this class loads OpenCV and then launches the viewer.
 *
 * Usage: {@code java -jar opencv-image-lab.jar [image-file]}
 */
public class ImageLabLauncher {

    private static final Logger logger = LoggerFactory.getLogger(ImageLabLauncher.class);

    private static final String APP_NAME = "OpenCV Image Lab";

    public static void main(String[] args) {
        quietJavaFxClasspathWarning();

        // Must be set before AWT/JavaFX start
        System.setProperty("apple.awt.application.name", APP_NAME);

        logger.info("Starting {} on Java {}", APP_NAME, System.getProperty("java.version"));
        OpenCvLoader.ensureLoaded();
        if (args.length > 1) {
            logger.warn("Only the first image argument is used, ignoring {} more", args.length - 1);
        }

        Application.launch(ImageLabApp.class, args);
    }

    /**
     * JavaFX logs "Unsupported JavaFX configuration" through java.util.logging
     * whenever it is loaded from the classpath instead of the module path.
     */
    private static void quietJavaFxClasspathWarning() {
        java.util.logging.Logger javafxLogger = java.util.logging.Logger.getLogger("javafx");
        Filter previous = javafxLogger.getFilter();
        javafxLogger.setFilter(record -> {
            String msg = record.getMessage();
            if (msg != null && msg.startsWith("Unsupported JavaFX configuration")) {
                return false;
            }
            return previous == null || previous.isLoggable(record);
        });
    }
}

package com.ttennebkram.imagelab.fx;

import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.processing.Comparisons;
import javafx.scene.image.Image;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;

/**
 * Utility methods for converting image buffers to JavaFX images.
 */
public class FXImageUtils {

    /**
     * Convert a buffer to a JavaFX Image. Three-channel buffers are drawn with
     * their raw channels as red, green and blue, so HSV and YCbCr results stay visible.
     *
     * @return A JavaFX Image, or null if the buffer is null
     */
    public static Image toImage(ImageBuffer buffer) {
        if (buffer == null) {
            return null;
        }
        ImageBuffer rgb = Comparisons.forDisplay(buffer);
        int width = rgb.getWidth();
        int height = rgb.getHeight();

        WritableImage image = new WritableImage(width, height);
        PixelWriter pw = image.getPixelWriter();
        pw.setPixels(0, 0, width, height, PixelFormat.getByteRgbInstance(), rgb.getData(), 0, width * 3);
        return image;
    }
}

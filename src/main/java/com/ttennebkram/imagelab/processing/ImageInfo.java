package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.model.PixelFormat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Descriptive metadata of an image, including the size it would have in each export format.
 */
public final class ImageInfo {

    private final int width;
    private final int height;
    private final int channelCount;
    private final PixelFormat pixelFormat;
    private final Map<ExportFormat, Integer> estimatedSizes;

    public ImageInfo(int width, int height, int channelCount, PixelFormat pixelFormat,
                     Map<ExportFormat, Integer> estimatedSizes) {
        this.width = width;
        this.height = height;
        this.channelCount = channelCount;
        this.pixelFormat = pixelFormat;
        this.estimatedSizes = estimatedSizes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(estimatedSizes));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannelCount() {
        return channelCount;
    }

    public PixelFormat getPixelFormat() {
        return pixelFormat;
    }

    public Map<ExportFormat, Integer> getEstimatedSizes() {
        return estimatedSizes;
    }

    /**
     * Encoded size in bytes, or -1 if it was not estimated.
     */
    public int getEstimatedSize(ExportFormat format) {
        return estimatedSizes.getOrDefault(format, -1);
    }

    @Override
    public String toString() {
        return width + "x" + height + " " + pixelFormat + " " + estimatedSizes;
    }
}

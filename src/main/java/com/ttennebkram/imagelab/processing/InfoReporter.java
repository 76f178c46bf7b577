package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.export.Exporter;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.SourceInfo;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives display metadata from image buffers. Encoded sizes come from actually
 * encoding the image with the {@link Exporter}.
 */
public class InfoReporter {

    private final Exporter exporter;
    private final int jpegQuality;

    public InfoReporter(Exporter exporter, int jpegQuality) {
        this.exporter = exporter;
        this.jpegQuality = jpegQuality;
    }

    public int getJpegQuality() {
        return jpegQuality;
    }

    /**
     * Dimensions, channels and encoded size as PNG, JPEG (at the configured quality) and BMP.
     */
    public ImageInfo describe(ImageBuffer buffer) {
        Map<ExportFormat, Integer> sizes = new EnumMap<>(ExportFormat.class);
        for (ExportFormat format : ExportFormat.values()) {
            Integer quality = format.isLossy() ? jpegQuality : null;
            sizes.put(format, exporter.encode(buffer, format, quality).length());
        }
        return new ImageInfo(buffer.getWidth(), buffer.getHeight(), buffer.getChannelCount(),
                buffer.getPixelFormat(), sizes);
    }

    /**
     * JPEG size for each quality, ordered by quality.
     */
    public SortedMap<Integer, Integer> jpegSizes(ImageBuffer buffer, int... qualities) {
        SortedMap<Integer, Integer> sizes = new TreeMap<>();
        for (int quality : qualities) {
            sizes.put(quality, exporter.encode(buffer, ExportFormat.JPEG, quality).length());
        }
        return sizes;
    }

    /**
     * Status text such as {@code "640 x 480, Channels: 3, Format: PNG, Size: 12.34 KB"}.
     * The format and size part is only present when source metadata is given.
     */
    public String statusLine(ImageInfo info, SourceInfo source) {
        StringBuilder sb = new StringBuilder();
        sb.append(info.getWidth()).append(" x ").append(info.getHeight())
                .append(", Channels: ").append(info.getChannelCount());
        if (source != null) {
            sb.append(", Format: ").append(source.getFormatLabel())
                    .append(", Size: ").append(kilobytes(source.getByteLength()));
        }
        return sb.toString();
    }

    /**
     * Status text for a buffer without encoding it.
     */
    public String statusLine(ImageBuffer buffer, SourceInfo source) {
        return statusLine(new ImageInfo(buffer.getWidth(), buffer.getHeight(), buffer.getChannelCount(),
                buffer.getPixelFormat(), new EnumMap<>(ExportFormat.class)), source);
    }

    public static String kilobytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
    }
}

package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.export.ExportFormat;
import com.ttennebkram.imagelab.export.Exporter;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.model.SourceInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InfoReporterTest {

    private static InfoReporter reporter;

    @BeforeAll
    public static void setUp() {
        OpenCvLoader.ensureLoaded();
        reporter = new InfoReporter(new Exporter(), 90);
    }

    @Test
    public void testStatusLine() {
        ImageBuffer image = TestImages.gradient(4, 3);
        assertEquals("4 x 3, Channels: 3, Format: PNG, Size: 12.34 KB",
                reporter.statusLine(image, new SourceInfo("photo.png", "image/png", 12634)));
        assertEquals("4 x 3, Channels: 3", reporter.statusLine(image, null));
        assertEquals("2 x 2, Channels: 1, Format: JPG, Size: 1.00 KB",
                reporter.statusLine(ImageBuffer.filled(2, 2, PixelFormat.GRAY8, 0),
                        new SourceInfo("scan.jpg", null, 1024)));
    }

    @Test
    public void testKilobytes() {
        assertEquals("0.00 KB", InfoReporter.kilobytes(0));
        assertEquals("0.50 KB", InfoReporter.kilobytes(512));
        assertEquals("1000.00 KB", InfoReporter.kilobytes(1024000));
    }

    @Test
    public void testDescribe() {
        ImageBuffer image = TestImages.gradient(64, 48);
        ImageInfo info = reporter.describe(image);
        assertEquals(64, info.getWidth());
        assertEquals(48, info.getHeight());
        assertEquals(3, info.getChannelCount());
        assertEquals(PixelFormat.RGB8, info.getPixelFormat());
        for (ExportFormat format : ExportFormat.values()) {
            assertTrue(info.getEstimatedSize(format) > 0, format.name());
        }
        // BMP stores raw pixels plus a header
        assertTrue(info.getEstimatedSize(ExportFormat.BMP) > 64 * 48 * 3);
    }

    @Test
    public void testJpegSizesGrowWithQuality() {
        ImageBuffer image = TestImages.noise(64, 64, PixelFormat.RGB8, 5);
        SortedMap<Integer, Integer> sizes = reporter.jpegSizes(image, 95, 10, 50);
        assertEquals(List.of(10, 50, 95), new ArrayList<>(sizes.keySet()));
        assertTrue(sizes.get(10) < sizes.get(50));
        assertTrue(sizes.get(50) < sizes.get(95));
    }
}

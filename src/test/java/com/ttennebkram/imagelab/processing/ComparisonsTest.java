package com.ttennebkram.imagelab.processing;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class ComparisonsTest {

    @BeforeAll
    public static void setUp() {
        OpenCvLoader.ensureLoaded();
    }

    @Test
    public void testSideBySide() {
        ImageBuffer original = ImageBuffer.filled(10, 6, PixelFormat.RGB8, 10, 20, 30);
        ImageBuffer processed = ImageBuffer.filled(5, 3, PixelFormat.GRAY8, 200);

        ImageBuffer combined = Comparisons.sideBySide(original, processed);
        assertEquals(20, combined.getWidth());
        assertEquals(6, combined.getHeight());
        assertEquals(PixelFormat.RGB8, combined.getPixelFormat());
        assertEquals(10, combined.getValue(9, 5, 0));
        assertEquals(200, combined.getValue(10, 0, 0));
        assertEquals(200, combined.getValue(19, 5, 2));
    }

    @Test
    public void testHalfSplit() {
        ImageBuffer original = ImageBuffer.filled(9, 4, PixelFormat.RGB8, 0, 0, 0);
        ImageBuffer processed = ImageBuffer.filled(9, 4, PixelFormat.RGB8, 255, 255, 255);

        ImageBuffer split = Comparisons.halfSplit(original, processed);
        assertEquals(9, split.getWidth());
        assertEquals(4, split.getHeight());
        assertEquals(0, split.getValue(3, 2, 1));
        assertEquals(255, split.getValue(4, 2, 1));
        assertEquals(255, split.getValue(8, 3, 1));
    }

    @Test
    public void testHalfSplitOfSameImageIsUnchanged() {
        ImageBuffer image = TestImages.gradient(16, 8);
        assertEquals(image, Comparisons.halfSplit(image, image));
    }

    @Test
    public void testColorConversionsShowTheirRawChannels() {
        ImageBuffer original = ImageBuffer.filled(8, 4, PixelFormat.RGB8, 200, 120, 40);
        ImageBuffer hsv = Coercions.toFormat(original, PixelFormat.HSV8);

        ImageBuffer combined = Comparisons.sideBySide(original, hsv);
        for (int c = 0; c < 3; c++) {
            assertEquals(original.getValue(0, 0, c), combined.getValue(0, 0, c));
            assertEquals(hsv.getValue(0, 0, c), combined.getValue(8, 0, c));
        }
        assertNotEquals(combined.getValue(0, 0, 0), combined.getValue(8, 0, 0));

        ImageBuffer bgr = Coercions.toFormat(original, PixelFormat.BGR8);
        assertEquals(40, Comparisons.forDisplay(bgr).getValue(0, 0, 0));
        assertEquals(PixelFormat.RGB8, Comparisons.forDisplay(bgr).getPixelFormat());
    }

    @Test
    public void testGrayAndAlphaAreConvertedForDisplay() {
        ImageBuffer gray = ImageBuffer.filled(2, 2, PixelFormat.GRAY8, 77);
        ImageBuffer shown = Comparisons.forDisplay(gray);
        assertEquals(PixelFormat.RGB8, shown.getPixelFormat());
        assertEquals(77, shown.getValue(1, 1, 2));

        ImageBuffer rgba = ImageBuffer.filled(2, 2, PixelFormat.RGBA8, 1, 2, 3, 4);
        assertEquals(ImageBuffer.filled(2, 2, PixelFormat.RGB8, 1, 2, 3), Comparisons.forDisplay(rgba));
    }
}

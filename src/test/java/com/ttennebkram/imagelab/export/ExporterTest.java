package com.ttennebkram.imagelab.export;

import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.UnsupportedFormatException;
import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.processing.OpenCvLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExporterTest {

    private static Exporter exporter;

    @BeforeAll
    public static void setUp() {
        OpenCvLoader.ensureLoaded();
        exporter = new Exporter();
    }

    @Test
    public void testFormatNames() {
        assertEquals(ExportFormat.PNG, ExportFormat.fromName("PNG"));
        assertEquals(ExportFormat.JPEG, ExportFormat.fromName("jpg"));
        assertEquals(ExportFormat.JPEG, ExportFormat.fromName(".JPEG"));
        assertEquals(ExportFormat.BMP, ExportFormat.fromName(" bmp "));
        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class,
                () -> ExportFormat.fromName("gif"));
        assertEquals("Unsupported export format: gif", e.getMessage());
        assertThrows(UnsupportedFormatException.class,
                () -> exporter.encode(TestImages.gradient(4, 4), "tiff", null));
    }

    @Test
    public void testMagicBytes() {
        ImageBuffer image = TestImages.gradient(16, 16);
        byte[] png = exporter.encode(image, ExportFormat.PNG, null).getBytes();
        assertArrayEquals(new byte[] {(byte) 0x89, 'P', 'N', 'G'}, java.util.Arrays.copyOf(png, 4));

        byte[] jpeg = exporter.encode(image, ExportFormat.JPEG, 90).getBytes();
        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);

        byte[] bmp = exporter.encode(image, "bmp", null).getBytes();
        assertEquals('B', bmp[0]);
        assertEquals('M', bmp[1]);
    }

    @Test
    public void testPngRoundTripIsExact() {
        ImageBuffer image = TestImages.noise(20, 10, PixelFormat.RGB8, 9);
        byte[] png = exporter.encode(image, ExportFormat.PNG, null).getBytes();
        assertEquals(image, ImageCodec.decodeBuffer(png));

        ImageBuffer gray = TestImages.grayGradient(12, 7);
        assertEquals(gray, ImageCodec.decodeBuffer(exporter.encode(gray, ExportFormat.PNG, null).getBytes()));
    }

    @Test
    public void testQualityRules() {
        ImageBuffer image = TestImages.gradient(8, 8);
        assertThrows(InvalidParameterException.class, () -> exporter.encode(image, ExportFormat.JPEG, null));
        assertThrows(InvalidParameterException.class, () -> exporter.encode(image, ExportFormat.PNG, 80));
        assertThrows(InvalidParameterException.class, () -> exporter.encode(image, ExportFormat.BMP, 80));

        // Out of range qualities are clamped, not rejected
        assertArrayEquals(exporter.encode(image, ExportFormat.JPEG, 100).getBytes(),
                exporter.encode(image, ExportFormat.JPEG, 150).getBytes());
        assertArrayEquals(exporter.encode(image, ExportFormat.JPEG, 1).getBytes(),
                exporter.encode(image, ExportFormat.JPEG, -5).getBytes());
    }

    @Test
    public void testSizeOrdering() {
        ImageBuffer image = TestImages.gradient(128, 96);
        int q30 = exporter.encode(image, ExportFormat.JPEG, 30).length();
        int q90 = exporter.encode(image, ExportFormat.JPEG, 90).length();
        int png = exporter.encode(image, ExportFormat.PNG, null).length();
        int bmp = exporter.encode(image, ExportFormat.BMP, null).length();
        assertTrue(q30 <= q90, q30 + " > " + q90);
        assertTrue(png <= bmp, png + " > " + bmp);
    }

    @Test
    public void testJpegDropsAlpha() {
        ImageBuffer rgba = ImageBuffer.filled(6, 6, PixelFormat.RGBA8, 255, 0, 0, 128);
        EncodedImage jpeg = exporter.encode(rgba, ExportFormat.JPEG, 95);
        ImageBuffer decoded = ImageCodec.decodeBuffer(jpeg.getBytes());
        assertEquals(PixelFormat.RGB8, decoded.getPixelFormat());
        assertTrue(decoded.getValue(3, 3, 0) > 240);
        assertTrue(decoded.getValue(3, 3, 2) < 15);
    }

    @Test
    public void testBgrBufferIsWrittenInColorOrder() {
        ImageBuffer bgr = ImageBuffer.filled(4, 4, PixelFormat.BGR8, 0, 0, 255);
        ImageBuffer decoded = ImageCodec.decodeBuffer(exporter.encode(bgr, ExportFormat.PNG, null).getBytes());
        assertEquals(ImageBuffer.filled(4, 4, PixelFormat.RGB8, 255, 0, 0), decoded);
    }

    @Test
    public void testHsvBufferIsWrittenChannelForChannel() {
        ImageBuffer hsv = ImageBuffer.filled(4, 4, PixelFormat.HSV8, 15, 204, 200);
        ImageBuffer decoded = ImageCodec.decodeBuffer(exporter.encode(hsv, ExportFormat.PNG, null).getBytes());
        assertEquals(ImageBuffer.filled(4, 4, PixelFormat.RGB8, 200, 204, 15), decoded);

        ImageBuffer ycbcr = ImageBuffer.filled(2, 2, PixelFormat.YCBCR8, 90, 60, 240);
        decoded = ImageCodec.decodeBuffer(exporter.encode(ycbcr, ExportFormat.BMP, null).getBytes());
        assertEquals(ImageBuffer.filled(2, 2, PixelFormat.RGB8, 240, 60, 90), decoded);
    }

    @Test
    public void testFileNames() {
        assertEquals("photo.jpg", Exporter.fileNameFor("photo.png", ExportFormat.JPEG));
        assertEquals("photo.png", Exporter.fileNameFor("photo.JPEG", ExportFormat.PNG));
        assertEquals("scan.tar.bmp", Exporter.fileNameFor("scan.tar", ExportFormat.BMP));
        assertEquals("processed.png", Exporter.fileNameFor("  ", ExportFormat.PNG));
        assertEquals("processed.jpg", Exporter.fileNameFor(null, ExportFormat.JPEG));
        assertEquals(".hidden.png", Exporter.fileNameFor(".hidden", ExportFormat.PNG));
    }

    @Test
    public void testToDownload() throws IOException {
        Map<String, byte[]> saved = new LinkedHashMap<>();
        Exporter withSink = new Exporter(saved::put);
        EncodedImage encoded = withSink.encode(TestImages.gradient(4, 4), ExportFormat.BMP, null);

        assertEquals("result.bmp", withSink.toDownload(encoded, "result.png"));
        assertArrayEquals(encoded.getBytes(), saved.get("result.bmp"));

        assertThrows(IllegalStateException.class, () -> exporter.toDownload(encoded, "result"));
    }

    @Test
    public void testEncodedImageIsImmutable() {
        EncodedImage encoded = exporter.encode(TestImages.gradient(4, 4), ExportFormat.PNG, null);
        byte[] copy = encoded.getBytes();
        copy[0] = 0;
        assertEquals((byte) 0x89, encoded.getBytes()[0]);
    }
}

package com.ttennebkram.imagelab;

import com.ttennebkram.imagelab.model.ImageBuffer;
import com.ttennebkram.imagelab.model.PixelFormat;

import java.util.Random;

/**
 * Synthetic images shared by the tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * RGB8 image with red rising left to right, green rising top to bottom and blue fixed at 128.
     */
    public static ImageBuffer gradient(int width, int height) {
        byte[] data = new byte[width * height * 3];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[i++] = (byte) (x * 255 / Math.max(1, width - 1));
                data[i++] = (byte) (y * 255 / Math.max(1, height - 1));
                data[i++] = (byte) 128;
            }
        }
        return new ImageBuffer(width, height, PixelFormat.RGB8, data);
    }

    /**
     * GRAY8 image rising diagonally from 0 to 255.
     */
    public static ImageBuffer grayGradient(int width, int height) {
        byte[] data = new byte[width * height];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[i++] = (byte) ((x + y) * 255 / Math.max(1, width + height - 2));
            }
        }
        return new ImageBuffer(width, height, PixelFormat.GRAY8, data);
    }

    /**
     * Seeded random image, reproducible across runs.
     */
    public static ImageBuffer noise(int width, int height, PixelFormat format, long seed) {
        byte[] data = new byte[width * height * format.getChannels()];
        new Random(seed).nextBytes(data);
        return new ImageBuffer(width, height, format, data);
    }

    /**
     * Largest absolute per-byte difference between two buffers of equal shape.
     */
    public static int maxDifference(ImageBuffer a, ImageBuffer b) {
        byte[] da = a.getData();
        byte[] db = b.getData();
        if (da.length != db.length) {
            throw new IllegalArgumentException("Buffers differ in size");
        }
        int max = 0;
        for (int i = 0; i < da.length; i++) {
            max = Math.max(max, Math.abs((da[i] & 0xFF) - (db[i] & 0xFF)));
        }
        return max;
    }
}

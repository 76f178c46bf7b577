package com.ttennebkram.imagelab.model;

import java.util.Arrays;

/**
 * Decoded 8-bit raster, stored row-major with interleaved channels.
 *
 * Buffers are immutable snapshots: the constructor copies the supplied array and
 * {@link #getData()} returns a copy. Any transform that produces pixels produces a
 * new buffer.
 */
public final class ImageBuffer {

    private final int width;
    private final int height;
    private final PixelFormat pixelFormat;
    private final byte[] data;

    public ImageBuffer(int width, int height, PixelFormat pixelFormat, byte[] data) {
        this(width, height, pixelFormat, data, true);
    }

    private ImageBuffer(int width, int height, PixelFormat pixelFormat, byte[] data, boolean copy) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (pixelFormat == null) {
            throw new IllegalArgumentException("Pixel format is required");
        }
        long expected = (long) width * height * pixelFormat.getChannels();
        if (data == null || data.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " bytes for " + width + "x" + height
                    + " " + pixelFormat + " but got " + (data == null ? "null" : data.length));
        }
        this.width = width;
        this.height = height;
        this.pixelFormat = pixelFormat;
        this.data = copy ? data.clone() : data;
    }

    /**
     * Wrap an array without copying. Only for arrays freshly allocated by the caller
     * that no other code keeps a reference to.
     */
    public static ImageBuffer wrap(int width, int height, PixelFormat pixelFormat, byte[] data) {
        return new ImageBuffer(width, height, pixelFormat, data, false);
    }

    /**
     * Create a buffer where every pixel has the same channel values.
     */
    public static ImageBuffer filled(int width, int height, PixelFormat pixelFormat, int... channelValues) {
        int channels = pixelFormat.getChannels();
        if (channelValues.length != channels) {
            throw new IllegalArgumentException(pixelFormat + " needs " + channels + " channel values");
        }
        byte[] data = new byte[width * height * channels];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) channelValues[i % channels];
        }
        return wrap(width, height, pixelFormat, data);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannelCount() {
        return pixelFormat.getChannels();
    }

    public PixelFormat getPixelFormat() {
        return pixelFormat;
    }

    public byte[] getData() {
        return data.clone();
    }

    /**
     * Unsigned value of one channel of one pixel.
     */
    public int getValue(int x, int y, int channel) {
        if (x < 0 || x >= width || y < 0 || y >= height || channel < 0 || channel >= getChannelCount()) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + "," + channel + ") outside "
                    + width + "x" + height + "x" + getChannelCount());
        }
        return data[(y * width + x) * getChannelCount() + channel] & 0xFF;
    }

    /**
     * Number of bytes of raw pixel data.
     */
    public int byteSize() {
        return data.length;
    }

    /**
     * Same pixels, relabelled with another format of equal channel count.
     */
    public ImageBuffer withFormat(PixelFormat format) {
        if (format.getChannels() != getChannelCount()) {
            throw new IllegalArgumentException("Cannot relabel " + pixelFormat + " as " + format);
        }
        return format == pixelFormat ? this : new ImageBuffer(width, height, format, data, false);
    }

    public boolean sameDimensions(ImageBuffer other) {
        return other != null && width == other.width && height == other.height;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ImageBuffer)) {
            return false;
        }
        ImageBuffer other = (ImageBuffer) obj;
        return width == other.width && height == other.height
                && pixelFormat == other.pixelFormat && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = width;
        result = 31 * result + height;
        result = 31 * result + pixelFormat.hashCode();
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "ImageBuffer[" + width + "x" + height + ", " + pixelFormat + "]";
    }
}

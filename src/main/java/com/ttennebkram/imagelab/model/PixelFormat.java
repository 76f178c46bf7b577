package com.ttennebkram.imagelab.model;

/**
 * Channel layout of an 8-bit image buffer.
 * HSV8 uses OpenCV's 8-bit convention (hue 0-179, saturation and value 0-255).
 * YCBCR8 stores Y, Cb, Cr in that order.
 */
public enum PixelFormat {
    GRAY8(1),
    RGB8(3),
    BGR8(3),
    HSV8(3),
    YCBCR8(3),
    RGBA8(4);

    private final int channels;

    PixelFormat(int channels) {
        this.channels = channels;
    }

    public int getChannels() {
        return channels;
    }
}

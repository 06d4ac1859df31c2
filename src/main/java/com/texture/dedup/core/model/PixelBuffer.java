package com.texture.dedup.core.model;

import java.util.Objects;

/**
 * A decoded image as a row-major RGBA byte buffer (4 bytes per pixel).
 * The buffer is never copied; callers must not mutate it after construction.
 */
public final class PixelBuffer {

    public static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final byte[] rgba;

    public PixelBuffer(int width, int height, byte[] rgba) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        }
        Objects.requireNonNull(rgba, "rgba is required");
        if (rgba.length != width * height * CHANNELS) {
            throw new IllegalArgumentException("Expected " + (width * height * CHANNELS)
                    + " bytes for a " + width + "x" + height + " image, got " + rgba.length);
        }
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return width * height;
    }

    public byte[] getRgba() {
        return rgba;
    }

    public int red(int pixel) {
        return rgba[pixel * CHANNELS] & 0xFF;
    }

    public int green(int pixel) {
        return rgba[pixel * CHANNELS + 1] & 0xFF;
    }

    public int blue(int pixel) {
        return rgba[pixel * CHANNELS + 2] & 0xFF;
    }

    public int alpha(int pixel) {
        return rgba[pixel * CHANNELS + 3] & 0xFF;
    }

    /**
     * Returns true if both dimensions are powers of two.
     */
    public boolean hasPowerOfTwoSize() {
        return Integer.bitCount(width) == 1 && Integer.bitCount(height) == 1;
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + width + "x" + height + '}';
    }
}

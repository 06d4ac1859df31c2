package com.texture.dedup.testsupport;

import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.source.ImageDecodeException;
import com.texture.dedup.source.PixelSource;

import java.util.Map;

/**
 * Synthetic images for tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Opaque grey image with every channel set to {@code value}.
     */
    public static PixelBuffer grey(int width, int height, int value) {
        return rgba(width, height, value, value, value, 255);
    }

    public static PixelBuffer rgba(int width, int height, int r, int g, int b, int a) {
        byte[] bytes = new byte[width * height * 4];
        for (int i = 0; i < width * height; i++) {
            bytes[i * 4] = (byte) r;
            bytes[i * 4 + 1] = (byte) g;
            bytes[i * 4 + 2] = (byte) b;
            bytes[i * 4 + 3] = (byte) a;
        }
        return new PixelBuffer(width, height, bytes);
    }

    /**
     * Opaque grey checkerboard of {@code cell x cell} squares alternating between
     * {@code 100 + delta} and {@code 100 - delta}. Every {@code 2*cell} block averages
     * to 100, so the pattern vanishes when down-sampled by {@code 2*cell} or more.
     */
    public static PixelBuffer checker(int size, int cell, int delta) {
        byte[] bytes = new byte[size * size * 4];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                boolean even = ((x / cell) + (y / cell)) % 2 == 0;
                int value = even ? 100 + delta : 100 - delta;
                int offset = (y * size + x) * 4;
                bytes[offset] = (byte) value;
                bytes[offset + 1] = (byte) value;
                bytes[offset + 2] = (byte) value;
                bytes[offset + 3] = (byte) 255;
            }
        }
        return new PixelBuffer(size, size, bytes);
    }

    /**
     * Horizontal grey gradient from {@code offset} rising by {@code step} per column.
     */
    public static PixelBuffer gradient(int width, int height, int offset, int step) {
        byte[] bytes = new byte[width * height * 4];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value = Math.min(255, offset + x * step);
                int i = (y * width + x) * 4;
                bytes[i] = (byte) value;
                bytes[i + 1] = (byte) value;
                bytes[i + 2] = (byte) value;
                bytes[i + 3] = (byte) 255;
            }
        }
        return new PixelBuffer(width, height, bytes);
    }

    /**
     * Pixel source serving the given images; unknown ids fail to decode.
     */
    public static PixelSource sourceOf(Map<String, PixelBuffer> images) {
        return id -> {
            PixelBuffer image = images.get(id);
            if (image == null) {
                throw new ImageDecodeException(id, "No test image " + id);
            }
            return image;
        };
    }
}

package com.texture.dedup.core.model;

/**
 * Width to height ratio of an image, reduced to lowest terms.
 * Two images are only ever compared when their aspect ratios are equal.
 *
 * @param width  reduced width component
 * @param height reduced height component
 */
public record AspectRatio(int width, int height) implements Comparable<AspectRatio> {

    public AspectRatio {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Width and height must be > 0, got " + width + "x" + height);
        }
        int gcd = gcd(width, height);
        width /= gcd;
        height /= gcd;
    }

    /**
     * Computes the aspect ratio of an image of the given dimensions.
     */
    public static AspectRatio of(int width, int height) {
        return new AspectRatio(width, height);
    }

    /**
     * Computes the aspect ratio of the given image.
     */
    public static AspectRatio of(PixelBuffer image) {
        return new AspectRatio(image.getWidth(), image.getHeight());
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    @Override
    public int compareTo(AspectRatio other) {
        if (width != other.width) {
            return Integer.compare(width, other.width);
        }
        return Integer.compare(height, other.height);
    }

    @Override
    public String toString() {
        return width + ":" + height;
    }
}

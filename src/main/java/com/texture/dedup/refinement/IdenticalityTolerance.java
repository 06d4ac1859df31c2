package com.texture.dedup.refinement;

import com.texture.dedup.core.model.SimilarityDimension;

/**
 * Largest per-channel difference at which two pixels still count as identical.
 * A tolerance of 255 ignores the channel.
 */
public record IdenticalityTolerance(int red, int green, int blue, int alpha) {

    public IdenticalityTolerance {
        check(red, "red");
        check(green, "green");
        check(blue, "blue");
        check(alpha, "alpha");
    }

    /**
     * Default tolerance for a dimension: only the channels the dimension fingerprints
     * are compared.
     */
    public static IdenticalityTolerance forDimension(SimilarityDimension dimension) {
        switch (dimension) {
            case ALPHA:
                return new IdenticalityTolerance(255, 255, 255, 2);
            case NORMAL:
                return new IdenticalityTolerance(2, 2, 255, 255);
            case GLOSS:
                return new IdenticalityTolerance(255, 255, 8, 255);
            case BRIGHTNESS:
                return new IdenticalityTolerance(2, 2, 2, 255);
            case GENERAL:
            default:
                return new IdenticalityTolerance(2, 2, 2, 100);
        }
    }

    private static void check(int value, String channel) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(channel + " tolerance must be between 0 and 255");
        }
    }
}

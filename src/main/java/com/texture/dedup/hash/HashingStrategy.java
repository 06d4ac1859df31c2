package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;

/**
 * The available fingerprinting strategies.
 *
 * <p>Every strategy has a minimum pixel budget for refinement pass 1. Pass {@code p}
 * multiplies that budget by {@code 4^(p-1)}, so each later pass doubles the fingerprint
 * resolution along both axes.</p>
 */
public enum HashingStrategy {
    WEIGHTED_RGBA(256) {
        @Override
        ImageHasher newHasher(AspectRatio ratio, int minPixels) {
            return new WeightedRgbaHasher(ratio, minPixels);
        }
    },
    ALPHA(512) {
        @Override
        ImageHasher newHasher(AspectRatio ratio, int minPixels) {
            return new AlphaHasher(ratio, minPixels);
        }
    },
    NORMAL_DIRECTION(256) {
        @Override
        ImageHasher newHasher(AspectRatio ratio, int minPixels) {
            return new NormalDirectionHasher(ratio, minPixels);
        }
    },
    BLUE_CHANNEL(512) {
        @Override
        ImageHasher newHasher(AspectRatio ratio, int minPixels) {
            return new BlueChannelHasher(ratio, minPixels);
        }
    },
    NORMALIZED_BRIGHTNESS(512) {
        @Override
        ImageHasher newHasher(AspectRatio ratio, int minPixels) {
            return new NormalizedBrightnessHasher(ratio, minPixels);
        }
    };

    /**
     * Last supported pass. At pass 7 the RGBA fingerprint of a square image is 1024x1024
     * pixels and its index grid already has 2^30 buckets.
     */
    public static final int MAX_PASS = 7;

    private final int minPixels;

    HashingStrategy(int minPixels) {
        this.minPixels = minPixels;
    }

    abstract ImageHasher newHasher(AspectRatio ratio, int minPixels);

    public int getMinPixels() {
        return minPixels;
    }

    /**
     * Minimum pixel budget for the given refinement pass (1-based).
     *
     * @throws IllegalArgumentException if {@code pass} is below 1 or above {@link #MAX_PASS}
     */
    public int getMinPixels(int pass) {
        if (pass < 1 || pass > MAX_PASS) {
            throw new IllegalArgumentException("pass must be between 1 and " + MAX_PASS + ", got " + pass);
        }
        return Math.toIntExact(Math.multiplyExact((long) minPixels, 1L << (2 * (pass - 1))));
    }

    public ImageHasher createHasher(AspectRatio ratio) {
        return createHasher(ratio, 1);
    }

    public ImageHasher createHasher(AspectRatio ratio, int pass) {
        return newHasher(ratio, getMinPixels(pass));
    }

    /**
     * Returns a factory producing this strategy's hashers for one refinement pass.
     */
    public HasherFactory forPass(int pass) {
        int budget = getMinPixels(pass);
        return ratio -> newHasher(ratio, budget);
    }
}

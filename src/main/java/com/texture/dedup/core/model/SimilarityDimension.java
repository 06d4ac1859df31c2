package com.texture.dedup.core.model;

import com.texture.dedup.hash.HashingStrategy;

/**
 * A tracked similarity dimension. Each dimension has its own fingerprinting
 * strategy, default query spread and its own set of ledger files.
 */
public enum SimilarityDimension {
    GENERAL("general", HashingStrategy.WEIGHTED_RGBA, 2),
    ALPHA("alpha", HashingStrategy.ALPHA, 6),
    NORMAL("normal", HashingStrategy.NORMAL_DIRECTION, 6),
    GLOSS("gloss", HashingStrategy.BLUE_CHANNEL, 6),
    BRIGHTNESS("brightness", HashingStrategy.NORMALIZED_BRIGHTNESS, 4);

    private final String key;
    private final HashingStrategy strategy;
    private final int defaultSpread;

    SimilarityDimension(String key, HashingStrategy strategy, int defaultSpread) {
        this.key = key;
        this.strategy = strategy;
        this.defaultSpread = defaultSpread;
    }

    /**
     * Short lowercase name used in ledger file names and log output.
     */
    public String getKey() {
        return key;
    }

    public HashingStrategy getStrategy() {
        return strategy;
    }

    public int getDefaultSpread() {
        return defaultSpread;
    }
}

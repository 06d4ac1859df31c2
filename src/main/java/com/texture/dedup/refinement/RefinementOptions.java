package com.texture.dedup.refinement;

import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.hash.HashingStrategy;
import com.texture.dedup.index.SameRatioIndex;

/**
 * Options for a refinement run.
 */
public class RefinementOptions {

    private static final int DEFAULT_MAX_PASSES = 4;
    private static final int DEFAULT_MAX_EQ_CLASS_SIZE = 15;
    private static final int NO_SPREAD_OVERRIDE = -1;

    private final int maxPasses;
    private final int maxEqClassSize;
    private final int spread;

    private RefinementOptions(Builder builder) {
        this.maxPasses = builder.maxPasses;
        this.maxEqClassSize = builder.maxEqClassSize;
        this.spread = builder.spread;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    /**
     * Largest number of distinct certain representatives an accepted class may have.
     */
    public int getMaxEqClassSize() {
        return maxEqClassSize;
    }

    /**
     * Query spread for {@code dimension}: the override if one was set, the dimension's
     * default otherwise.
     */
    public int getSpread(SimilarityDimension dimension) {
        return spread == NO_SPREAD_OVERRIDE ? dimension.getDefaultSpread() : spread;
    }

    public static RefinementOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RefinementOptions{maxPasses=" + maxPasses + ", maxEqClassSize=" + maxEqClassSize
                + ", spread=" + (spread == NO_SPREAD_OVERRIDE ? "default" : spread) + '}';
    }

    public static class Builder {
        private int maxPasses = DEFAULT_MAX_PASSES;
        private int maxEqClassSize = DEFAULT_MAX_EQ_CLASS_SIZE;
        private int spread = NO_SPREAD_OVERRIDE;

        public Builder maxPasses(int maxPasses) {
            if (maxPasses <= 0 || maxPasses > HashingStrategy.MAX_PASS) {
                throw new IllegalArgumentException("maxPasses must be between 1 and " + HashingStrategy.MAX_PASS);
            }
            this.maxPasses = maxPasses;
            return this;
        }

        public Builder maxEqClassSize(int maxEqClassSize) {
            if (maxEqClassSize < 2) {
                throw new IllegalArgumentException("maxEqClassSize must be at least 2");
            }
            this.maxEqClassSize = maxEqClassSize;
            return this;
        }

        public Builder spread(int spread) {
            if (spread < 0 || spread > SameRatioIndex.MAX_SPREAD) {
                throw new IllegalArgumentException("spread must be between 0 and " + SameRatioIndex.MAX_SPREAD);
            }
            this.spread = spread;
            return this;
        }

        public RefinementOptions build() {
            return new RefinementOptions(this);
        }
    }
}

package com.texture.dedup.metrics;

import com.texture.dedup.core.model.SimilarityDimension;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPassDuration(SimilarityDimension dimension, int pass, Duration duration) {
    }

    @Override
    public void recordImagesIndexed(SimilarityDimension dimension, int count) {
    }

    @Override
    public void recordImagesSkipped(SimilarityDimension dimension, int count) {
    }

    @Override
    public void incrementOversizedClass(SimilarityDimension dimension) {
    }

    @Override
    public void recordClassSize(int size) {
    }

    @Override
    public void recordRejectedPairs(SimilarityDimension dimension, int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

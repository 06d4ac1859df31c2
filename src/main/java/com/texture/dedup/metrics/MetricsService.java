package com.texture.dedup.metrics;

import com.texture.dedup.core.model.SimilarityDimension;

import java.time.Duration;

/**
 * Interface for recording texture classification metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordPassDuration(SimilarityDimension dimension, int pass, Duration duration);

    void recordImagesIndexed(SimilarityDimension dimension, int count);

    void recordImagesSkipped(SimilarityDimension dimension, int count);

    void incrementOversizedClass(SimilarityDimension dimension);

    void recordClassSize(int size);

    void recordRejectedPairs(SimilarityDimension dimension, int count);

    void recordCacheHit();

    void recordCacheMiss();
}

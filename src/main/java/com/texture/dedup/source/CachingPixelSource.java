package com.texture.dedup.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.texture.dedup.cache.CacheConfig;
import com.texture.dedup.cache.CacheStats;
import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.metrics.MetricsService;
import com.texture.dedup.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Caffeine-backed cache in front of another {@link PixelSource}. A refinement pass
 * loads every candidate twice, once to insert it and once to query it. The second load
 * is served from memory only while the image is still cached, so with more candidates
 * than {@link CacheConfig#maxSize()} most images are decoded twice per pass. Decode
 * failures are not cached.
 */
public class CachingPixelSource implements PixelSource {
    private static final Logger log = LoggerFactory.getLogger(CachingPixelSource.class);

    private final PixelSource delegate;
    private final Cache<String, PixelBuffer> cache;
    private final MetricsService metrics;

    public CachingPixelSource(PixelSource delegate, CacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingPixelSource(PixelSource delegate, CacheConfig config, MetricsService metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterAccess(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingPixelSource initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    /**
     * Wraps {@code source} in a cache if the configuration enables one.
     */
    public static PixelSource wrap(PixelSource source, CacheConfig config, MetricsService metrics) {
        if (config == null || !config.enabled() || source instanceof CachingPixelSource) {
            return source;
        }
        return new CachingPixelSource(source, config, metrics);
    }

    @Override
    public PixelBuffer load(String id) throws ImageDecodeException {
        PixelBuffer cached = cache.getIfPresent(id);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        PixelBuffer image = delegate.load(id);
        cache.put(id, image);
        return image;
    }

    /**
     * Hit, miss and eviction counts since this source was created.
     */
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}

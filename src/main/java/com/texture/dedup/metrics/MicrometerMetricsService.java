package com.texture.dedup.metrics;

import com.texture.dedup.core.model.SimilarityDimension;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code texture.refinement.pass.duration} - Timer (tags: dimension, pass)</li>
 *   <li>{@code texture.image.indexed} - Counter (tag: dimension)</li>
 *   <li>{@code texture.image.skipped} - Counter (tag: dimension)</li>
 *   <li>{@code texture.class.oversized} - Counter (tag: dimension)</li>
 *   <li>{@code texture.class.size} - DistributionSummary</li>
 *   <li>{@code texture.pairs.rejected} - DistributionSummary (tag: dimension)</li>
 *   <li>{@code texture.cache.hit} - Counter</li>
 *   <li>{@code texture.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final DistributionSummary classSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.classSizeSummary = DistributionSummary.builder("texture.class.size")
                .description("Distribution of equivalence class sizes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("texture.cache.hit")
                .description("Number of decoded image cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("texture.cache.miss")
                .description("Number of decoded image cache misses")
                .register(registry);
    }

    @Override
    public void recordPassDuration(SimilarityDimension dimension, int pass, Duration duration) {
        String key = dimension.name() + ":" + pass;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("texture.refinement.pass.duration")
                        .description("Duration of one refinement pass")
                        .tag("dimension", dimension.getKey())
                        .tag("pass", Integer.toString(pass))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordImagesIndexed(SimilarityDimension dimension, int count) {
        counter("texture.image.indexed", "Number of images inserted into a copy index", dimension)
                .increment(count);
    }

    @Override
    public void recordImagesSkipped(SimilarityDimension dimension, int count) {
        counter("texture.image.skipped", "Number of images skipped because they could not be read",
                dimension).increment(count);
    }

    @Override
    public void incrementOversizedClass(SimilarityDimension dimension) {
        counter("texture.class.oversized", "Number of classes above the maximum class size", dimension)
                .increment();
    }

    @Override
    public void recordClassSize(int size) {
        classSizeSummary.record(size);
    }

    @Override
    public void recordRejectedPairs(SimilarityDimension dimension, int count) {
        DistributionSummary summary = summaryCache.computeIfAbsent(dimension.name(), k ->
                DistributionSummary.builder("texture.pairs.rejected")
                        .description("Rejected pairs derived per reconciliation")
                        .tag("dimension", dimension.getKey())
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String description, SimilarityDimension dimension) {
        String key = name + ":" + dimension.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("dimension", dimension.getKey())
                        .register(registry));
    }
}

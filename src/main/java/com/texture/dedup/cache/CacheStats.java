package com.texture.dedup.cache;

/**
 * Snapshot of decoded image cache statistics.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}

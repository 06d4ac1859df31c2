package com.texture.dedup.cache;

/**
 * Configuration for the decoded image cache.
 *
 * @param maxSize    maximum number of decoded images kept in memory; an image is decoded
 *                   only once per pass if this is at least the number of candidates
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 2,000 images, 600s TTL, enabled. Larger corpora
     * get fewer hits and should raise {@code maxSize} if memory allows.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(2_000, 600, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}

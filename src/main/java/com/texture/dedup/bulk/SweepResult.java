package com.texture.dedup.bulk;

import java.util.List;

/**
 * Result of a parallel sweep.
 *
 * @param processed number of items whose task completed normally
 * @param skipped   items whose task failed, with the reason
 */
public record SweepResult(long processed, List<SkippedItem> skipped) {

    public SweepResult {
        skipped = List.copyOf(skipped);
    }

    public int skippedCount() {
        return skipped.size();
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }

    /**
     * An item excluded from the operation because its task failed.
     */
    public record SkippedItem(String item, String error) {}

    @Override
    public String toString() {
        return "SweepResult{processed=" + processed + ", skipped=" + skipped.size() + '}';
    }
}

package com.texture.dedup.bulk;

/**
 * Receives progress of a {@link ParallelSweep}: once when the sweep starts and once when
 * it ends, and from worker threads every hundred files in between.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param done  files finished so far, skipped files included
     * @param total files in the sweep
     * @param label the sweep label, such as {@code "Indexing"} or {@code "Finding copies"}
     */
    void onProgress(long done, long total, String label);

    ProgressCallback NOOP = (done, total, label) -> {};
}

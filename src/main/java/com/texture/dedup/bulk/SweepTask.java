package com.texture.dedup.bulk;

/**
 * Work performed for one item of a {@link ParallelSweep}.
 */
@FunctionalInterface
public interface SweepTask<T> {

    void process(T item) throws Exception;
}

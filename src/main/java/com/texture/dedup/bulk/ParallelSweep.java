package com.texture.dedup.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs an independent task per item on a fixed worker pool.
 *
 * <p>A failing item is logged with its identifier, recorded in the
 * {@link SweepResult} and excluded; it never aborts the sweep. The cancellation token
 * is checked before every item; once it is cancelled the remaining items are skipped
 * and {@link OperationCancelledException} is thrown after in-flight items finish.</p>
 */
public class ParallelSweep implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ParallelSweep.class);

    private static final int PROGRESS_INTERVAL = 100;

    private final ExecutorService executor;
    private final int parallelism;

    public ParallelSweep() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ParallelSweep(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.parallelism = parallelism;
        this.executor = Executors.newFixedThreadPool(parallelism);
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs {@code task} for every item and waits for all of them.
     *
     * @param label    short description used in progress messages and logs
     * @param items    the items to process
     * @param task     the per-item work
     * @param callback progress callback, may be null
     * @param token    cancellation token, may be null
     * @return the number of processed items and the skipped ones
     * @throws OperationCancelledException if the token was cancelled during the sweep
     */
    public <T> SweepResult forEach(String label, Collection<T> items, SweepTask<T> task,
                                   ProgressCallback callback, CancellationToken token) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        CancellationToken ct = token != null ? token : CancellationToken.NONE;
        ct.throwIfCancelled();

        long total = items.size();
        AtomicLong done = new AtomicLong();
        AtomicLong processed = new AtomicLong();
        List<SweepResult.SkippedItem> skipped = Collections.synchronizedList(new ArrayList<>());

        cb.onProgress(0, total, label);
        log.debug("sweep.started label={} items={}", label, total);

        List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.runAsync(() -> {
                if (ct.isCancelled()) {
                    return;
                }
                try {
                    task.process(item);
                    processed.incrementAndGet();
                } catch (OperationCancelledException e) {
                    return;
                } catch (Exception e) {
                    skipped.add(new SweepResult.SkippedItem(String.valueOf(item), String.valueOf(e.getMessage())));
                    log.warn("sweep.item.skipped label={} item={} error={}", label, item, e.getMessage());
                }
                long n = done.incrementAndGet();
                if (n % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(n, total, label);
                }
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Sweep '" + label + "' failed", cause);
        }

        if (ct.isCancelled()) {
            log.info("sweep.cancelled label={} processed={} total={}", label, processed.get(), total);
            throw new OperationCancelledException("Sweep '" + label + "' was cancelled");
        }

        SweepResult result = new SweepResult(processed.get(), skipped);
        cb.onProgress(total, total, label);
        log.debug("sweep.completed label={} result={}", label, result);
        return result;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

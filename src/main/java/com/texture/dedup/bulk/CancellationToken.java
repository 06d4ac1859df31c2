package com.texture.dedup.bulk;

/**
 * Cooperative cancellation flag shared between the caller and the workers of a
 * long-running operation. Workers check it between file-level units of work.
 */
public class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The NONE token cannot be cancelled");
        }
    };

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws OperationCancelledException if cancellation was requested
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new OperationCancelledException("Operation was cancelled");
        }
    }
}

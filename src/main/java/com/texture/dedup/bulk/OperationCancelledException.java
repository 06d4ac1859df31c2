package com.texture.dedup.bulk;

/**
 * Signals that a bulk operation stopped because its {@link CancellationToken} was
 * cancelled. This is a control-flow signal, not an error.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String message) {
        super(message);
    }
}

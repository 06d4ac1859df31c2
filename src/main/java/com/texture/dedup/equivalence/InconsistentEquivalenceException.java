package com.texture.dedup.equivalence;

/**
 * Thrown by the strict {@code add} operations of {@link EquivalenceCollection} when
 * an item already belongs to a different explicit class. This indicates inconsistent
 * input data and must not be ignored.
 */
public class InconsistentEquivalenceException extends RuntimeException {

    public InconsistentEquivalenceException(String message) {
        super(message);
    }
}

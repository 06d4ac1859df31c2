package com.texture.dedup.equivalence;

import java.util.Objects;

/**
 * Two distinct items in canonical order, {@code first < second}.
 */
public record UnorderedPair<T extends Comparable<T>>(T first, T second) implements Comparable<UnorderedPair<T>> {

    public UnorderedPair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException("Pair must be ordered and distinct: " + first + ", " + second);
        }
    }

    public static <T extends Comparable<T>> UnorderedPair<T> of(T a, T b) {
        return a.compareTo(b) <= 0 ? new UnorderedPair<>(a, b) : new UnorderedPair<>(b, a);
    }

    public boolean contains(T item) {
        return first.equals(item) || second.equals(item);
    }

    @Override
    public int compareTo(UnorderedPair<T> other) {
        int c = first.compareTo(other.first);
        return c != 0 ? c : second.compareTo(other.second);
    }

    @Override
    public String toString() {
        return "[" + first + ", " + second + "]";
    }
}

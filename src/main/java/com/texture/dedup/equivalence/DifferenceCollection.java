package com.texture.dedup.equivalence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set of pairs known to be different, such as pairs a reviewer rejected. Thread-safe.
 */
public class DifferenceCollection<T extends Comparable<T>> {

    private final Set<UnorderedPair<T>> pairs = new TreeSet<>();

    public DifferenceCollection() {
    }

    public DifferenceCollection(Collection<UnorderedPair<T>> pairs) {
        this.pairs.addAll(pairs);
    }

    /**
     * Every pair that shares an uncertain class but is not equal in {@code certain}.
     */
    public static <T extends Comparable<T>> DifferenceCollection<T> fromUncertain(
            EquivalenceCollection<T> uncertain, EquivalenceCollection<T> certain) {
        DifferenceCollection<T> result = new DifferenceCollection<>();
        for (Set<T> c : uncertain.getClasses()) {
            List<T> members = new ArrayList<>(c);
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    if (!certain.areEqual(members.get(i), members.get(j))) {
                        result.set(members.get(i), members.get(j));
                    }
                }
            }
        }
        return result;
    }

    /**
     * Records {@code a} and {@code b} as different. Ignored if they are the same item.
     */
    public synchronized void set(T a, T b) {
        if (a.compareTo(b) != 0) {
            pairs.add(UnorderedPair.of(a, b));
        }
    }

    public synchronized void setAll(DifferenceCollection<T> other) {
        pairs.addAll(other.getPairs());
    }

    public synchronized boolean areDifferent(T a, T b) {
        return a.compareTo(b) != 0 && pairs.contains(UnorderedPair.of(a, b));
    }

    /**
     * Drops every pair whose two items are equal in {@code certain}.
     *
     * @return the number of removed pairs
     */
    public synchronized int removeEqual(EquivalenceCollection<T> certain) {
        int before = pairs.size();
        pairs.removeIf(p -> certain.areEqual(p.first(), p.second()));
        return before - pairs.size();
    }

    /**
     * Snapshot of all pairs in sorted order.
     */
    public synchronized List<UnorderedPair<T>> getPairs() {
        return Collections.unmodifiableList(new ArrayList<>(pairs));
    }

    public synchronized int size() {
        return pairs.size();
    }

    public synchronized boolean isEmpty() {
        return pairs.isEmpty();
    }

    @Override
    public synchronized String toString() {
        return "DifferenceCollection{pairs=" + pairs.size() + '}';
    }
}

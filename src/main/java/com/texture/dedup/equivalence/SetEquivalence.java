package com.texture.dedup.equivalence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Union-find over the dense item indexes {@code 0..count-1}.
 *
 * <p>Every pointer always refers to an index no larger than its own
 * ({@code parent[i] <= i}). {@link #makeEqual} keeps it that way by redirecting the
 * larger of two pointers to the smaller one, which lets {@link #getEquivalenceSets}
 * label all classes in one forward pass.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class SetEquivalence {

    private final int[] parent;

    public SetEquivalence(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        parent = new int[count];
        for (int i = 0; i < count; i++) {
            parent[i] = i;
        }
    }

    public int getCount() {
        return parent.length;
    }

    /**
     * Puts {@code a} and {@code b} into the same class.
     */
    public void makeEqual(int a, int b) {
        checkIndex(a);
        checkIndex(b);

        // Walk both chains. Whenever the pointers differ, the item with the larger
        // pointer is redirected to the smaller one, and the walk continues from the
        // item its old pointer referred to so that its chain is merged as well.
        int aValue = parent[a];
        int bValue = parent[b];
        while (aValue != bValue) {
            if (aValue < bValue) {
                parent[b] = aValue;
                b = bValue;
                bValue = parent[b];
            } else {
                parent[a] = bValue;
                a = aValue;
                aValue = parent[a];
            }
        }
    }

    /**
     * Returns true if {@code a} and {@code b} are currently in the same class.
     */
    public boolean areEqual(int a, int b) {
        return find(a) == find(b);
    }

    private int find(int i) {
        checkIndex(i);
        while (parent[i] != i) {
            i = parent[i];
        }
        return i;
    }

    /**
     * Labels every class with a dense index {@code 0..K-1}, in order of the class's
     * smallest member. Does not modify this instance.
     */
    public EquivalenceSets getEquivalenceSets() {
        int[] labels = Arrays.copyOf(parent, parent.length);
        int counter = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == i) {
                labels[i] = counter++;
            } else {
                // labels[i] < i, already replaced by its root's label
                labels[i] = labels[labels[i]];
            }
        }
        return new EquivalenceSets(counter, labels);
    }

    /**
     * Merges overlapping observations into disjoint classes. Every observation with at
     * least two members unions its first member with all others.
     *
     * @param observations groups of item indexes observed to be similar
     * @param count        total number of items
     * @return all classes, singletons included, ordered by smallest member
     */
    public static List<List<Integer>> mergeOverlapping(Collection<int[]> observations, int count) {
        SetEquivalence eq = new SetEquivalence(count);
        for (int[] observation : observations) {
            if (observation.length < 2) {
                continue;
            }
            int first = observation[0];
            for (int i = 1; i < observation.length; i++) {
                eq.makeEqual(first, observation[i]);
            }
        }

        EquivalenceSets sets = eq.getEquivalenceSets();
        List<List<Integer>> classes = new ArrayList<>(sets.count());
        for (int i = 0; i < sets.count(); i++) {
            classes.add(new ArrayList<>());
        }
        for (int i = 0; i < count; i++) {
            classes.get(sets.classOf(i)).add(i);
        }
        return classes;
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= parent.length) {
            throw new IndexOutOfBoundsException("Index " + i + " out of range [0, " + parent.length + ")");
        }
    }

    /**
     * Dense class labelling.
     *
     * @param count   number of classes
     * @param indexes class index of every item
     */
    public record EquivalenceSets(int count, int[] indexes) {

        public int classOf(int item) {
            return indexes[item];
        }
    }
}

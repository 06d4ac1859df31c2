package com.texture.dedup.equivalence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Disjoint equivalence classes over arbitrary item identifiers.
 *
 * <p>Items are registered in an arena and addressed by slot. Each slot points directly
 * at the slot of its class root, and each root owns a class record with the member
 * slots. Merging two classes re-points the members of the smaller class at the root of
 * the larger and drops the smaller record. Classes of one item are never materialized:
 * an unknown item is its own implicit singleton.</p>
 *
 * <p>All operations are guarded by a read-write lock, so mutations are serialized and
 * queries see a consistent state.</p>
 *
 * @param <T> item type, must have value-based {@code equals}/{@code hashCode}
 */
public class EquivalenceCollection<T> {

    private final List<T> items = new ArrayList<>();
    private final Map<T, Integer> slots = new HashMap<>();
    private int[] root = new int[16];
    private final Map<Integer, List<Integer>> classes = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public EquivalenceCollection() {
    }

    /**
     * Creates a collection from existing classes, reconciling any overlaps.
     */
    public static <T> EquivalenceCollection<T> of(Collection<? extends Collection<T>> classes) {
        EquivalenceCollection<T> collection = new EquivalenceCollection<>();
        for (Collection<T> c : classes) {
            collection.set(c);
        }
        return collection;
    }

    /**
     * Marks {@code a} and {@code b} as equal, merging their classes if necessary.
     */
    public void set(T a, T b) {
        set(List.of(a, b));
    }

    /**
     * Marks all given items as equal, merging every class they touch.
     */
    public void set(Collection<T> group) {
        List<T> members = distinct(group);
        if (members.size() < 2) {
            return;
        }
        lock.writeLock().lock();
        try {
            int target = -1;
            for (T item : members) {
                Integer slot = slots.get(item);
                if (slot != null) {
                    int r = root[slot];
                    target = target == -1 ? r : union(target, r);
                }
            }
            joinAll(members, target);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks {@code a} and {@code b} as equal.
     *
     * @throws InconsistentEquivalenceException if they already belong to two different classes
     */
    public void add(T a, T b) {
        add(List.of(a, b));
    }

    /**
     * Adds a class. Items may already belong to at most one existing class, which the
     * other items then join.
     *
     * @throws InconsistentEquivalenceException if the items already belong to two or more
     *                                          different classes
     */
    public void add(Collection<T> group) {
        List<T> members = distinct(group);
        if (members.size() < 2) {
            return;
        }
        lock.writeLock().lock();
        try {
            int target = -1;
            T targetItem = null;
            for (T item : members) {
                Integer slot = slots.get(item);
                if (slot == null) {
                    continue;
                }
                int r = root[slot];
                if (target == -1) {
                    target = r;
                    targetItem = item;
                } else if (target != r) {
                    throw new InconsistentEquivalenceException("Cannot add " + members + ": '"
                            + targetItem + "' and '" + item + "' already belong to different classes");
                }
            }
            joinAll(members, target);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns true if both items are in the same class, or are the same item.
     */
    public boolean areEqual(T a, T b) {
        if (Objects.equals(a, b)) {
            return true;
        }
        lock.readLock().lock();
        try {
            Integer slotA = slots.get(a);
            Integer slotB = slots.get(b);
            return slotA != null && slotB != null && root[slotA] == root[slotB];
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the class of an item, or a singleton set if it has none.
     */
    public Set<T> get(T item) {
        lock.readLock().lock();
        try {
            Integer slot = slots.get(item);
            if (slot == null) {
                return Set.of(item);
            }
            return toSet(classes.get(root[slot]));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a stable key identifying the class of an item: the first item registered
     * in that class, or the item itself if it has no class.
     */
    public T classKey(T item) {
        lock.readLock().lock();
        try {
            Integer slot = slots.get(item);
            return slot == null ? item : items.get(root[slot]);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns true if the item belongs to an explicit class of two or more items.
     */
    public boolean contains(T item) {
        lock.readLock().lock();
        try {
            return slots.containsKey(item);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all explicit classes.
     */
    public List<Set<T>> getClasses() {
        lock.readLock().lock();
        try {
            List<Set<T>> result = new ArrayList<>(classes.size());
            for (List<Integer> members : classes.values()) {
                result.add(toSet(members));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of every item that belongs to an explicit class.
     */
    public Set<T> getItems() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(slots.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getClassCount() {
        lock.readLock().lock();
        try {
            return classes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of items in explicit classes.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return slots.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    // Caller holds the write lock.
    private void joinAll(List<T> members, int target) {
        if (target == -1) {
            target = register(members.get(0));
            List<Integer> record = new ArrayList<>();
            record.add(target);
            classes.put(target, record);
        }
        List<Integer> record = classes.get(target);
        for (T item : members) {
            if (!slots.containsKey(item)) {
                int slot = register(item);
                root[slot] = target;
                record.add(slot);
            }
        }
    }

    // Caller holds the write lock. Returns the surviving root.
    private int union(int rootA, int rootB) {
        if (rootA == rootB) {
            return rootA;
        }
        List<Integer> classA = classes.get(rootA);
        List<Integer> classB = classes.get(rootB);
        int larger = classA.size() >= classB.size() ? rootA : rootB;
        int smaller = larger == rootA ? rootB : rootA;

        List<Integer> moved = classes.remove(smaller);
        List<Integer> target = classes.get(larger);
        for (int slot : moved) {
            root[slot] = larger;
            target.add(slot);
        }
        return larger;
    }

    // Caller holds the write lock.
    private int register(T item) {
        int slot = items.size();
        items.add(item);
        slots.put(item, slot);
        if (slot == root.length) {
            int[] grown = new int[root.length * 2];
            System.arraycopy(root, 0, grown, 0, root.length);
            root = grown;
        }
        root[slot] = slot;
        return slot;
    }

    private Set<T> toSet(List<Integer> members) {
        Set<T> set = new LinkedHashSet<>(members.size() * 2);
        for (int slot : members) {
            set.add(items.get(slot));
        }
        return Collections.unmodifiableSet(set);
    }

    private static <T> List<T> distinct(Collection<T> group) {
        Objects.requireNonNull(group, "group is required");
        List<T> result = new ArrayList<>(new LinkedHashSet<>(group));
        for (T item : result) {
            Objects.requireNonNull(item, "items must not be null");
        }
        return result;
    }

    @Override
    public String toString() {
        return "EquivalenceCollection{classes=" + getClassCount() + ", items=" + size() + '}';
    }
}

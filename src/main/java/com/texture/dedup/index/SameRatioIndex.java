package com.texture.dedup.index;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.CandidateEntry;
import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.hash.ImageHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Inverted grid index over the fingerprints of images that share one aspect ratio.
 *
 * <p>The grid has one bucket per (byte position, byte value) pair. Inserting an image
 * adds its entry ID to the bucket {@code (i, fingerprint[i])} for every position
 * {@code i}. A query with spread {@code s} takes, per position, the union of the
 * buckets for values within {@code +-s} of the observed value and ANDs the per-position
 * sets together; only entries close at every position survive.</p>
 *
 * <p>Entry IDs are dense insertion indexes, so the per-position sets are bit sets and
 * the AND costs {@code O(N / 64)}. The index is append-only.</p>
 */
public class SameRatioIndex {
    private static final Logger log = LoggerFactory.getLogger(SameRatioIndex.class);

    public static final int MAX_SPREAD = 255;
    private static final int VALUES = 256;

    private final ImageHasher hasher;
    private final int byteCount;
    private final List<CandidateEntry> entries = new ArrayList<>();
    private final IdList[] grid;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public SameRatioIndex(ImageHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher is required");
        this.byteCount = hasher.getByteCount();
        this.grid = new IdList[Math.multiplyExact(byteCount, VALUES)];
    }

    public AspectRatio getRatio() {
        return hasher.getRatio();
    }

    /**
     * Inserts an image.
     *
     * @return false if no fingerprint could be computed for the image
     */
    public boolean addImage(PixelBuffer image, String id) {
        Objects.requireNonNull(id, "id is required");
        Optional<byte[]> fingerprint = hasher.tryGetBytes(image);
        if (fingerprint.isEmpty()) {
            log.debug("Not indexing {} ({}x{}): no fingerprint for ratio {}",
                    id, image.getWidth(), image.getHeight(), getRatio());
            return false;
        }
        byte[] bytes = fingerprint.get();

        lock.writeLock().lock();
        try {
            int entryId = entries.size();
            entries.add(new CandidateEntry(id, image.getWidth(), image.getHeight()));
            for (int i = 0; i < bytes.length; i++) {
                cell(i, bytes[i] & 0xFF).add(entryId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return true;
    }

    /**
     * Finds all indexed images whose fingerprint is within {@code spread} of the query
     * image's fingerprint at every byte position.
     *
     * @return the matching entries in insertion order, or empty if the query image has
     *         no fingerprint
     */
    public Optional<List<CandidateEntry>> getSimilar(PixelBuffer image, int spread) {
        if (spread < 0 || spread > MAX_SPREAD) {
            throw new IllegalArgumentException("spread must be in [0, 255], got " + spread);
        }
        Optional<byte[]> fingerprint = hasher.tryGetBytes(image);
        if (fingerprint.isEmpty()) {
            return Optional.empty();
        }
        byte[] bytes = fingerprint.get();

        lock.readLock().lock();
        try {
            int count = entries.size();
            BitSet acc = null;
            for (int i = 0; i < bytes.length; i++) {
                BitSet position = collect(i, bytes[i] & 0xFF, spread, count);
                if (acc == null) {
                    acc = position;
                } else {
                    acc.and(position);
                }
                if (acc.isEmpty()) {
                    break;
                }
            }

            List<CandidateEntry> result = new ArrayList<>();
            if (acc != null) {
                for (int id = acc.nextSetBit(0); id >= 0; id = acc.nextSetBit(id + 1)) {
                    result.add(entries.get(id));
                }
            }
            return Optional.of(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    private BitSet collect(int position, int value, int spread, int count) {
        BitSet set = new BitSet(count);
        int from = Math.max(0, value - spread);
        int to = Math.min(VALUES - 1, value + spread);
        for (int v = from; v <= to; v++) {
            IdList ids = grid[position * VALUES + v];
            if (ids != null) {
                ids.setAll(set);
            }
        }
        return set;
    }

    private IdList cell(int position, int value) {
        int index = position * VALUES + value;
        IdList ids = grid[index];
        if (ids == null) {
            ids = new IdList();
            grid[index] = ids;
        }
        return ids;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Growable list of entry IDs for one grid bucket.
     */
    private static final class IdList {
        private int[] ids = new int[4];
        private int size;

        void add(int id) {
            if (size == ids.length) {
                int[] grown = new int[size * 2];
                System.arraycopy(ids, 0, grown, 0, size);
                ids = grown;
            }
            ids[size++] = id;
        }

        void setAll(BitSet set) {
            for (int i = 0; i < size; i++) {
                set.set(ids[i]);
            }
        }
    }
}

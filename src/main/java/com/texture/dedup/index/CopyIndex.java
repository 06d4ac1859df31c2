package com.texture.dedup.index;

import com.texture.dedup.bulk.CancellationToken;
import com.texture.dedup.bulk.ParallelSweep;
import com.texture.dedup.bulk.ProgressCallback;
import com.texture.dedup.bulk.SweepResult;
import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.CandidateEntry;
import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.equivalence.SetEquivalence;
import com.texture.dedup.hash.HasherFactory;
import com.texture.dedup.source.PixelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Corpus-wide copy detection index. Images are routed to one {@link SameRatioIndex}
 * per aspect ratio, so images of different shapes are never compared.
 */
public class CopyIndex {
    private static final Logger log = LoggerFactory.getLogger(CopyIndex.class);

    private final HasherFactory hasherFactory;
    private final ConcurrentMap<AspectRatio, SameRatioIndex> indexes = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    private final Set<String> unsupported = ConcurrentHashMap.newKeySet();

    public CopyIndex(HasherFactory hasherFactory) {
        this.hasherFactory = Objects.requireNonNull(hasherFactory, "hasherFactory is required");
    }

    /**
     * Inserts an image.
     *
     * @return false if the image has no power-of-two size or no fingerprint could be
     *         computed for it; the id is then listed by {@link #getUnsupported()}
     */
    public boolean addImage(PixelBuffer image, String id) {
        if (!image.hasPowerOfTwoSize()) {
            log.debug("Not indexing {} ({}x{}): size is not a power of two",
                    id, image.getWidth(), image.getHeight());
            unsupported.add(id);
            return false;
        }
        if (!indexFor(AspectRatio.of(image)).addImage(image, id)) {
            unsupported.add(id);
            return false;
        }
        return true;
    }

    /**
     * Finds indexed images similar to {@code image}.
     *
     * @return the matches, an empty list if no image of the same aspect ratio was indexed,
     *         or empty if the query image has no fingerprint
     */
    public Optional<List<CandidateEntry>> getSimilar(PixelBuffer image, int spread) {
        if (!image.hasPowerOfTwoSize()) {
            return Optional.empty();
        }
        SameRatioIndex index = indexes.get(AspectRatio.of(image));
        if (index == null) {
            return Optional.of(List.of());
        }
        return index.getSimilar(image, spread);
    }

    private SameRatioIndex indexFor(AspectRatio ratio) {
        SameRatioIndex index = indexes.get(ratio);
        if (index != null) {
            return index;
        }
        synchronized (creationLock) {
            index = indexes.get(ratio);
            if (index == null) {
                index = new SameRatioIndex(hasherFactory.create(ratio));
                indexes.put(ratio, index);
                log.debug("index.ratio.created ratio={}", ratio);
            }
            return index;
        }
    }

    /**
     * Loads and inserts every image in parallel. Images that fail to load are skipped.
     *
     * @return the sweep outcome; {@link #size()} tells how many images were indexed
     */
    public SweepResult addAll(Collection<String> ids, PixelSource source, ParallelSweep sweep,
                              ProgressCallback callback, CancellationToken token) {
        SweepResult result = sweep.forEach("Indexing", ids, id -> addImage(source.load(id), id), callback, token);
        log.info("index.built images={} indexed={} unsupported={} skipped={} ratios={}",
                ids.size(), size(), unsupported.size(), result.skippedCount(), getRatios());
        return result;
    }

    /**
     * Groups {@code ids} into disjoint equivalence classes. Every id is queried against
     * the index; each query returning at least two images becomes an observation, and
     * all observations are merged.
     *
     * @return every class with at least two members, ordered by the position of their
     *         first member in {@code ids}, and the images the query sweep could not load
     */
    public CopyClasses getEquivalenceClasses(List<String> ids, PixelSource source, int spread,
                                                   ParallelSweep sweep, ProgressCallback callback,
                                                   CancellationToken token) {
        return getEquivalenceClasses(ids, source, spread, id -> 0, sweep, callback, token);
    }

    /**
     * Like {@link #getEquivalenceClasses(List, PixelSource, int, ParallelSweep, ProgressCallback,
     * CancellationToken)}, but a match only counts if it is in the same partition as the
     * queried id. Matches outside {@code ids} are always ignored.
     */
    public CopyClasses getEquivalenceClasses(List<String> ids, PixelSource source, int spread,
                                             Function<String, ?> partition,
                                             ParallelSweep sweep, ProgressCallback callback,
                                             CancellationToken token) {
        Map<String, Integer> positions = new HashMap<>(ids.size() * 2);
        for (int i = 0; i < ids.size(); i++) {
            positions.putIfAbsent(ids.get(i), i);
        }

        List<int[]> observations = Collections.synchronizedList(new ArrayList<>());
        SweepResult query = sweep.forEach("Finding copies", ids, id -> {
            Optional<List<CandidateEntry>> similar = getSimilar(source.load(id), spread);
            if (similar.isEmpty() || similar.get().size() < 2) {
                return;
            }
            Object group = partition.apply(id);
            Set<Integer> members = new LinkedHashSet<>();
            members.add(positions.get(id));
            for (CandidateEntry entry : similar.get()) {
                Integer position = positions.get(entry.id());
                if (position != null && Objects.equals(group, partition.apply(entry.id()))) {
                    members.add(position);
                }
            }
            if (members.size() >= 2) {
                observations.add(members.stream().mapToInt(Integer::intValue).toArray());
            }
        }, callback, token);

        List<Set<String>> classes = new ArrayList<>();
        for (List<Integer> members : SetEquivalence.mergeOverlapping(observations, ids.size())) {
            if (members.size() < 2) {
                continue;
            }
            Set<String> c = new LinkedHashSet<>();
            for (int position : members) {
                c.add(ids.get(position));
            }
            classes.add(c);
        }
        log.debug("index.classes ids={} observations={} classes={} skipped={}",
                ids.size(), observations.size(), classes.size(), query.skippedCount());
        return new CopyClasses(classes, query);
    }

    public Set<AspectRatio> getRatios() {
        return Collections.unmodifiableSet(indexes.keySet());
    }

    /**
     * Ids of loaded images that could not be fingerprinted: sizes that are not a power
     * of two, or images smaller than the fingerprint of their aspect ratio.
     */
    public Set<String> getUnsupported() {
        return Collections.unmodifiableSet(new TreeSet<>(unsupported));
    }

    /**
     * Number of indexed images.
     */
    public int size() {
        int size = 0;
        for (SameRatioIndex index : indexes.values()) {
            size += index.size();
        }
        return size;
    }
}

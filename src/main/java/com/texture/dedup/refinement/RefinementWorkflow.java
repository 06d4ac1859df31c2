package com.texture.dedup.refinement;

import com.texture.dedup.bulk.CancellationToken;
import com.texture.dedup.bulk.ParallelSweep;
import com.texture.dedup.bulk.ProgressCallback;
import com.texture.dedup.bulk.SweepResult;
import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.equivalence.EquivalenceCollection;
import com.texture.dedup.index.CopyClasses;
import com.texture.dedup.index.CopyIndex;
import com.texture.dedup.logging.LogContext;
import com.texture.dedup.metrics.MetricsService;
import com.texture.dedup.metrics.NoOpMetricsService;
import com.texture.dedup.source.PixelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Multi-pass copy detection for one similarity dimension.
 *
 * <p>Pass 1 fingerprints every candidate at the coarsest resolution and groups them
 * into classes. A class is scored by the number of distinct certain classes among its
 * members (an item without a certain class counts on its own). Classes scoring at most
 * {@link RefinementOptions#getMaxEqClassSize()} are accepted. The members of every
 * other class become the candidates of the next pass, which fingerprints at four times
 * the pixel budget and only matches images that shared a class in the previous pass.
 * On the last pass, oversized classes are accepted as they are.</p>
 *
 * <p>A member of an oversized class may be too small for the finer fingerprint of a
 * later pass. It keeps its earlier agreement by joining the largest class its group
 * mates form in that pass. If the group forms no class at all, the whole group is
 * accepted as it was, as a best-effort class.</p>
 *
 * <p>A pass completes entirely before the next one starts. Images that fail to load are
 * logged and left out of the pass.</p>
 */
public class RefinementWorkflow {
    private static final Logger log = LoggerFactory.getLogger(RefinementWorkflow.class);

    private final PixelSource source;
    private final ParallelSweep sweep;
    private final MetricsService metrics;

    public RefinementWorkflow(PixelSource source, ParallelSweep sweep) {
        this(source, sweep, new NoOpMetricsService());
    }

    public RefinementWorkflow(PixelSource source, ParallelSweep sweep, MetricsService metrics) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.sweep = Objects.requireNonNull(sweep, "sweep is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Runs all passes over {@code ids}.
     *
     * @param dimension the dimension to refine, selects the fingerprint and default spread
     * @param ids       the candidate images
     * @param certain   the confirmed classes used to score class sizes; not modified
     * @param options   pass limit, class size ceiling and spread
     * @param callback  progress callback, may be null
     * @param token     cancellation token, may be null
     * @return the suggested classes
     * @throws com.texture.dedup.bulk.OperationCancelledException if the token is cancelled
     */
    public RefinementResult run(SimilarityDimension dimension, Collection<String> ids,
                                EquivalenceCollection<String> certain, RefinementOptions options,
                                ProgressCallback callback, CancellationToken token) {
        int spread = options.getSpread(dimension);
        EquivalenceCollection<String> uncertain = new EquivalenceCollection<>();
        List<PassSummary> passes = new ArrayList<>();
        List<Set<String>> bestEffort = new ArrayList<>();
        List<SweepResult.SkippedItem> skipped = new ArrayList<>();
        Set<String> skippedIds = new HashSet<>();

        List<List<String>> groups = new ArrayList<>();
        groups.add(new ArrayList<>(new TreeSet<>(ids)));

        log.info("refinement.started dimension={} images={} options={}", dimension.getKey(), ids.size(), options);

        for (int pass = 1; pass <= options.getMaxPasses() && !groups.isEmpty(); pass++) {
            try (LogContext ignored = LogContext.forPass(pass)) {
                long start = System.nanoTime();
                boolean lastPass = pass == options.getMaxPasses();

                List<String> candidates = new ArrayList<>();
                Map<String, Integer> groupOf = new HashMap<>();
                for (int g = 0; g < groups.size(); g++) {
                    for (String id : groups.get(g)) {
                        candidates.add(id);
                        groupOf.put(id, g);
                    }
                }

                CopyIndex index = new CopyIndex(dimension.getStrategy().forPass(pass));
                SweepResult indexing = index.addAll(candidates, source, sweep, callback, token);
                metrics.recordImagesIndexed(dimension, index.size());

                CopyClasses found = index.getEquivalenceClasses(
                        candidates, source, spread, groupOf::get, sweep, callback, token);
                List<SweepResult.SkippedItem> passSkipped = mergeSkipped(indexing.skipped(), found.skipped());
                for (SweepResult.SkippedItem item : passSkipped) {
                    if (skippedIds.add(item.item())) {
                        skipped.add(item);
                    }
                }
                metrics.recordImagesSkipped(dimension, passSkipped.size());

                Set<String> unsupported = index.getUnsupported();
                List<Set<String>> classes = found.classes();
                List<Set<String>> unrefinable = new ArrayList<>();
                if (pass > 1 && !unsupported.isEmpty()) {
                    classes = attachUnsupported(groups, groupOf, classes, unsupported, unrefinable);
                }

                List<List<String>> next = new ArrayList<>();
                int accepted = 0;
                int oversized = 0;
                for (Set<String> c : classes) {
                    metrics.recordClassSize(c.size());
                    int score = distinctCertain(c, certain);
                    if (score <= options.getMaxEqClassSize()) {
                        uncertain.set(c);
                        accepted++;
                        continue;
                    }

                    oversized++;
                    metrics.incrementOversizedClass(dimension);
                    if (lastPass) {
                        log.warn("refinement.class.bestEffort size={} distinctCertain={} maxEqClassSize={}",
                                c.size(), score, options.getMaxEqClassSize());
                        uncertain.set(c);
                        bestEffort.add(c);
                    } else {
                        log.debug("refinement.class.oversized size={} distinctCertain={}", c.size(), score);
                        next.add(new ArrayList<>(new TreeSet<>(c)));
                    }
                }
                for (Set<String> group : unrefinable) {
                    log.warn("refinement.group.unrefinable size={} reason=noClassAtFinerResolution", group.size());
                    uncertain.set(group);
                    bestEffort.add(group);
                }

                Duration duration = Duration.ofNanos(System.nanoTime() - start);
                metrics.recordPassDuration(dimension, pass, duration);
                PassSummary summary = new PassSummary(pass, candidates.size(), index.size(),
                        passSkipped.size(), unsupported.size(), accepted, oversized, duration);
                passes.add(summary);
                log.info("refinement.pass.completed pass={} candidates={} indexed={} unsupported={} accepted={} oversized={} durationMs={}",
                        pass, summary.candidates(), summary.indexed(), unsupported.size(), accepted, oversized,
                        duration.toMillis());

                groups = next;
            }
        }

        log.info("refinement.completed dimension={} passes={} classes={} bestEffort={} skipped={}",
                dimension.getKey(), passes.size(), uncertain.getClassCount(), bestEffort.size(), skipped.size());
        return new RefinementResult(dimension, uncertain, passes, bestEffort, skipped);
    }

    /**
     * Adds the members of each group that this pass could not fingerprint to the largest
     * class found in that group; on a tie, the class listed first. Groups with such
     * members but no class are collected in {@code unrefinable}.
     */
    static List<Set<String>> attachUnsupported(List<List<String>> groups, Map<String, Integer> groupOf,
                                               List<Set<String>> classes, Set<String> unsupported,
                                               List<Set<String>> unrefinable) {
        List<Set<String>> result = new ArrayList<>(classes.size());
        Map<Integer, Integer> largest = new HashMap<>();
        for (Set<String> c : classes) {
            int index = result.size();
            result.add(new LinkedHashSet<>(c));
            Integer group = groupOf.get(c.iterator().next());
            Integer current = largest.get(group);
            if (current == null || c.size() > result.get(current).size()) {
                largest.put(group, index);
            }
        }

        for (int g = 0; g < groups.size(); g++) {
            List<String> stranded = new ArrayList<>();
            for (String id : groups.get(g)) {
                if (unsupported.contains(id)) {
                    stranded.add(id);
                }
            }
            if (stranded.isEmpty()) {
                continue;
            }
            Integer target = largest.get(g);
            if (target == null) {
                unrefinable.add(new TreeSet<>(groups.get(g)));
            } else {
                log.debug("refinement.members.attached count={} classSize={}", stranded.size(), result.get(target).size());
                result.get(target).addAll(stranded);
            }
        }
        return result;
    }

    /**
     * Skips of the index and query sweeps, one entry per image.
     */
    private static List<SweepResult.SkippedItem> mergeSkipped(List<SweepResult.SkippedItem> indexing,
                                                             List<SweepResult.SkippedItem> query) {
        List<SweepResult.SkippedItem> merged = new ArrayList<>(indexing);
        Set<String> seen = new HashSet<>();
        for (SweepResult.SkippedItem item : indexing) {
            seen.add(item.item());
        }
        for (SweepResult.SkippedItem item : query) {
            if (seen.add(item.item())) {
                merged.add(item);
            }
        }
        return merged;
    }

    /**
     * Number of distinct certain classes among the members of {@code c}.
     */
    static int distinctCertain(Set<String> c, EquivalenceCollection<String> certain) {
        Set<String> keys = new HashSet<>();
        for (String item : c) {
            keys.add(certain.classKey(item));
        }
        return keys.size();
    }
}

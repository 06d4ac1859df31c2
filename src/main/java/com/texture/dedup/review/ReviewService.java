package com.texture.dedup.review;

import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.equivalence.DifferenceCollection;
import com.texture.dedup.equivalence.EquivalenceCollection;
import com.texture.dedup.ledger.LedgerStore;
import com.texture.dedup.ledger.TriStateLedger;
import com.texture.dedup.logging.LogContext;
import com.texture.dedup.metrics.MetricsService;
import com.texture.dedup.metrics.NoOpMetricsService;
import com.texture.dedup.refinement.Reconciler;
import com.texture.dedup.representative.RepresentativeMapper;
import com.texture.dedup.representative.RepresentativeSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;

/**
 * The two sides of the manual review step: listing the uncertain classes a reviewer
 * still has to look at, and accepting the classes the reviewer confirmed. Accepting
 * rewrites the certain ledger, derives the rejected pairs and regenerates the
 * representative map.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    public static final int DEFAULT_REVIEW_LIMIT = 25;

    private final LedgerStore store;
    private final RepresentativeSelector selector;
    private final MetricsService metrics;
    private final int reviewLimit;

    public ReviewService(LedgerStore store, RepresentativeSelector selector) {
        this(store, selector, new NoOpMetricsService(), DEFAULT_REVIEW_LIMIT);
    }

    public ReviewService(LedgerStore store, RepresentativeSelector selector, MetricsService metrics,
                         int reviewLimit) {
        if (reviewLimit <= 0) {
            throw new IllegalArgumentException("reviewLimit must be positive");
        }
        this.store = store;
        this.selector = selector;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.reviewLimit = reviewLimit;
    }

    /**
     * Lists the uncertain classes with members still to review, ordered by
     * representative. Members already certain or rejected against the representative
     * are left out. Classes with more pending members than the review limit are
     * skipped.
     */
    public List<ReviewCandidate> getPendingClasses(SimilarityDimension dimension) {
        TriStateLedger ledger = store.load(dimension);
        List<ReviewCandidate> candidates = new ArrayList<>();
        int tooLarge = 0;
        for (Set<String> c : ledger.uncertain().getClasses()) {
            String representative = selector.select(c);
            List<String> pending = new ArrayList<>();
            for (String item : c) {
                if (!item.equals(representative)
                        && !ledger.certain().areEqual(representative, item)
                        && !ledger.rejected().areDifferent(representative, item)) {
                    pending.add(item);
                }
            }
            if (pending.isEmpty()) {
                continue;
            }
            if (pending.size() > reviewLimit) {
                log.warn("review.class.tooLarge representative={} pending={} limit={}",
                        representative, pending.size(), reviewLimit);
                tooLarge++;
                continue;
            }
            pending.sort(Comparator.naturalOrder());
            candidates.add(new ReviewCandidate(representative, pending, c.size()));
        }
        candidates.sort(Comparator.comparing(ReviewCandidate::representative));
        log.info("review.pending dimension={} classes={} tooLarge={}", dimension.getKey(), candidates.size(), tooLarge);
        return candidates;
    }

    /**
     * Merges the confirmed classes into the certain ledger and reconciles the rest:
     * every uncertain pair that is still not certain becomes rejected.
     *
     * @return the updated ledger
     */
    public TriStateLedger acceptCertain(SimilarityDimension dimension, EquivalenceCollection<String> confirmed) {
        try (LogContext ignored = LogContext.forReview(LogContext.generateRunId(), dimension.getKey())) {
            TriStateLedger ledger = store.load(dimension);
            EquivalenceCollection<String> certain = merge(ledger.certain(), confirmed);
            DifferenceCollection<String> rejected = Reconciler.reconcile(ledger.uncertain(), certain, ledger.rejected());
            write(dimension, certain, rejected);

            log.info("review.accepted dimension={} confirmedClasses={} certainClasses={} rejectedPairs={}",
                    dimension.getKey(), confirmed.getClassCount(), certain.getClassCount(), rejected.size());
            return new TriStateLedger(certain, ledger.uncertain(), rejected);
        }
    }

    /**
     * Merges classes into the certain ledger without deriving new rejected pairs.
     * Rejected pairs that the merge confirms are dropped.
     *
     * @return the updated ledger
     */
    public TriStateLedger addCertain(SimilarityDimension dimension, EquivalenceCollection<String> confirmed) {
        TriStateLedger ledger = store.load(dimension);
        EquivalenceCollection<String> certain = merge(ledger.certain(), confirmed);
        DifferenceCollection<String> rejected = ledger.rejected();
        rejected.removeEqual(certain);
        write(dimension, certain, rejected);

        log.info("review.certainAdded dimension={} addedClasses={} certainClasses={}",
                dimension.getKey(), confirmed.getClassCount(), certain.getClassCount());
        return new TriStateLedger(certain, ledger.uncertain(), rejected);
    }

    private static EquivalenceCollection<String> merge(EquivalenceCollection<String> certain,
                                                       EquivalenceCollection<String> confirmed) {
        for (Set<String> c : confirmed.getClasses()) {
            certain.set(c);
        }
        return certain;
    }

    private void write(SimilarityDimension dimension, EquivalenceCollection<String> certain,
                       DifferenceCollection<String> rejected) {
        SortedMap<String, String> representatives = new RepresentativeMapper(selector).map(certain);
        store.writeCertain(dimension, certain);
        store.writeRejected(dimension, rejected);
        store.writeRepresentatives(dimension, representatives);
        metrics.recordRejectedPairs(dimension, rejected.size());
    }

    /**
     * Recomputes the rejected pairs from the persisted uncertain and certain ledgers.
     */
    public DifferenceCollection<String> updateRejected(SimilarityDimension dimension) {
        try (LogContext ignored = LogContext.forReview(LogContext.generateRunId(), dimension.getKey())) {
            TriStateLedger ledger = store.load(dimension);
            DifferenceCollection<String> rejected =
                    Reconciler.reconcile(ledger.uncertain(), ledger.certain(), ledger.rejected());
            store.writeRejected(dimension, rejected);
            metrics.recordRejectedPairs(dimension, rejected.size());
            return rejected;
        }
    }

    /**
     * Rebuilds and writes the representative map from the certain ledger.
     */
    public SortedMap<String, String> regenerateRepresentatives(SimilarityDimension dimension) {
        SortedMap<String, String> representatives =
                new RepresentativeMapper(selector).map(store.readCertain(dimension));
        store.writeRepresentatives(dimension, representatives);
        return representatives;
    }
}

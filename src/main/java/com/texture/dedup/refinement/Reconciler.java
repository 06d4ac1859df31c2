package com.texture.dedup.refinement;

import com.texture.dedup.equivalence.DifferenceCollection;
import com.texture.dedup.equivalence.EquivalenceCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the rejected pairs after review: every pair suggested together in the
 * uncertain ledger that the certain ledger does not confirm is rejected. Previously
 * rejected pairs stay rejected unless the certain ledger now confirms them.
 */
public final class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private Reconciler() {
    }

    public static DifferenceCollection<String> reconcile(EquivalenceCollection<String> uncertain,
                                                         EquivalenceCollection<String> certain,
                                                         DifferenceCollection<String> previouslyRejected) {
        DifferenceCollection<String> rejected = new DifferenceCollection<>(previouslyRejected.getPairs());
        rejected.setAll(DifferenceCollection.fromUncertain(uncertain, certain));
        int confirmed = rejected.removeEqual(certain);
        log.info("reconcile.completed rejected={} previouslyRejected={} nowCertain={}",
                rejected.size(), previouslyRejected.size(), confirmed);
        return rejected;
    }
}

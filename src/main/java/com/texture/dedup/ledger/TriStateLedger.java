package com.texture.dedup.ledger;

import com.texture.dedup.equivalence.DifferenceCollection;
import com.texture.dedup.equivalence.EquivalenceCollection;
import com.texture.dedup.equivalence.UnorderedPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The certain, uncertain and rejected state of one similarity dimension.
 */
public record TriStateLedger(EquivalenceCollection<String> certain,
                             EquivalenceCollection<String> uncertain,
                             DifferenceCollection<String> rejected) {

    public TriStateLedger {
        Objects.requireNonNull(certain, "certain is required");
        Objects.requireNonNull(uncertain, "uncertain is required");
        Objects.requireNonNull(rejected, "rejected is required");
    }

    public static TriStateLedger empty() {
        return new TriStateLedger(new EquivalenceCollection<>(), new EquivalenceCollection<>(),
                new DifferenceCollection<>());
    }

    /**
     * Rejected pairs whose items are nonetheless equal in the certain ledger. Empty for
     * a consistent ledger.
     */
    public List<UnorderedPair<String>> findConflicts() {
        List<UnorderedPair<String>> conflicts = new ArrayList<>();
        for (UnorderedPair<String> pair : rejected.getPairs()) {
            if (certain.areEqual(pair.first(), pair.second())) {
                conflicts.add(pair);
            }
        }
        return conflicts;
    }

    public boolean isConsistent() {
        return findConflicts().isEmpty();
    }
}

package com.texture.dedup.api;

import com.texture.dedup.equivalence.UnorderedPair;
import com.texture.dedup.refinement.RefinementResult;

import java.util.List;

/**
 * Outcome of {@link TextureEquivalenceService#refine}.
 *
 * @param refinement     the suggested classes and per-pass details
 * @param identicalPairs pairs proven identical and added to the certain ledger
 */
public record RefinementReport(RefinementResult refinement, List<UnorderedPair<String>> identicalPairs) {

    public RefinementReport {
        identicalPairs = List.copyOf(identicalPairs);
    }
}

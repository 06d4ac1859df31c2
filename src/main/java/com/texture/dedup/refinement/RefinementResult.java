package com.texture.dedup.refinement;

import com.texture.dedup.bulk.SweepResult;
import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.equivalence.EquivalenceCollection;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a refinement run.
 *
 * @param dimension  the similarity dimension that was refined
 * @param uncertain  the suggested classes
 * @param passes     per-pass summaries in order
 * @param bestEffort oversized classes accepted as-is because the pass limit was reached
 * @param skipped    images that failed to load in any sweep, each listed once
 */
public record RefinementResult(SimilarityDimension dimension,
                               EquivalenceCollection<String> uncertain,
                               List<PassSummary> passes,
                               List<Set<String>> bestEffort,
                               List<SweepResult.SkippedItem> skipped) {

    public int passCount() {
        return passes.size();
    }

    public boolean hasBestEffortClasses() {
        return !bestEffort.isEmpty();
    }
}

package com.texture.dedup.index;

import com.texture.dedup.bulk.SweepResult;

import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link CopyIndex#getEquivalenceClasses}.
 *
 * @param classes the classes with at least two members
 * @param query   the query sweep; images that failed to load are listed as skipped
 */
public record CopyClasses(List<Set<String>> classes, SweepResult query) {

    public List<SweepResult.SkippedItem> skipped() {
        return query.skipped();
    }
}

package com.texture.dedup.refinement;

import java.time.Duration;

/**
 * Outcome of one refinement pass.
 *
 * @param pass        pass number, starting at 1
 * @param candidates  number of images the pass started with
 * @param indexed     number of images that got a fingerprint
 * @param skipped     number of images that failed to load
 * @param unsupported number of loaded images too small or irregular for this pass's fingerprint
 * @param accepted    number of classes accepted in this pass
 * @param oversized   number of classes handed to the next pass, or accepted as-is on the last pass
 * @param duration    wall time of the pass
 */
public record PassSummary(int pass, int candidates, int indexed, int skipped, int unsupported,
                          int accepted, int oversized, Duration duration) {
}

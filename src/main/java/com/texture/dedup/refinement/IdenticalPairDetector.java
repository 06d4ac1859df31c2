package com.texture.dedup.refinement;

import com.texture.dedup.bulk.CancellationToken;
import com.texture.dedup.bulk.ParallelSweep;
import com.texture.dedup.bulk.ProgressCallback;
import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.equivalence.UnorderedPair;
import com.texture.dedup.source.ImageDecodeException;
import com.texture.dedup.source.PixelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds members of suggested classes that are pixel-for-pixel identical within a
 * tolerance. Such pairs need no review and can go straight to the certain ledger.
 */
public class IdenticalPairDetector {
    private static final Logger log = LoggerFactory.getLogger(IdenticalPairDetector.class);

    private final PixelSource source;
    private final ParallelSweep sweep;

    public IdenticalPairDetector(PixelSource source, ParallelSweep sweep) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.sweep = Objects.requireNonNull(sweep, "sweep is required");
    }

    /**
     * Returns every identical pair within each class, sorted.
     */
    public List<UnorderedPair<String>> detect(Collection<Set<String>> classes, IdenticalityTolerance tolerance,
                                              ProgressCallback callback, CancellationToken token) {
        CancellationToken ct = token != null ? token : CancellationToken.NONE;
        List<UnorderedPair<String>> identical = Collections.synchronizedList(new ArrayList<>());
        sweep.forEach("Finding identical", classes, c -> identical.addAll(detect(c, tolerance, ct)),
                callback, ct);

        List<UnorderedPair<String>> result = new ArrayList<>(identical);
        Collections.sort(result);
        log.info("identical.detected classes={} pairs={}", classes.size(), result.size());
        return result;
    }

    private List<UnorderedPair<String>> detect(Set<String> members, IdenticalityTolerance tolerance,
                                               CancellationToken token) {
        List<String> ids = new ArrayList<>();
        List<PixelBuffer> images = new ArrayList<>();
        for (String id : members) {
            token.throwIfCancelled();
            try {
                images.add(source.load(id));
                ids.add(id);
            } catch (ImageDecodeException e) {
                log.warn("identical.item.skipped item={} error={}", id, e.getMessage());
            }
        }

        List<UnorderedPair<String>> pairs = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            for (int j = i + 1; j < images.size(); j++) {
                if (areIdentical(images.get(i), images.get(j), tolerance)) {
                    pairs.add(UnorderedPair.of(ids.get(i), ids.get(j)));
                }
            }
        }
        return pairs;
    }

    /**
     * True if both images have the same size and no channel of any pixel differs by
     * more than the tolerance.
     */
    public static boolean areIdentical(PixelBuffer a, PixelBuffer b, IdenticalityTolerance tolerance) {
        if (a.getWidth() != b.getWidth() || a.getHeight() != b.getHeight()) {
            return false;
        }
        int pixels = a.getPixelCount();
        for (int p = 0; p < pixels; p++) {
            if (Math.abs(a.red(p) - b.red(p)) > tolerance.red()
                    || Math.abs(a.green(p) - b.green(p)) > tolerance.green()
                    || Math.abs(a.blue(p) - b.blue(p)) > tolerance.blue()
                    || Math.abs(a.alpha(p) - b.alpha(p)) > tolerance.alpha()) {
                return false;
            }
        }
        return true;
    }
}

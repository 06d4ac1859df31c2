package com.texture.dedup.representative;

import com.texture.dedup.core.model.TextureInfo;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;

/**
 * Picks the canonical member of an equivalence class.
 *
 * <p>{@link #QUALITY_ORDER} sorts worse items first. Items are compared by</p>
 * <ol>
 *     <li>width, wider is better;</li>
 *     <li>format quality score, higher is better. Two formats without a score tie, and
 *     a format with a score beats one without, which keeps the order transitive;</li>
 *     <li>whether the item is used, used is better;</li>
 *     <li>identifier, the smaller one is better.</li>
 * </ol>
 * The order is total, so the selected representative does not depend on the order in
 * which members are supplied.
 */
public class RepresentativeSelector {

    public static final Comparator<TextureInfo> QUALITY_ORDER = Comparator
            .comparingInt(TextureInfo::width)
            .thenComparing(RepresentativeSelector::compareFormat)
            .thenComparing(Comparator.comparing(TextureInfo::used))
            .thenComparing(TextureInfo::id, Comparator.reverseOrder());

    private final TextureCatalog catalog;

    public RepresentativeSelector(TextureCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
    }

    /**
     * Returns the best member of {@code members}.
     *
     * @throws IllegalArgumentException if {@code members} is empty
     */
    public String select(Collection<String> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Cannot select a representative of an empty class");
        }
        TextureInfo best = null;
        for (String id : members) {
            TextureInfo info = catalog.get(id);
            if (best == null || QUALITY_ORDER.compare(info, best) > 0) {
                best = info;
            }
        }
        return best.id();
    }

    /**
     * Compares two items by quality; positive if {@code a} is the better one.
     */
    public int compare(String a, String b) {
        return QUALITY_ORDER.compare(catalog.get(a), catalog.get(b));
    }

    private static int compareFormat(TextureInfo a, TextureInfo b) {
        boolean scoredA = a.format().hasQualityScore();
        boolean scoredB = b.format().hasQualityScore();
        if (scoredA && scoredB) {
            return Integer.compare(a.format().getQualityScore(), b.format().getQualityScore());
        }
        return Boolean.compare(scoredA, scoredB);
    }
}

package com.texture.dedup.review;

import java.util.List;

/**
 * An uncertain class awaiting review.
 *
 * @param representative the best member of the class, shown as the reference image
 * @param pending        members neither confirmed nor rejected against the representative, sorted
 * @param classSize      size of the whole uncertain class
 */
public record ReviewCandidate(String representative, List<String> pending, int classSize) {

    public ReviewCandidate {
        pending = List.copyOf(pending);
    }
}

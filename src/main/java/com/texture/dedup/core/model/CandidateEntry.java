package com.texture.dedup.core.model;

import java.util.Objects;

/**
 * An image inserted into a same-ratio index.
 *
 * @param id     stable item identifier
 * @param width  source width in pixels
 * @param height source height in pixels
 */
public record CandidateEntry(String id, int width, int height) {

    public CandidateEntry {
        Objects.requireNonNull(id, "id is required");
    }
}

package com.texture.dedup.core.model;

import java.util.Objects;

/**
 * Known metadata about one texture in the corpus.
 *
 * @param id     stable item identifier
 * @param width  original width in pixels
 * @param height original height in pixels
 * @param format storage format of the original file
 * @param used   whether anything in the corpus references this texture
 */
public record TextureInfo(String id, int width, int height, TextureFormat format, boolean used) {

    public TextureInfo {
        Objects.requireNonNull(id, "id is required");
        format = format != null ? format : TextureFormat.UNKNOWN;
    }

    /**
     * Placeholder for an item the catalog knows nothing about.
     */
    public static TextureInfo unknown(String id) {
        return new TextureInfo(id, 0, 0, TextureFormat.UNKNOWN, false);
    }
}

package com.texture.dedup.source;

import com.texture.dedup.core.model.PixelBuffer;

/**
 * Supplies decoded pixels for an item identifier.
 */
@FunctionalInterface
public interface PixelSource {

    /**
     * Loads and decodes the image of an item.
     *
     * @param id the item identifier
     * @return the decoded RGBA image
     * @throws ImageDecodeException if the item cannot be read or decoded
     */
    PixelBuffer load(String id) throws ImageDecodeException;
}

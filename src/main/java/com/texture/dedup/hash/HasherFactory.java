package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;

/**
 * Creates the hasher used for one aspect ratio.
 */
@FunctionalInterface
public interface HasherFactory {

    ImageHasher create(AspectRatio ratio);
}

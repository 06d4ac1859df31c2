package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

import java.util.Optional;

/**
 * Reduces an image of one fixed aspect ratio to a short byte fingerprint.
 * Implementations are pure functions of the input pixels.
 */
public interface ImageHasher {

    /**
     * The only aspect ratio this hasher accepts.
     */
    AspectRatio getRatio();

    /**
     * Length of every fingerprint this hasher produces.
     */
    int getByteCount();

    /**
     * Computes the fingerprint of an image.
     *
     * @param image the decoded image
     * @return the fingerprint, or empty if the image has a different aspect ratio,
     *         non power-of-two dimensions, or is below the minimum resolution
     */
    Optional<byte[]> tryGetBytes(PixelBuffer image);
}

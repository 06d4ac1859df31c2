package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

/**
 * One byte per pixel: the blue channel with the low bit dropped.
 * Gloss maps keep their gloss term in blue.
 */
public class BlueChannelHasher extends AbstractDownSamplingHasher {

    public BlueChannelHasher(AspectRatio ratio, int minPixels) {
        super(ratio, minPixels);
    }

    @Override
    protected int getBytesPerPixel() {
        return 1;
    }

    @Override
    protected void encode(PixelBuffer small, byte[] out) {
        for (int i = 0; i < small.getPixelCount(); i++) {
            out[i] = (byte) (small.blue(i) >> 1);
        }
    }
}

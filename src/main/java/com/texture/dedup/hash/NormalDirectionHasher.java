package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

/**
 * Two bytes per pixel: the X and Y components of a tangent-space normal
 * (red and green), each with the low bit dropped.
 */
public class NormalDirectionHasher extends AbstractDownSamplingHasher {

    public NormalDirectionHasher(AspectRatio ratio, int minPixels) {
        super(ratio, minPixels);
    }

    @Override
    protected int getBytesPerPixel() {
        return 2;
    }

    @Override
    protected void encode(PixelBuffer small, byte[] out) {
        for (int i = 0; i < small.getPixelCount(); i++) {
            out[i * 2] = (byte) (small.red(i) >> 1);
            out[i * 2 + 1] = (byte) (small.green(i) >> 1);
        }
    }
}

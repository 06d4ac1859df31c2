package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

/**
 * One byte per pixel: alpha with the two low bits dropped to hide compression noise.
 */
public class AlphaHasher extends AbstractDownSamplingHasher {

    public AlphaHasher(AspectRatio ratio, int minPixels) {
        super(ratio, minPixels);
    }

    @Override
    protected int getBytesPerPixel() {
        return 1;
    }

    @Override
    protected void encode(PixelBuffer small, byte[] out) {
        for (int i = 0; i < small.getPixelCount(); i++) {
            out[i] = (byte) (small.alpha(i) >> 2);
        }
    }
}

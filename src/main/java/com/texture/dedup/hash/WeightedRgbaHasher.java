package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

/**
 * Four bytes per pixel. Green carries twice the weight of the other channels
 * so that comparisons lean toward luminance.
 */
public class WeightedRgbaHasher extends AbstractDownSamplingHasher {

    static final float WEIGHT_R = 0.25f;
    static final float WEIGHT_G = 0.5f;
    static final float WEIGHT_B = 0.25f;
    static final float WEIGHT_A = 0.25f;

    public WeightedRgbaHasher(AspectRatio ratio, int minPixels) {
        super(ratio, minPixels);
    }

    @Override
    protected int getBytesPerPixel() {
        return 4;
    }

    @Override
    protected void encode(PixelBuffer small, byte[] out) {
        for (int i = 0; i < small.getPixelCount(); i++) {
            out[i * 4] = (byte) (small.red(i) * WEIGHT_R);
            out[i * 4 + 1] = (byte) (small.green(i) * WEIGHT_G);
            out[i * 4 + 2] = (byte) (small.blue(i) * WEIGHT_B);
            out[i * 4 + 3] = (byte) (small.alpha(i) * WEIGHT_A);
        }
    }
}

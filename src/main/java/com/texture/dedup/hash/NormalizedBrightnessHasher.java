package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

/**
 * One byte per pixel: greyscale brightness re-normalized to a fixed mean and
 * standard deviation, so that the same texture exported under different lighting
 * still produces the same fingerprint.
 */
public class NormalizedBrightnessHasher extends AbstractDownSamplingHasher {

    static final double TARGET_MEAN = 128.0;
    static final double TARGET_DEVIATION = 32.0;

    public NormalizedBrightnessHasher(AspectRatio ratio, int minPixels) {
        super(ratio, minPixels);
    }

    @Override
    protected int getBytesPerPixel() {
        return 1;
    }

    @Override
    protected void encode(PixelBuffer small, byte[] out) {
        int count = small.getPixelCount();
        double[] grey = new double[count];
        double sum = 0;
        for (int i = 0; i < count; i++) {
            grey[i] = 0.299 * small.red(i) + 0.587 * small.green(i) + 0.114 * small.blue(i);
            sum += grey[i];
        }
        double mean = sum / count;

        double variance = 0;
        for (double g : grey) {
            variance += (g - mean) * (g - mean);
        }
        double deviation = Math.sqrt(variance / count);

        for (int i = 0; i < count; i++) {
            // a flat image has no contrast to normalize
            double z = deviation < 1e-6 ? 0 : (grey[i] - mean) / deviation;
            long value = Math.round(TARGET_MEAN + z * TARGET_DEVIATION);
            out[i] = (byte) Math.max(0, Math.min(255, value));
        }
    }
}

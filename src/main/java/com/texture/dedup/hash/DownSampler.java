package com.texture.dedup.hash;

import com.texture.dedup.core.model.PixelBuffer;

/**
 * Block-averaging down-sampler.
 */
final class DownSampler {

    private DownSampler() {
    }

    /**
     * Averages every {@code factor x factor} block of the image into one pixel.
     * Both dimensions must be divisible by the factor.
     */
    static PixelBuffer blockAverage(PixelBuffer image, int factor) {
        if (factor < 1) {
            throw new IllegalArgumentException("factor must be >= 1, got " + factor);
        }
        if (factor == 1) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        if (width % factor != 0 || height % factor != 0) {
            throw new IllegalArgumentException("Image " + width + "x" + height
                    + " is not divisible by factor " + factor);
        }

        int smallWidth = width / factor;
        int smallHeight = height / factor;
        int blockSize = factor * factor;
        byte[] source = image.getRgba();
        byte[] result = new byte[smallWidth * smallHeight * PixelBuffer.CHANNELS];
        int[] sums = new int[PixelBuffer.CHANNELS];

        for (int sy = 0; sy < smallHeight; sy++) {
            for (int sx = 0; sx < smallWidth; sx++) {
                sums[0] = sums[1] = sums[2] = sums[3] = 0;
                for (int y = sy * factor; y < (sy + 1) * factor; y++) {
                    int offset = (y * width + sx * factor) * PixelBuffer.CHANNELS;
                    for (int x = 0; x < factor; x++) {
                        for (int c = 0; c < PixelBuffer.CHANNELS; c++) {
                            sums[c] += source[offset++] & 0xFF;
                        }
                    }
                }
                int target = (sy * smallWidth + sx) * PixelBuffer.CHANNELS;
                for (int c = 0; c < PixelBuffer.CHANNELS; c++) {
                    result[target + c] = (byte) ((sums[c] + blockSize / 2) / blockSize);
                }
            }
        }
        return new PixelBuffer(smallWidth, smallHeight, result);
    }
}

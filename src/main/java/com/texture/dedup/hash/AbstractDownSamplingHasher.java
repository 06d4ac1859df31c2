package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;

import java.util.Objects;
import java.util.Optional;

/**
 * Shared shape of all fingerprinting strategies: block-average the image down to the
 * smallest power-of-two multiple of the aspect ratio that holds at least
 * {@code minPixels} pixels, then encode every down-sampled pixel into
 * {@link #getBytesPerPixel()} bytes.
 */
public abstract class AbstractDownSamplingHasher implements ImageHasher {

    private final AspectRatio ratio;
    private final int smallWidth;
    private final int smallHeight;
    private final int byteCount;

    protected AbstractDownSamplingHasher(AspectRatio ratio, int minPixels) {
        this.ratio = Objects.requireNonNull(ratio, "ratio is required");
        if (minPixels <= 0) {
            throw new IllegalArgumentException("minPixels must be > 0");
        }

        long scale = 1;
        while ((long) ratio.width() * ratio.height() * scale * scale < minPixels) {
            scale *= 2;
        }
        this.smallWidth = Math.toIntExact(scale * ratio.width());
        this.smallHeight = Math.toIntExact(scale * ratio.height());
        this.byteCount = Math.multiplyExact(smallWidth * smallHeight, getBytesPerPixel());
    }

    /**
     * Number of output bytes per down-sampled pixel.
     */
    protected abstract int getBytesPerPixel();

    /**
     * Writes the bytes of one down-sampled image into {@code out}.
     */
    protected abstract void encode(PixelBuffer small, byte[] out);

    @Override
    public AspectRatio getRatio() {
        return ratio;
    }

    @Override
    public int getByteCount() {
        return byteCount;
    }

    public int getSmallWidth() {
        return smallWidth;
    }

    public int getSmallHeight() {
        return smallHeight;
    }

    @Override
    public Optional<byte[]> tryGetBytes(PixelBuffer image) {
        if (!image.hasPowerOfTwoSize()
                || image.getWidth() < smallWidth
                || !ratio.equals(AspectRatio.of(image))) {
            return Optional.empty();
        }

        PixelBuffer small = DownSampler.blockAverage(image, image.getWidth() / smallWidth);
        byte[] bytes = new byte[byteCount];
        encode(small, bytes);
        return Optional.of(bytes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{ratio=" + ratio
                + ", size=" + smallWidth + "x" + smallHeight + ", bytes=" + byteCount + '}';
    }
}

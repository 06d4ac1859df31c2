package com.texture.dedup.core.model;

/**
 * Storage format of a texture, with a coarse compression quality score.
 *
 * <p>BC1, BC2 and BC3 share one score: they encode colour with the same 4x4 endpoint
 * scheme and differ only in how alpha is stored. Single and dual channel formats
 * (BC4, BC5) have no score because they are not comparable with colour formats.</p>
 */
public enum TextureFormat {
    R8G8B8A8_UNORM(100),
    B8G8R8A8_UNORM(100),
    BC7_UNORM(80),
    BC7_UNORM_SRGB(80),
    BC1_UNORM(50),
    BC1_UNORM_SRGB(50),
    BC2_UNORM(50),
    BC3_UNORM(50),
    BC3_UNORM_SRGB(50),
    BC4_UNORM(-1),
    BC5_UNORM(-1),
    UNKNOWN(-1);

    private static final int NO_SCORE = -1;

    private final int qualityScore;

    TextureFormat(int qualityScore) {
        this.qualityScore = qualityScore;
    }

    public boolean hasQualityScore() {
        return qualityScore != NO_SCORE;
    }

    /**
     * Returns the quality score, or -1 if this format has none.
     */
    public int getQualityScore() {
        return qualityScore;
    }
}

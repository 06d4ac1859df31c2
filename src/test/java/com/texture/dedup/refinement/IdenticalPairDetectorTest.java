package com.texture.dedup.refinement;

import com.texture.dedup.bulk.ParallelSweep;
import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.equivalence.UnorderedPair;
import com.texture.dedup.testsupport.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdenticalPairDetector Tests")
class IdenticalPairDetectorTest {

    private final Map<String, PixelBuffer> images = Map.of(
            "a", TestImages.grey(16, 16, 100),
            "b", TestImages.grey(16, 16, 100),
            "c", TestImages.grey(16, 16, 102),
            "d", TestImages.grey(16, 16, 110),
            "big", TestImages.grey(32, 32, 100));

    private ParallelSweep sweep;
    private IdenticalPairDetector detector;

    @BeforeEach
    void setUp() {
        sweep = new ParallelSweep(2);
        detector = new IdenticalPairDetector(TestImages.sourceOf(images), sweep);
    }

    @AfterEach
    void tearDown() {
        sweep.close();
    }

    @Test
    @DisplayName("Should find pairs of the same size within tolerance")
    void findsIdenticalPairs() {
        List<UnorderedPair<String>> pairs = detector.detect(
                List.of(Set.of("a", "b", "c", "d", "big", "missing")),
                IdenticalityTolerance.forDimension(SimilarityDimension.GENERAL), null, null);

        assertEquals(List.of(UnorderedPair.of("a", "b"), UnorderedPair.of("a", "c"), UnorderedPair.of("b", "c")), pairs);
    }

    @Test
    @DisplayName("Pairs are only compared within their class")
    void onlyWithinClass() {
        List<UnorderedPair<String>> pairs = detector.detect(List.of(Set.of("a", "d"), Set.of("b", "big")),
                IdenticalityTolerance.forDimension(SimilarityDimension.GENERAL), null, null);
        assertTrue(pairs.isEmpty());
    }

    @Test
    @DisplayName("Channels with full tolerance are ignored")
    void ignoredChannels() {
        PixelBuffer opaque = TestImages.rgba(16, 16, 0, 0, 0, 200);
        PixelBuffer coloured = TestImages.rgba(16, 16, 255, 90, 3, 201);

        assertTrue(IdenticalPairDetector.areIdentical(opaque, coloured,
                IdenticalityTolerance.forDimension(SimilarityDimension.ALPHA)));
        assertFalse(IdenticalPairDetector.areIdentical(opaque, coloured,
                IdenticalityTolerance.forDimension(SimilarityDimension.GENERAL)));
    }

    @Test
    @DisplayName("Should reject tolerances outside the byte range")
    void invalidTolerance() {
        assertThrows(IllegalArgumentException.class, () -> new IdenticalityTolerance(256, 0, 0, 0));
    }
}

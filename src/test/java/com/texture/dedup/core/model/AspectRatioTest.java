package com.texture.dedup.core.model;

import com.texture.dedup.testsupport.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AspectRatio Tests")
class AspectRatioTest {

    @Test
    @DisplayName("Should reduce to lowest terms")
    void reducesToLowestTerms() {
        AspectRatio ratio = AspectRatio.of(1024, 512);
        assertEquals(2, ratio.width());
        assertEquals(1, ratio.height());
        assertEquals("2:1", ratio.toString());
    }

    @Test
    @DisplayName("Images of different sizes but the same shape share a ratio")
    void sameShapeSameRatio() {
        assertEquals(AspectRatio.of(TestImages.grey(16, 16, 0)), AspectRatio.of(TestImages.grey(256, 256, 0)));
        assertNotEquals(AspectRatio.of(32, 16), AspectRatio.of(16, 32));
    }

    @Test
    @DisplayName("Should reject non-positive dimensions")
    void rejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> AspectRatio.of(0, 16));
        assertThrows(IllegalArgumentException.class, () -> AspectRatio.of(16, -1));
    }

    @Test
    @DisplayName("Should order by width, then height")
    void ordering() {
        assertTrue(AspectRatio.of(1, 2).compareTo(AspectRatio.of(2, 1)) < 0);
        assertTrue(AspectRatio.of(2, 3).compareTo(AspectRatio.of(2, 1)) > 0);
        assertEquals(0, AspectRatio.of(4, 2).compareTo(AspectRatio.of(2, 1)));
    }
}

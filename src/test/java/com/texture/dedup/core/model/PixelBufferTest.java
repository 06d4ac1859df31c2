package com.texture.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PixelBuffer Tests")
class PixelBufferTest {

    @Test
    @DisplayName("Channel accessors read unsigned RGBA values")
    void channelAccessors() {
        PixelBuffer image = new PixelBuffer(1, 2, new byte[]{1, 2, 3, 4, (byte) 200, (byte) 201, (byte) 202, (byte) 255});
        assertEquals(1, image.red(0));
        assertEquals(4, image.alpha(0));
        assertEquals(200, image.red(1));
        assertEquals(202, image.blue(1));
        assertEquals(255, image.alpha(1));
        assertEquals(2, image.getPixelCount());
    }

    @Test
    @DisplayName("Should reject a buffer of the wrong length")
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new PixelBuffer(2, 2, new byte[15]));
    }

    @Test
    @DisplayName("Should detect power-of-two sizes")
    void powerOfTwo() {
        assertTrue(new PixelBuffer(64, 16, new byte[64 * 16 * 4]).hasPowerOfTwoSize());
        assertFalse(new PixelBuffer(48, 16, new byte[48 * 16 * 4]).hasPowerOfTwoSize());
        assertFalse(new PixelBuffer(16, 12, new byte[16 * 12 * 4]).hasPowerOfTwoSize());
    }
}

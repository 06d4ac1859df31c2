package com.texture.dedup.hash;

import com.texture.dedup.core.model.AspectRatio;
import com.texture.dedup.core.model.PixelBuffer;
import com.texture.dedup.testsupport.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HashingStrategy Tests")
class HashingStrategyTest {

    private static final AspectRatio SQUARE = AspectRatio.of(1, 1);

    @Nested
    @DisplayName("Common behaviour")
    class Common {

        @ParameterizedTest
        @EnumSource(HashingStrategy.class)
        @DisplayName("Hashing the same image twice yields the same fingerprint")
        void deterministic(HashingStrategy strategy) {
            PixelBuffer image = TestImages.gradient(64, 64, 10, 3);
            ImageHasher hasher = strategy.createHasher(SQUARE);

            byte[] first = hasher.tryGetBytes(image).orElseThrow();
            byte[] second = strategy.createHasher(SQUARE).tryGetBytes(image).orElseThrow();

            assertArrayEquals(first, second);
            assertEquals(hasher.getByteCount(), first.length);
        }

        @ParameterizedTest
        @EnumSource(HashingStrategy.class)
        @DisplayName("Images of another aspect ratio have no fingerprint")
        void rejectsOtherRatio(HashingStrategy strategy) {
            ImageHasher hasher = strategy.createHasher(SQUARE);
            assertTrue(hasher.tryGetBytes(TestImages.grey(128, 64, 100)).isEmpty());
        }

        @ParameterizedTest
        @EnumSource(HashingStrategy.class)
        @DisplayName("Images without power-of-two size have no fingerprint")
        void rejectsNonPowerOfTwo(HashingStrategy strategy) {
            ImageHasher hasher = strategy.createHasher(SQUARE);
            assertTrue(hasher.tryGetBytes(TestImages.grey(96, 96, 100)).isEmpty());
        }

        @ParameterizedTest
        @EnumSource(HashingStrategy.class)
        @DisplayName("Images below the minimum resolution have no fingerprint")
        void rejectsTooSmall(HashingStrategy strategy) {
            ImageHasher hasher = strategy.createHasher(SQUARE);
            assertTrue(hasher.tryGetBytes(TestImages.grey(8, 8, 100)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @ParameterizedTest
        @CsvSource({
                "WEIGHTED_RGBA, 1, 1, 1024",
                "WEIGHTED_RGBA, 2, 1, 2048",
                "ALPHA, 1, 1, 1024",
                "NORMAL_DIRECTION, 1, 1, 512",
                "BLUE_CHANNEL, 1, 1, 1024",
                "NORMALIZED_BRIGHTNESS, 1, 1, 1024"
        })
        @DisplayName("Byte count depends on strategy and ratio")
        void byteCount(HashingStrategy strategy, int width, int height, int expected) {
            assertEquals(expected, strategy.createHasher(AspectRatio.of(width, height)).getByteCount());
        }

        @Test
        @DisplayName("Each pass quadruples the pixel budget")
        void passScaling() {
            assertEquals(256, HashingStrategy.WEIGHTED_RGBA.getMinPixels(1));
            assertEquals(1024, HashingStrategy.WEIGHTED_RGBA.getMinPixels(2));
            assertEquals(4096, HashingStrategy.WEIGHTED_RGBA.getMinPixels(3));
            assertEquals(16384, HashingStrategy.WEIGHTED_RGBA.getMinPixels(4));
            assertThrows(IllegalArgumentException.class, () -> HashingStrategy.ALPHA.getMinPixels(0));
        }

        @ParameterizedTest
        @EnumSource(HashingStrategy.class)
        @DisplayName("Budgets grow up to the last supported pass and stop there")
        void passLimit(HashingStrategy strategy) {
            int last = strategy.getMinPixels(HashingStrategy.MAX_PASS);
            assertEquals(strategy.getMinPixels() * (1L << (2 * (HashingStrategy.MAX_PASS - 1))), last);
            assertThrows(IllegalArgumentException.class, () -> strategy.getMinPixels(HashingStrategy.MAX_PASS + 1));
            assertThrows(IllegalArgumentException.class, () -> strategy.getMinPixels(17));
        }

        @Test
        @DisplayName("A later pass needs larger images")
        void laterPassNeedsLargerImages() {
            PixelBuffer image = TestImages.grey(16, 16, 100);
            AbstractDownSamplingHasher pass1 = (AbstractDownSamplingHasher) HashingStrategy.WEIGHTED_RGBA.forPass(1).create(SQUARE);
            AbstractDownSamplingHasher pass2 = (AbstractDownSamplingHasher) HashingStrategy.WEIGHTED_RGBA.forPass(2).create(SQUARE);

            assertEquals(16, pass1.getSmallWidth());
            assertEquals(32, pass2.getSmallWidth());
            assertTrue(pass1.tryGetBytes(image).isPresent());
            assertTrue(pass2.tryGetBytes(image).isEmpty());
        }
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("Weighted RGBA scales each channel by its weight")
        void weightedRgba() {
            byte[] bytes = fingerprint(HashingStrategy.WEIGHTED_RGBA, TestImages.grey(16, 16, 100));
            assertEquals(25, bytes[0] & 0xFF);
            assertEquals(50, bytes[1] & 0xFF);
            assertEquals(25, bytes[2] & 0xFF);
            assertEquals(63, bytes[3] & 0xFF);
        }

        @Test
        @DisplayName("Down-sampling averages blocks")
        void downSamplingAverages() {
            // every 2x2 block holds two 80s and two 120s
            byte[] bytes = fingerprint(HashingStrategy.WEIGHTED_RGBA, TestImages.checker(32, 1, 20));
            for (int i = 0; i < bytes.length; i += 4) {
                assertEquals(50, bytes[i + 1] & 0xFF);
            }
        }

        @Test
        @DisplayName("Alpha drops the two low bits")
        void alpha() {
            byte[] bytes = fingerprint(HashingStrategy.ALPHA, TestImages.rgba(32, 32, 10, 20, 30, 203));
            for (byte b : bytes) {
                assertEquals(50, b & 0xFF);
            }
        }

        @Test
        @DisplayName("Normal direction keeps red and green, halved")
        void normalDirection() {
            byte[] bytes = fingerprint(HashingStrategy.NORMAL_DIRECTION, TestImages.rgba(16, 16, 200, 101, 7, 255));
            assertEquals(100, bytes[0] & 0xFF);
            assertEquals(50, bytes[1] & 0xFF);
        }

        @Test
        @DisplayName("Blue channel keeps blue, halved")
        void blueChannel() {
            byte[] bytes = fingerprint(HashingStrategy.BLUE_CHANNEL, TestImages.rgba(32, 32, 0, 0, 201, 255));
            assertEquals(100, bytes[0] & 0xFF);
        }

        @Test
        @DisplayName("Normalized brightness maps a flat image to the target mean")
        void brightnessFlat() {
            byte[] bytes = fingerprint(HashingStrategy.NORMALIZED_BRIGHTNESS, TestImages.grey(32, 32, 37));
            for (byte b : bytes) {
                assertEquals(128, b & 0xFF);
            }
        }

        @Test
        @DisplayName("Normalized brightness ignores a uniform brightness shift")
        void brightnessShiftInvariant() {
            byte[] dark = fingerprint(HashingStrategy.NORMALIZED_BRIGHTNESS, TestImages.gradient(32, 32, 0, 2));
            byte[] bright = fingerprint(HashingStrategy.NORMALIZED_BRIGHTNESS, TestImages.gradient(32, 32, 40, 2));
            for (int i = 0; i < dark.length; i++) {
                assertTrue(Math.abs((dark[i] & 0xFF) - (bright[i] & 0xFF)) <= 1, "byte " + i);
            }
        }

        private byte[] fingerprint(HashingStrategy strategy, PixelBuffer image) {
            Optional<byte[]> bytes = strategy.createHasher(AspectRatio.of(image)).tryGetBytes(image);
            assertTrue(bytes.isPresent());
            return bytes.get();
        }
    }
}

package com.texture.dedup.source;

import com.texture.dedup.core.model.PixelBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImageIoPixelSource Tests")
class ImageIoPixelSourceTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should decode a PNG into RGBA bytes")
    void decodesPng() throws Exception {
        BufferedImage image = new BufferedImage(4, 2, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, 0x80FF4020);
        image.setRGB(3, 1, 0xFF0000FF);
        Files.createDirectories(dir.resolve("chr"));
        ImageIO.write(image, "png", dir.resolve("chr/c1000.png").toFile());

        PixelBuffer pixels = new ImageIoPixelSource(dir).load("chr/c1000.png");

        assertEquals(4, pixels.getWidth());
        assertEquals(2, pixels.getHeight());
        assertEquals(0xFF, pixels.red(0));
        assertEquals(0x40, pixels.green(0));
        assertEquals(0x20, pixels.blue(0));
        assertEquals(0x80, pixels.alpha(0));
        assertEquals(0xFF, pixels.blue(7));
        assertEquals(0, pixels.red(7));
    }

    @Test
    @DisplayName("Missing and undecodable files raise ImageDecodeException")
    void failures() throws Exception {
        Files.writeString(dir.resolve("notes.png"), "not an image");
        ImageIoPixelSource source = new ImageIoPixelSource(dir);

        ImageDecodeException missing = assertThrows(ImageDecodeException.class, () -> source.load("gone.png"));
        assertEquals("gone.png", missing.getItemId());
        assertThrows(ImageDecodeException.class, () -> source.load("notes.png"));
    }
}

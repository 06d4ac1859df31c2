package com.texture.dedup.source;

import com.texture.dedup.core.model.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads images that {@link ImageIO} can decode (PNG, BMP, JPEG, ...) from a root
 * directory. Item identifiers are paths relative to that directory using {@code /}
 * as separator.
 */
public class ImageIoPixelSource implements PixelSource {
    private static final Logger log = LoggerFactory.getLogger(ImageIoPixelSource.class);

    private final Path root;

    public ImageIoPixelSource(Path root) {
        this.root = Objects.requireNonNull(root, "root is required");
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Resolves an item identifier to its file.
     */
    public Path resolve(String id) {
        return root.resolve(id);
    }

    @Override
    public PixelBuffer load(String id) throws ImageDecodeException {
        Path file = resolve(id);
        if (!Files.isRegularFile(file)) {
            throw new ImageDecodeException(id, "No such file: " + file);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new ImageDecodeException(id, "Cannot read " + file + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException(id, "Unsupported image format: " + file);
        }

        log.trace("Decoded {} ({}x{})", id, image.getWidth(), image.getHeight());
        return toPixelBuffer(image);
    }

    static PixelBuffer toPixelBuffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] rgba = new byte[width * height * PixelBuffer.CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            rgba[i * 4] = (byte) (p >> 16);
            rgba[i * 4 + 1] = (byte) (p >> 8);
            rgba[i * 4 + 2] = (byte) p;
            rgba[i * 4 + 3] = (byte) (p >>> 24);
        }
        return new PixelBuffer(width, height, rgba);
    }
}

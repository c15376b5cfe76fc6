package org.pixelforge.util;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Writes synthetic PNG inputs for benchmarks and tests, named
 * {@code test_image_<n>_<pattern>.png}, cycling through the {@link Pattern}s.
 */
public final class TestImageGenerator {

    private static final Logger LOGGER = Logger.getLogger(TestImageGenerator.class.getName());

    static final int CHECKER_BOX = 100;
    static final int CIRCLE_STEP = 50;
    static final int LINE_SPACING = 50;
    static final long NOISE_SEED = 42L;

    public enum Pattern {
        GRADIENT, CHECKERBOARD, CIRCLES, NOISE, LINES;

        String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private TestImageGenerator() {
        // Prevent instantiation
    }

    /**
     * @return the written files, in generation order
     */
    public static List<Path> generate(final Path outputDir, final int count, final int width, final int height)
            throws IOException {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Image size must be positive, got %dx%d".formatted(width, height));
        Files.createDirectories(outputDir);

        final Pattern[] patterns = Pattern.values();
        final List<Path> written = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final Pattern pattern = patterns[i % patterns.length];
            final Path file = outputDir.resolve("test_image_%d_%s.png".formatted(i + 1, pattern.label()));
            final BufferedImage image = render(pattern, width, height, NOISE_SEED + i);
            if (!ImageIO.write(image, "png", file.toFile()))
                throw new IOException("No PNG writer available for " + file);
            written.add(file);
            LOGGER.fine(() -> "Generated test image " + file.getFileName());
        }
        LOGGER.info(() -> "Generated %d test images (%dx%d) in %s".formatted(count, width, height, outputDir));
        return written;
    }

    public static BufferedImage render(final Pattern pattern, final int width, final int height, final long seed) {
        final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        if (pattern == Pattern.NOISE) {
            final Random random = new Random(seed);
            for (int y = 0; y < height; y++)
                for (int x = 0; x < width; x++)
                    image.setRGB(x, y, random.nextInt(0x1000000));
            return image;
        }

        final Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.BLACK);
            switch (pattern) {
                case GRADIENT -> {
                    for (int x = 0; x < width; x++) {
                        final int v = (int) ((double) x / width * 255);
                        g.setColor(new Color(v, v, v));
                        g.drawLine(x, 0, x, height - 1);
                    }
                }
                case CHECKERBOARD -> {
                    for (int x = 0; x < width; x += CHECKER_BOX)
                        for (int y = 0; y < height; y += CHECKER_BOX)
                            if ((x + y) / CHECKER_BOX % 2 == 0) g.fillRect(x, y, CHECKER_BOX, CHECKER_BOX);
                }
                case CIRCLES -> {
                    g.setStroke(new BasicStroke(2f));
                    final int cx = width / 2;
                    final int cy = height / 2;
                    for (int r = 0; r < Math.min(width, height) / 2; r += CIRCLE_STEP)
                        g.drawOval(cx - r, cy - r, 2 * r, 2 * r);
                }
                case LINES -> {
                    g.setStroke(new BasicStroke(2f));
                    for (int i = -height; i < width + height; i += LINE_SPACING)
                        g.drawLine(i, 0, i + height, height);
                }
                default -> throw new IllegalStateException("Unhandled pattern " + pattern);
            }
        } finally {
            g.dispose();
        }
        return image;
    }
}

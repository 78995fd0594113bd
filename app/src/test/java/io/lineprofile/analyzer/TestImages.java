package io.lineprofile.analyzer;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Synthetic fixtures shared by tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Image whose pixel at (x, y) has blue = x, green = y and red = (x + y) mod 256.
     */
    public static BufferedImage coordinateGradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int red = (x + y) % 256;
                int green = y % 256;
                int blue = x % 256;
                image.setRGB(x, y, (red << 16) | (green << 8) | blue);
            }
        }
        return image;
    }

    public static BufferedImage solid(int width, int height, int red, int green, int blue) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = (red << 16) | (green << 8) | blue;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    public static Path writePng(BufferedImage image, Path target) throws IOException {
        ImageIO.write(image, "png", target.toFile());
        return target;
    }

    /**
     * Chart rendering draws text; minimal JDK images without fonts cannot do that.
     */
    public static boolean fontsAvailable() {
        try {
            BufferedImage probe = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = probe.createGraphics();
            try {
                graphics.drawString("0", 1, 12);
            } finally {
                graphics.dispose();
            }
            return true;
        } catch (Throwable ex) {
            return false;
        }
    }
}

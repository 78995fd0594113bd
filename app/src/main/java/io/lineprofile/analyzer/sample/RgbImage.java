package io.lineprofile.analyzer.sample;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.Objects;

/**
 * Read-only view of a decoded image as a row-major grid of {@link Pixel}s.
 *
 * <p>Intensities are the stored raster samples, not colour-managed sRGB values. Single-band images
 * repeat their gray level in all three channels and samples wider than 8 bits keep their high byte.
 */
public final class RgbImage {

    private static final int INTENSITY_BITS = 8;

    private final BufferedImage source;
    private final Raster raster;
    private final boolean rawSamples;

    private RgbImage(BufferedImage source) {
        this.source = source;
        this.raster = source.getRaster();
        this.rawSamples = hasRawSamples(source.getColorModel(), raster.getNumBands());
    }

    public static RgbImage of(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        return new RgbImage(image);
    }

    public int width() {
        return source.getWidth();
    }

    public int height() {
        return source.getHeight();
    }

    public boolean contains(Point point) {
        return point.x() >= 0 && point.x() < width() && point.y() >= 0 && point.y() < height();
    }

    public Pixel pixel(int x, int y) {
        if (x < 0 || x >= width() || y < 0 || y >= height()) {
            throw new CoordinateOutOfBoundsException(new Point(x, y), width(), height());
        }
        if (!rawSamples) {
            return Pixel.fromArgb(source.getRGB(x, y));
        }
        if (raster.getNumBands() < 3) {
            int gray = sample(x, y, 0);
            return new Pixel(gray, gray, gray);
        }
        return new Pixel(sample(x, y, 2), sample(x, y, 1), sample(x, y, 0));
    }

    public Pixel pixel(Point point) {
        return pixel(point.x(), point.y());
    }

    /**
     * Returns a fresh RGB copy that callers are free to draw on.
     */
    public BufferedImage copyToBufferedImage() {
        BufferedImage copy = new BufferedImage(width(), height(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                copy.setRGB(x, y, pixel(x, y).toRgb());
            }
        }
        return copy;
    }

    private int sample(int x, int y, int band) {
        int value = raster.getSample(x, y, band);
        int bits = raster.getSampleModel().getSampleSize(band);
        if (bits > INTENSITY_BITS) {
            return value >>> (bits - INTENSITY_BITS);
        }
        if (bits < INTENSITY_BITS) {
            return value * 255 / ((1 << bits) - 1);
        }
        return value;
    }

    // Palette indices and non-RGB colour spaces still need the colour model to yield intensities.
    private static boolean hasRawSamples(ColorModel colorModel, int bands) {
        if (colorModel instanceof IndexColorModel) {
            return false;
        }
        int type = colorModel.getColorSpace().getType();
        if (type == ColorSpace.TYPE_GRAY) {
            return bands >= 1;
        }
        return type == ColorSpace.TYPE_RGB && bands >= 3;
    }
}

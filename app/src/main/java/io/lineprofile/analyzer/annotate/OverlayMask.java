package io.lineprofile.analyzer.annotate;

import io.lineprofile.analyzer.sample.Channel;
import io.lineprofile.analyzer.sample.Point;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

/**
 * Pixels covered by the line and start marker, rasterized once and stamped onto any number of images.
 */
final class OverlayMask {

    private final BufferedImage mask;

    private OverlayMask(BufferedImage mask) {
        this.mask = mask;
    }

    static OverlayMask draw(int width, int height, Point from, Point to, OverlayStyle style) {
        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_BINARY);
        Graphics2D graphics = mask.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
            graphics.setColor(Color.WHITE);
            graphics.setStroke(new BasicStroke(style.lineThickness(), BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
            graphics.drawLine(from.x(), from.y(), to.x(), to.y());
            int radius = style.markerRadius();
            graphics.drawOval(from.x() - radius, from.y() - radius, radius * 2, radius * 2);
        } finally {
            graphics.dispose();
        }
        return new OverlayMask(mask);
    }

    /**
     * Writes {@code shade} into band 0 of a single-band image wherever the mask is set.
     */
    void applyToGray(BufferedImage target, int shade) {
        WritableRaster raster = target.getRaster();
        forEachCovered(target, (x, y) -> raster.setSample(x, y, 0, shade));
    }

    /**
     * Paints covered pixels of an RGB image with {@code shade} in one channel and zero in the others.
     */
    void applyAsChannelColour(BufferedImage target, Channel channel, int shade) {
        int colour = channel.toArgb(shade);
        forEachCovered(target, (x, y) -> target.setRGB(x, y, colour));
    }

    private void forEachCovered(BufferedImage target, PixelAction action) {
        if (target.getWidth() != mask.getWidth() || target.getHeight() != mask.getHeight()) {
            throw new IllegalArgumentException("Target image size does not match the overlay mask");
        }
        Raster raster = mask.getRaster();
        for (int y = 0; y < raster.getHeight(); y++) {
            for (int x = 0; x < raster.getWidth(); x++) {
                if (raster.getSample(x, y, 0) != 0) {
                    action.apply(x, y);
                }
            }
        }
    }

    @FunctionalInterface
    private interface PixelAction {
        void apply(int x, int y);
    }
}

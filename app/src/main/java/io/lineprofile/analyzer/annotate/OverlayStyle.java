package io.lineprofile.analyzer.annotate;

/**
 * Appearance of the line and start marker drawn onto annotated images.
 *
 * @param lineThickness stroke width in pixels for both the line and the marker outline
 * @param shade         intensity written where the overlay covers a pixel
 * @param markerRadius  radius of the circle drawn around the start point
 */
public record OverlayStyle(int lineThickness, int shade, int markerRadius) {

    public static final int DEFAULT_LINE_THICKNESS = 2;
    public static final int DEFAULT_SHADE = 255;
    static final int MARKER_PADDING = 5;

    public OverlayStyle {
        if (lineThickness <= 0) {
            throw new IllegalArgumentException("lineThickness must be positive");
        }
        if (shade < 0 || shade > 255) {
            throw new IllegalArgumentException("shade must be between 0 and 255");
        }
        if (markerRadius <= 0) {
            throw new IllegalArgumentException("markerRadius must be positive");
        }
    }

    public static OverlayStyle defaults() {
        return withThickness(DEFAULT_LINE_THICKNESS, DEFAULT_SHADE);
    }

    /**
     * Style whose marker radius follows the line thickness.
     */
    public static OverlayStyle withThickness(int lineThickness, int shade) {
        return new OverlayStyle(lineThickness, shade, defaultMarkerRadius(lineThickness));
    }

    public static int defaultMarkerRadius(int lineThickness) {
        return lineThickness + MARKER_PADDING;
    }
}

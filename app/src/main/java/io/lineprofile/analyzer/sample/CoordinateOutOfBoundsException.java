package io.lineprofile.analyzer.sample;

/**
 * Raised when a sample point falls outside the image extent.
 */
public class CoordinateOutOfBoundsException extends RuntimeException {

    private final Point point;

    public CoordinateOutOfBoundsException(Point point, int width, int height) {
        super("Point " + point + " is outside the " + width + "x" + height + " image");
        this.point = point;
    }

    public Point point() {
        return point;
    }
}

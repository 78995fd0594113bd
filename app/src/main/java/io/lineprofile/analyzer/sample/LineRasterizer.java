package io.lineprofile.analyzer.sample;

import java.util.List;

/**
 * Enumerates the discrete pixel coordinates approximating a straight segment.
 */
public interface LineRasterizer {

    /**
     * @return coordinates from {@code from} to {@code to}, both inclusive, in traversal order
     */
    List<Point> rasterize(Point from, Point to);
}

package io.lineprofile.analyzer.sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Integer Bresenham rasterization.
 *
 * <p>The walk follows the axis with the strictly larger delta (the y axis on ties) and steps the
 * other axis whenever the decision value is non-negative, so a segment from {@code (x0, y0)} to
 * {@code (x1, y1)} always yields {@code max(|dx|, |dy|) + 1} points.
 */
public class BresenhamLineRasterizer implements LineRasterizer {

    @Override
    public List<Point> rasterize(Point from, Point to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        int dx = to.x() - from.x();
        int dy = to.y() - from.y();
        int xSign = dx > 0 ? 1 : -1;
        int ySign = dy > 0 ? 1 : -1;
        dx = Math.abs(dx);
        dy = Math.abs(dy);

        int major;
        int minor;
        int xx;
        int xy;
        int yx;
        int yy;
        if (dx > dy) {
            major = dx;
            minor = dy;
            xx = xSign;
            xy = 0;
            yx = 0;
            yy = ySign;
        } else {
            major = dy;
            minor = dx;
            xx = 0;
            xy = ySign;
            yx = xSign;
            yy = 0;
        }

        List<Point> points = new ArrayList<>(major + 1);
        int decision = 2 * minor - major;
        int step = 0;
        for (int i = 0; i <= major; i++) {
            points.add(new Point(from.x() + i * xx + step * yx, from.y() + i * xy + step * yy));
            if (decision >= 0) {
                step++;
                decision -= 2 * major;
            }
            decision += 2 * minor;
        }
        return points;
    }
}

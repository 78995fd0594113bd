package io.lineprofile.analyzer.sample;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class BresenhamLineRasterizerTest {

    private final BresenhamLineRasterizer rasterizer = new BresenhamLineRasterizer();

    @Test
    void identicalEndpointsYieldSinglePoint() {
        List<Point> points = rasterizer.rasterize(new Point(4, 7), new Point(4, 7));

        assertThat(points).containsExactly(new Point(4, 7));
    }

    @Test
    void horizontalLineWalksEveryColumn() {
        List<Point> points = rasterizer.rasterize(new Point(0, 0), new Point(5, 0));

        assertThat(points).hasSize(6);
        assertThat(points).extracting(Point::y).containsOnly(0);
        assertThat(points).extracting(Point::x).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    void verticalLineWalksUpwards() {
        List<Point> points = rasterizer.rasterize(new Point(2, 3), new Point(2, 0));

        assertThat(points).containsExactly(new Point(2, 3), new Point(2, 2), new Point(2, 1), new Point(2, 0));
    }

    @Test
    void diagonalStepsBothAxesEachTime() {
        List<Point> points = rasterizer.rasterize(new Point(0, 0), new Point(3, 3));

        assertThat(points).containsExactly(new Point(0, 0), new Point(1, 1), new Point(2, 2), new Point(3, 3));
    }

    @Test
    void steepLineMatchesReferenceWalk() {
        List<Point> points = rasterizer.rasterize(new Point(-1, -4), new Point(3, 2));

        assertThat(points).containsExactly(
                new Point(-1, -4), new Point(0, -3), new Point(0, -2), new Point(1, -1),
                new Point(2, 0), new Point(2, 1), new Point(3, 2));
    }

    @Test
    void minorAxisStepsWhenDecisionReachesZero() {
        List<Point> points = rasterizer.rasterize(new Point(0, 0), new Point(4, 2));

        assertThat(points).containsExactly(
                new Point(0, 0), new Point(1, 1), new Point(2, 1), new Point(3, 2), new Point(4, 2));
    }

    @Test
    void pointCountIsLargestDeltaPlusOne() {
        Point from = new Point(1454, 627);
        Point to = new Point(1548, 772);

        List<Point> points = rasterizer.rasterize(from, to);

        assertThat(points).hasSize(Math.max(Math.abs(to.x() - from.x()), Math.abs(to.y() - from.y())) + 1);
        assertThat(points.get(0)).isEqualTo(from);
        assertThat(points.get(points.size() - 1)).isEqualTo(to);
    }

    @Test
    void consecutivePointsAreEightConnected() {
        List<Point> points = rasterizer.rasterize(new Point(10, 3), new Point(-7, 12));

        for (int i = 1; i < points.size(); i++) {
            Point previous = points.get(i - 1);
            Point current = points.get(i);
            assertThat(Math.abs(current.x() - previous.x())).isLessThanOrEqualTo(1);
            assertThat(Math.abs(current.y() - previous.y())).isLessThanOrEqualTo(1);
        }
    }
}

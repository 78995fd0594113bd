package io.lineprofile.analyzer.sample;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.lineprofile.analyzer.TestImages;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineProfileSamplerTest {

    private final LineProfileSampler sampler = new LineProfileSampler();
    private final RgbImage gradient = RgbImage.of(TestImages.coordinateGradient(10, 10));

    @Test
    void samplesHorizontalLineOnCoordinateGradient() {
        ProfileTable table = sampler.sample(gradient, new Point(0, 0), new Point(9, 0));

        assertThat(table.size()).isEqualTo(10);
        assertThat(table.distances()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(table.green()).containsOnly(0);
        assertThat(table.blue()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(table.red()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        double[] averages = table.averages();
        for (int i = 0; i < averages.length; i++) {
            assertThat(averages[i]).isCloseTo((i + 0 + i) / 3.0, within(1e-12));
        }
    }

    @Test
    void identicalEndpointsProduceOneSample() {
        ProfileTable table = sampler.sample(gradient, new Point(3, 4), new Point(3, 4));

        assertThat(table.samples()).containsExactly(new SampledPoint(0, 7, 4, 3));
    }

    @Test
    void averageKeepsFractionalPart() {
        RgbImage image = RgbImage.of(TestImages.solid(2, 2, 1, 1, 2));

        ProfileTable table = sampler.sample(image, new Point(0, 0), new Point(1, 1));

        assertThat(table.averages()).containsExactly(4 / 3.0, 4 / 3.0);
    }

    @Test
    void distanceIndexFollowsTraversalOrder() {
        ProfileTable table = sampler.sample(gradient, new Point(9, 9), new Point(0, 5));

        assertThat(table.size()).isEqualTo(10);
        assertThat(table.distances()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(table.blue()[0]).isEqualTo(9);
        assertThat(table.blue()[9]).isZero();
        assertThat(table.green()[0]).isEqualTo(9);
        assertThat(table.green()[9]).isEqualTo(5);
    }

    @Test
    void sampleCountMatchesRasterizedPath() {
        Point from = new Point(1, 8);
        Point to = new Point(7, 2);
        List<Point> path = new BresenhamLineRasterizer().rasterize(from, to);

        ProfileTable table = sampler.sample(gradient, from, to);

        assertThat(table.size()).isEqualTo(path.size());
        for (int i = 0; i < path.size(); i++) {
            Point point = path.get(i);
            assertThat(table.samples().get(i).blue()).isEqualTo(point.x());
            assertThat(table.samples().get(i).green()).isEqualTo(point.y());
        }
    }

    @Test
    void farCornerIsInsideImage() {
        ProfileTable table = sampler.sample(gradient, new Point(9, 9), new Point(9, 9));

        assertThat(table.samples()).containsExactly(new SampledPoint(0, 18, 9, 9));
    }

    @Test
    void pointOnePastWidthIsRejected() {
        assertThatThrownBy(() -> sampler.sample(gradient, new Point(0, 0), new Point(10, 0)))
                .isInstanceOf(CoordinateOutOfBoundsException.class)
                .hasMessageContaining("(10, 0)")
                .hasMessageContaining("10x10");
    }

    @Test
    void pointOnePastHeightIsRejected() {
        assertThatThrownBy(() -> sampler.sample(gradient, new Point(0, 10), new Point(0, 0)))
                .isInstanceOf(CoordinateOutOfBoundsException.class)
                .satisfies(ex -> assertThat(((CoordinateOutOfBoundsException) ex).point()).isEqualTo(new Point(0, 10)));
    }

    @Test
    void negativeCoordinatesAreRejected() {
        assertThatThrownBy(() -> sampler.sample(gradient, new Point(-1, 0), new Point(3, 0)))
                .isInstanceOf(CoordinateOutOfBoundsException.class);
    }

    @Test
    void rasterizerOutputOutsideImageIsRejected() {
        LineProfileSampler overshooting = new LineProfileSampler((from, to) -> List.of(from, new Point(42, 0)));

        assertThatThrownBy(() -> overshooting.sample(gradient, new Point(0, 0), new Point(1, 0)))
                .isInstanceOf(CoordinateOutOfBoundsException.class);
    }
}

package io.lineprofile.analyzer.sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads channel intensities at every rasterized coordinate between two endpoints.
 */
public class LineProfileSampler {

    private final LineRasterizer rasterizer;

    public LineProfileSampler() {
        this(new BresenhamLineRasterizer());
    }

    public LineProfileSampler(LineRasterizer rasterizer) {
        this.rasterizer = Objects.requireNonNull(rasterizer, "rasterizer");
    }

    public ProfileTable sample(RgbImage image, Point from, Point to) {
        Objects.requireNonNull(image, "image");
        requireInside(image, from);
        requireInside(image, to);

        List<Point> path = rasterizer.rasterize(from, to);
        List<SampledPoint> samples = new ArrayList<>(path.size());
        for (Point point : path) {
            samples.add(SampledPoint.of(samples.size(), image.pixel(point)));
        }
        return new ProfileTable(samples);
    }

    private static void requireInside(RgbImage image, Point point) {
        Objects.requireNonNull(point, "point");
        if (!image.contains(point)) {
            throw new CoordinateOutOfBoundsException(point, image.width(), image.height());
        }
    }
}

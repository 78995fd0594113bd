package io.lineprofile.analyzer.config;

import io.lineprofile.analyzer.annotate.OverlayStyle;
import io.lineprofile.analyzer.sample.Point;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of one analysis run assembled from CLI arguments and environment values.
 */
public record Config(
        Path imagePath,
        Point from,
        Point to,
        Optional<String> imageName,
        Path outputRoot,
        boolean show,
        LogFormat logFormat,
        OverlayStyle overlayStyle,
        int histogramBins,
        int chartWidth,
        int chartHeight
) {

    public Config {
        Objects.requireNonNull(imagePath, "imagePath");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        imageName = imageName == null ? Optional.empty() : imageName.filter(value -> !value.isBlank());
        Objects.requireNonNull(outputRoot, "outputRoot");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        overlayStyle = overlayStyle == null ? OverlayStyle.defaults() : overlayStyle;
        requirePositive(histogramBins, "histogramBins");
        requirePositive(chartWidth, "chartWidth");
        requirePositive(chartHeight, "chartHeight");
    }

    private static void requirePositive(int value, String fieldName) {
        if (value <= 0) {
            throw new IllegalArgumentException(fieldName + " must be positive");
        }
    }
}

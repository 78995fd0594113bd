package io.lineprofile.analyzer.pipeline;

import io.lineprofile.analyzer.config.Config;
import io.lineprofile.analyzer.output.ImageNames;
import io.lineprofile.analyzer.sample.Point;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One image and the segment to profile on it.
 */
public record AnalysisRequest(Path imagePath, Point from, Point to, Optional<String> imageName) {

    public AnalysisRequest {
        Objects.requireNonNull(imagePath, "imagePath");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        imageName = imageName == null ? Optional.empty() : imageName.filter(value -> !value.isBlank());
    }

    public static AnalysisRequest from(Config config) {
        return new AnalysisRequest(config.imagePath(), config.from(), config.to(), config.imageName());
    }

    public String resolvedImageName() {
        return imageName.orElseGet(() -> ImageNames.deriveFrom(imagePath));
    }
}

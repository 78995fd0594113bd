package io.lineprofile.analyzer.pipeline;

import io.lineprofile.analyzer.sample.ProfileTable;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a completed analysis run.
 */
public record AnalysisResult(String imageName, ProfileTable table, Path outputDirectory, List<Path> writtenFiles) {

    public AnalysisResult {
        Objects.requireNonNull(imageName, "imageName");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        writtenFiles = writtenFiles == null ? List.of() : List.copyOf(writtenFiles);
    }
}

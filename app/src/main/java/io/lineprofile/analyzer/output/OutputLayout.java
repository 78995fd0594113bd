package io.lineprofile.analyzer.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File names written for one analysed image under {@code <root>/<imageName>/}.
 */
public record OutputLayout(Path root, String imageName) {

    public static final String CSV_FILE = "RGB_Channels.csv";
    public static final String PLOTS_FILE = "plots.png";
    public static final String HISTOGRAMS_FILE = "histograms.png";

    public OutputLayout {
        Objects.requireNonNull(root, "root");
        if (imageName == null || imageName.isBlank()) {
            throw new IllegalArgumentException("imageName must not be blank");
        }
        if (imageName.contains("/") || imageName.contains("\\")) {
            throw new IllegalArgumentException("imageName must not contain path separators: " + imageName);
        }
    }

    public Path directory() {
        return root.resolve(imageName);
    }

    public Path csvFile() {
        return directory().resolve(CSV_FILE);
    }

    public Path plotsFile() {
        return directory().resolve(PLOTS_FILE);
    }

    public Path histogramsFile() {
        return directory().resolve(HISTOGRAMS_FILE);
    }

    public Path imageFile(String stem) {
        return directory().resolve(stem + ".png");
    }

    public Path create() {
        Path directory = directory();
        try {
            return Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new OutputWriteException("Failed to create output directory: " + directory, ex);
        }
    }
}

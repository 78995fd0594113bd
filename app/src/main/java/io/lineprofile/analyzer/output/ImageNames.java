package io.lineprofile.analyzer.output;

import java.nio.file.Path;

/**
 * Derives the per-image output folder name from an input file.
 */
public final class ImageNames {

    private ImageNames() {
    }

    /**
     * Strips everything from the first dot of the file name, so {@code scan.v2.tif} becomes {@code scan}.
     */
    public static String deriveFrom(Path imagePath) {
        if (imagePath == null || imagePath.getFileName() == null) {
            throw new IllegalArgumentException("imagePath must name a file");
        }
        String fileName = imagePath.getFileName().toString();
        int dot = fileName.indexOf('.');
        String stem = dot < 0 ? fileName : fileName.substring(0, dot);
        return stem.isBlank() ? fileName : stem;
    }
}

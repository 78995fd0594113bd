package io.lineprofile.analyzer.annotate;

import io.lineprofile.analyzer.output.OutputLayout;
import io.lineprofile.analyzer.output.OutputWriteException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.imageio.ImageIO;

/**
 * Saves annotated images as PNG files into the output directory.
 */
public class AnnotatedImageWriter {

    public List<Path> write(OutputLayout layout, AnnotatedImages images) {
        if (layout == null || images == null) {
            throw new IllegalArgumentException("layout and images must be provided");
        }
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, BufferedImage> entry : images.byName().entrySet()) {
            Path target = layout.imageFile(entry.getKey());
            writePng(entry.getValue(), target);
            written.add(target);
        }
        return written;
    }

    private static void writePng(BufferedImage image, Path target) {
        try {
            if (!ImageIO.write(image, "png", target.toFile())) {
                throw new OutputWriteException("No PNG writer available for " + target);
            }
        } catch (IOException ex) {
            throw new OutputWriteException("Failed to write annotated image: " + target, ex);
        }
    }
}

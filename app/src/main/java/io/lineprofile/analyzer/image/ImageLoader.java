package io.lineprofile.analyzer.image;

import io.lineprofile.analyzer.sample.RgbImage;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes raster images (PNG, JPEG, BMP, GIF, TIFF) through {@link ImageIO}.
 */
public class ImageLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageLoader.class);

    public RgbImage load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        if (!Files.isRegularFile(path)) {
            throw new ImageLoadException("Image file not found: " + path);
        }
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(path.toFile());
        } catch (IOException ex) {
            throw new ImageLoadException("Failed to read image: " + path, ex);
        } catch (RuntimeException ex) {
            throw new ImageLoadException("Corrupt image data in " + path + ": " + ex.getMessage(), ex);
        }
        if (decoded == null) {
            throw new ImageLoadException("Unsupported or corrupt image: " + path);
        }
        LOGGER.debug("Decoded {} ({}x{}, type {})", path, decoded.getWidth(), decoded.getHeight(), decoded.getType());
        return RgbImage.of(decoded);
    }
}

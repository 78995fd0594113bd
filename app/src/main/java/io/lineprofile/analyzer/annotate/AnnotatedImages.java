package io.lineprofile.analyzer.annotate;

import io.lineprofile.analyzer.sample.Channel;
import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The original image and its three channel images, each carrying the line overlay.
 */
public record AnnotatedImages(BufferedImage original, BufferedImage blue, BufferedImage green, BufferedImage red) {

    public static final String ORIGINAL_STEM = "originalImage";

    public AnnotatedImages {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(blue, "blue");
        Objects.requireNonNull(green, "green");
        Objects.requireNonNull(red, "red");
    }

    public BufferedImage channel(Channel channel) {
        return switch (channel) {
            case BLUE -> blue;
            case GREEN -> green;
            case RED -> red;
        };
    }

    public static String stemFor(Channel channel) {
        return channel.name().toLowerCase(Locale.ROOT) + "Channel";
    }

    /**
     * File stem to image, original first.
     */
    public Map<String, BufferedImage> byName() {
        Map<String, BufferedImage> images = new LinkedHashMap<>();
        images.put(ORIGINAL_STEM, original);
        for (Channel channel : Channel.values()) {
            images.put(stemFor(channel), channel(channel));
        }
        return images;
    }
}

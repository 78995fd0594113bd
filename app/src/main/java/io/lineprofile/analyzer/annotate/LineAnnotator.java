package io.lineprofile.analyzer.annotate;

import io.lineprofile.analyzer.sample.Channel;
import io.lineprofile.analyzer.sample.Point;
import io.lineprofile.analyzer.sample.RgbImage;
import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.Objects;

/**
 * Draws the sampled segment and a start marker onto copies of an image and its channel images.
 *
 * <p>On the colour image covered pixels become pure blue at the overlay shade, the blue-first
 * reading of a single scalar colour.
 */
public class LineAnnotator {

    private final OverlayStyle style;
    private final ChannelSplitter channelSplitter;

    public LineAnnotator(OverlayStyle style) {
        this(style, new ChannelSplitter());
    }

    public LineAnnotator(OverlayStyle style, ChannelSplitter channelSplitter) {
        this.style = Objects.requireNonNull(style, "style");
        this.channelSplitter = Objects.requireNonNull(channelSplitter, "channelSplitter");
    }

    public AnnotatedImages annotate(RgbImage image, Point from, Point to) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        OverlayMask mask = OverlayMask.draw(image.width(), image.height(), from, to, style);

        BufferedImage original = image.copyToBufferedImage();
        mask.applyAsChannelColour(original, Channel.BLUE, style.shade());

        Map<Channel, BufferedImage> channels = channelSplitter.split(image);
        for (BufferedImage channelImage : channels.values()) {
            mask.applyToGray(channelImage, style.shade());
        }
        return new AnnotatedImages(original,
                channels.get(Channel.BLUE),
                channels.get(Channel.GREEN),
                channels.get(Channel.RED));
    }
}

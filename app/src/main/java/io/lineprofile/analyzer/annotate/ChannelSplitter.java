package io.lineprofile.analyzer.annotate;

import io.lineprofile.analyzer.sample.Channel;
import io.lineprofile.analyzer.sample.Pixel;
import io.lineprofile.analyzer.sample.RgbImage;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decomposes an image into one 8-bit grayscale image per channel.
 */
public class ChannelSplitter {

    public Map<Channel, BufferedImage> split(RgbImage image) {
        Objects.requireNonNull(image, "image");
        Map<Channel, BufferedImage> channels = new EnumMap<>(Channel.class);
        Map<Channel, WritableRaster> rasters = new EnumMap<>(Channel.class);
        for (Channel channel : Channel.values()) {
            BufferedImage gray = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_BYTE_GRAY);
            channels.put(channel, gray);
            rasters.put(channel, gray.getRaster());
        }
        for (int y = 0; y < image.height(); y++) {
            for (int x = 0; x < image.width(); x++) {
                Pixel pixel = image.pixel(x, y);
                for (Channel channel : Channel.values()) {
                    rasters.get(channel).setSample(x, y, 0, pixel.channel(channel));
                }
            }
        }
        return channels;
    }
}

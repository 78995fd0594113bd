package io.lineprofile.analyzer.sample;

import java.util.Objects;

/**
 * One pixel's channel intensities, each in {@code [0, 255]}.
 */
public record Pixel(int blue, int green, int red) {

    public Pixel {
        requireIntensity(blue, Channel.BLUE);
        requireIntensity(green, Channel.GREEN);
        requireIntensity(red, Channel.RED);
    }

    public static Pixel fromArgb(int argb) {
        return new Pixel(Channel.BLUE.fromArgb(argb), Channel.GREEN.fromArgb(argb), Channel.RED.fromArgb(argb));
    }

    public int channel(Channel channel) {
        Objects.requireNonNull(channel, "channel");
        return switch (channel) {
            case BLUE -> blue;
            case GREEN -> green;
            case RED -> red;
        };
    }

    public int toRgb() {
        return Channel.RED.toArgb(red) | Channel.GREEN.toArgb(green) | Channel.BLUE.toArgb(blue);
    }

    private static void requireIntensity(int value, Channel channel) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(channel + " intensity out of range: " + value);
        }
    }
}

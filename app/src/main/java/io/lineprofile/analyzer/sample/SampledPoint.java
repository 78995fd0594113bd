package io.lineprofile.analyzer.sample;

/**
 * Channel intensities read at position {@code index} along a sampled line.
 */
public record SampledPoint(int index, int red, int green, int blue) {

    public SampledPoint {
        if (index < 0) {
            throw new IllegalArgumentException("index must be zero or greater");
        }
    }

    public static SampledPoint of(int index, Pixel pixel) {
        return new SampledPoint(index, pixel.channel(Channel.RED), pixel.channel(Channel.GREEN), pixel.channel(Channel.BLUE));
    }

    public int channel(Channel channel) {
        return switch (channel) {
            case RED -> red;
            case GREEN -> green;
            case BLUE -> blue;
        };
    }

    public double average() {
        return (red + green + blue) / 3.0;
    }
}

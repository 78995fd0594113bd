package io.lineprofile.analyzer.sample;

import java.util.List;
import java.util.Objects;

/**
 * Ordered intensity profile along a line, exposed as parallel sequences indexed by distance.
 */
public final class ProfileTable {

    private final List<SampledPoint> samples;

    public ProfileTable(List<SampledPoint> samples) {
        Objects.requireNonNull(samples, "samples");
        for (int i = 0; i < samples.size(); i++) {
            SampledPoint sample = Objects.requireNonNull(samples.get(i), "sample");
            if (sample.index() != i) {
                throw new IllegalArgumentException("Expected sample index " + i + " but found " + sample.index());
            }
        }
        this.samples = List.copyOf(samples);
    }

    public List<SampledPoint> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int[] distances() {
        return samples.stream().mapToInt(SampledPoint::index).toArray();
    }

    public int[] channel(Channel channel) {
        Objects.requireNonNull(channel, "channel");
        return samples.stream().mapToInt(sample -> sample.channel(channel)).toArray();
    }

    public int[] red() {
        return channel(Channel.RED);
    }

    public int[] green() {
        return channel(Channel.GREEN);
    }

    public int[] blue() {
        return channel(Channel.BLUE);
    }

    public double[] averages() {
        return samples.stream().mapToDouble(SampledPoint::average).toArray();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ProfileTable table && samples.equals(table.samples);
    }

    @Override
    public int hashCode() {
        return samples.hashCode();
    }

    @Override
    public String toString() {
        return "ProfileTable[size=" + samples.size() + "]";
    }
}

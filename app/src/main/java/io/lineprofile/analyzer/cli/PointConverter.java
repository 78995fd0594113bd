package io.lineprofile.analyzer.cli;

import io.lineprofile.analyzer.sample.Point;
import picocli.CommandLine;

/**
 * Parses {@code x,y} pixel coordinates.
 */
public class PointConverter implements CommandLine.ITypeConverter<Point> {

    @Override
    public Point convert(String value) {
        try {
            return Point.parse(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}

package io.lineprofile.analyzer.sample;

/**
 * Integer pixel coordinate; {@code x} is the column and {@code y} the row.
 */
public record Point(int x, int y) {

    public static Point parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Point must be provided as x,y");
        }
        String[] parts = raw.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Point must be provided as x,y: " + raw);
        }
        try {
            return new Point(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Point coordinates must be integers: " + raw, ex);
        }
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}

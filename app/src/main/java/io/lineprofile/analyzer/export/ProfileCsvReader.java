package io.lineprofile.analyzer.export;

import io.lineprofile.analyzer.sample.ProfileTable;
import io.lineprofile.analyzer.sample.SampledPoint;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses tables produced by {@link ProfileCsvWriter}. The average column is recomputed from the channels.
 */
public class ProfileCsvReader {

    private static final int COLUMN_COUNT = 5;

    public ProfileTable read(Path source) {
        List<String> lines;
        try {
            lines = Files.readAllLines(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read profile table: " + source, ex);
        }
        List<SampledPoint> samples = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            samples.add(parseRow(line, i + 1));
        }
        return new ProfileTable(samples);
    }

    private static SampledPoint parseRow(String line, int lineNumber) {
        String[] columns = line.split(String.valueOf(ProfileCsvWriter.DELIMITER));
        if (columns.length != COLUMN_COUNT) {
            throw new IllegalArgumentException("Line " + lineNumber + ": expected " + COLUMN_COUNT
                    + " columns but found " + columns.length);
        }
        return new SampledPoint(
                parseWhole(columns[0], lineNumber),
                parseWhole(columns[1], lineNumber),
                parseWhole(columns[2], lineNumber),
                parseWhole(columns[3], lineNumber));
    }

    private static int parseWhole(String raw, int lineNumber) {
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Line " + lineNumber + ": not a number: " + raw, ex);
        }
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException("Line " + lineNumber + ": expected a whole number but found " + raw);
        }
        return (int) value;
    }
}

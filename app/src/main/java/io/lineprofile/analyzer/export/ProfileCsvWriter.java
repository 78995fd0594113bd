package io.lineprofile.analyzer.export;

import io.lineprofile.analyzer.output.OutputWriteException;
import io.lineprofile.analyzer.sample.ProfileTable;
import io.lineprofile.analyzer.sample.SampledPoint;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/**
 * Writes a profile as headerless {@code index,red,green,blue,average} rows.
 */
public class ProfileCsvWriter {

    static final String NUMBER_FORMAT = "%.18e";
    static final char DELIMITER = ',';

    public void write(Path target, ProfileTable table) {
        if (target == null || table == null) {
            throw new IllegalArgumentException("target and table must be provided");
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (SampledPoint sample : table.samples()) {
                writer.write(formatRow(sample));
                writer.write('\n');
            }
        } catch (IOException ex) {
            throw new OutputWriteException("Failed to write profile table: " + target, ex);
        }
    }

    static String formatRow(SampledPoint sample) {
        return format(sample.index()) + DELIMITER
                + format(sample.red()) + DELIMITER
                + format(sample.green()) + DELIMITER
                + format(sample.blue()) + DELIMITER
                + format(sample.average());
    }

    /**
     * Formats the exact binary value, as C's printf does; {@code %e} on a double would pad with zeros instead.
     */
    private static String format(double value) {
        return String.format(Locale.ROOT, NUMBER_FORMAT, new BigDecimal(value));
    }
}

package io.lineprofile.analyzer.config;

import io.lineprofile.analyzer.annotate.OverlayStyle;
import io.lineprofile.analyzer.chart.ProfileChartRenderer;
import io.lineprofile.analyzer.cli.CliArguments;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_ROOT = "LINE_PROFILE_OUTPUT_ROOT";
    static final String ENV_SHOW = "LINE_PROFILE_SHOW";
    static final String ENV_LINE_THICKNESS = "LINE_PROFILE_LINE_THICKNESS";
    static final String ENV_OVERLAY_SHADE = "LINE_PROFILE_OVERLAY_SHADE";
    static final String ENV_MARKER_RADIUS = "LINE_PROFILE_MARKER_RADIUS";
    static final String ENV_HISTOGRAM_BINS = "LINE_PROFILE_HISTOGRAM_BINS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_OUTPUT_ROOT = "Output";
    static final int DEFAULT_CHART_WIDTH = 900;
    static final int DEFAULT_CHART_HEIGHT = 650;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.imagePath() == null) {
            throw new IllegalArgumentException("image path must be provided");
        }

        Path outputRoot = Optional.ofNullable(arguments.outputRoot())
                .or(() -> environmentReader.get(ENV_OUTPUT_ROOT)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of))
                .orElse(Path.of(DEFAULT_OUTPUT_ROOT));

        boolean show = resolveShow(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        int lineThickness = resolveInt(arguments.lineThickness(), ENV_LINE_THICKNESS, OverlayStyle.DEFAULT_LINE_THICKNESS);
        int shade = resolveInt(arguments.overlayShade(), ENV_OVERLAY_SHADE, OverlayStyle.DEFAULT_SHADE);
        int markerRadius = resolveInt(arguments.markerRadius(), ENV_MARKER_RADIUS, OverlayStyle.defaultMarkerRadius(lineThickness));
        int histogramBins = resolveInt(arguments.histogramBins(), ENV_HISTOGRAM_BINS, ProfileChartRenderer.DEFAULT_HISTOGRAM_BINS);
        int chartWidth = arguments.chartWidth() != null ? arguments.chartWidth() : DEFAULT_CHART_WIDTH;
        int chartHeight = arguments.chartHeight() != null ? arguments.chartHeight() : DEFAULT_CHART_HEIGHT;

        Optional<String> imageName = Optional.ofNullable(arguments.imageName())
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);

        return new Config(arguments.imagePath(), arguments.from(), arguments.to(), imageName, outputRoot, show,
                logFormat, new OverlayStyle(lineThickness, shade, markerRadius), histogramBins, chartWidth, chartHeight);
    }

    private boolean resolveShow(CliArguments arguments) {
        if (arguments.show()) {
            return true;
        }
        return environmentReader.get(ENV_SHOW)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveInt(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}

package io.lineprofile.analyzer.cli;

import io.lineprofile.analyzer.config.LogFormat;
import io.lineprofile.analyzer.sample.Point;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "line-profile-analyzer", mixinStandardHelpOptions = true, version = "line-profile-analyzer 0.1.0",
        description = "Samples RGB intensity profiles along a line drawn on an image")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "IMAGE", description = "Image file to analyse (PNG, JPEG, BMP, GIF or TIFF)")
    private Path imagePath;

    @CommandLine.Option(names = "--from", required = true, converter = PointConverter.class, paramLabel = "X,Y",
            description = "Start point of the sampled line")
    private Point from;

    @CommandLine.Option(names = "--to", required = true, converter = PointConverter.class, paramLabel = "X,Y",
            description = "End point of the sampled line")
    private Point to;

    @CommandLine.Option(names = "--image-name", paramLabel = "NAME",
            description = "Output folder name (defaults to the image file name without extension)")
    private String imageName;

    @CommandLine.Option(names = "--output-root", paramLabel = "DIR", description = "Directory receiving per-image output folders")
    private Path outputRoot;

    @CommandLine.Option(names = "--show", description = "Open chart and image preview windows after writing output")
    private boolean show;

    @CommandLine.Option(names = "--line-thickness", paramLabel = "PIXELS", description = "Overlay line thickness")
    private Integer lineThickness;

    @CommandLine.Option(names = "--overlay-shade", paramLabel = "0-255", description = "Overlay intensity")
    private Integer overlayShade;

    @CommandLine.Option(names = "--marker-radius", paramLabel = "PIXELS", description = "Start marker radius (defaults to thickness + 5)")
    private Integer markerRadius;

    @CommandLine.Option(names = "--histogram-bins", paramLabel = "COUNT", description = "Number of histogram bins")
    private Integer histogramBins;

    @CommandLine.Option(names = "--chart-width", paramLabel = "PIXELS", description = "Width of saved chart figures")
    private Integer chartWidth;

    @CommandLine.Option(names = "--chart-height", paramLabel = "PIXELS", description = "Height of saved chart figures")
    private Integer chartHeight;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path imagePath() {
        return imagePath;
    }

    public Point from() {
        return from;
    }

    public Point to() {
        return to;
    }

    public String imageName() {
        return imageName;
    }

    public Path outputRoot() {
        return outputRoot;
    }

    public boolean show() {
        return show;
    }

    public Integer lineThickness() {
        return lineThickness;
    }

    public Integer overlayShade() {
        return overlayShade;
    }

    public Integer markerRadius() {
        return markerRadius;
    }

    public Integer histogramBins() {
        return histogramBins;
    }

    public Integer chartWidth() {
        return chartWidth;
    }

    public Integer chartHeight() {
        return chartHeight;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}

package io.lineprofile.analyzer.chart;

import io.lineprofile.analyzer.output.OutputWriteException;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import javax.imageio.ImageIO;
import org.jfree.chart.JFreeChart;

/**
 * Charts laid out row by row in a fixed number of columns, rendered together as one figure.
 */
public record ChartGrid(String title, List<JFreeChart> charts, int columns) {

    public ChartGrid {
        Objects.requireNonNull(title, "title");
        charts = List.copyOf(Objects.requireNonNull(charts, "charts"));
        if (charts.isEmpty()) {
            throw new IllegalArgumentException("charts must not be empty");
        }
        if (columns <= 0) {
            throw new IllegalArgumentException("columns must be positive");
        }
    }

    public int rows() {
        return (charts.size() + columns - 1) / columns;
    }

    public BufferedImage render(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        BufferedImage figure = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = figure.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            double cellWidth = (double) width / columns;
            double cellHeight = (double) height / rows();
            for (int i = 0; i < charts.size(); i++) {
                int row = i / columns;
                int column = i % columns;
                Rectangle2D area = new Rectangle2D.Double(column * cellWidth, row * cellHeight, cellWidth, cellHeight);
                charts.get(i).draw(graphics, area);
            }
        } finally {
            graphics.dispose();
        }
        return figure;
    }

    public void writePng(Path target, int width, int height) {
        BufferedImage figure = render(width, height);
        try {
            if (!ImageIO.write(figure, "png", target.toFile())) {
                throw new OutputWriteException("No PNG writer available for " + target);
            }
        } catch (IOException ex) {
            throw new OutputWriteException("Failed to write chart figure: " + target, ex);
        }
    }
}

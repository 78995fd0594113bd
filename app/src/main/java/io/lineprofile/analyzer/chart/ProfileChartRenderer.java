package io.lineprofile.analyzer.chart;

import io.lineprofile.analyzer.sample.Channel;
import io.lineprofile.analyzer.sample.ProfileTable;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Paint;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.chart.renderer.xy.XYItemRenderer;
import org.jfree.data.statistics.HistogramDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Builds the line-plot and histogram figures for a {@link ProfileTable}.
 */
public class ProfileChartRenderer {

    public static final int DEFAULT_HISTOGRAM_BINS = 128;

    static final String DISTANCE_LABEL = "Distance [pixels]";
    static final String COUNTS_LABEL = "Counts";
    private static final int GRID_COLUMNS = 2;

    private final int histogramBins;

    public ProfileChartRenderer() {
        this(DEFAULT_HISTOGRAM_BINS);
    }

    public ProfileChartRenderer(int histogramBins) {
        if (histogramBins <= 0) {
            throw new IllegalArgumentException("histogramBins must be positive");
        }
        this.histogramBins = histogramBins;
    }

    public ChartGrid renderPlots(ProfileTable table) {
        requireSamples(table);
        int[] distances = table.distances();
        return new ChartGrid("Intensity profiles", List.of(
                lineChart(distances, toDoubles(table.red()), "Red Channel Intensity", Color.RED),
                lineChart(distances, toDoubles(table.green()), "Green Channel Intensity", Color.GREEN),
                lineChart(distances, toDoubles(table.blue()), "Blue Channel Intensity", Color.BLUE),
                lineChart(distances, table.averages(), "Average RGB Intensity Values", Color.BLACK)),
                GRID_COLUMNS);
    }

    public ChartGrid renderHistograms(ProfileTable table) {
        requireSamples(table);
        return new ChartGrid("Intensity histograms", List.of(
                histogram(toDoubles(table.channel(Channel.RED)), "Red Channel Intensity", Color.RED),
                histogram(toDoubles(table.channel(Channel.GREEN)), "Green Channel Intensity", Color.GREEN),
                histogram(toDoubles(table.channel(Channel.BLUE)), "Blue Channel Intensity", Color.BLUE),
                histogram(table.averages(), "Average RGB Intensity", Color.BLACK)),
                GRID_COLUMNS);
    }

    private JFreeChart lineChart(int[] distances, double[] values, String valueLabel, Paint paint) {
        XYSeries series = new XYSeries(valueLabel, false, true);
        for (int i = 0; i < distances.length; i++) {
            series.add(distances[i], values[i]);
        }
        JFreeChart chart = ChartFactory.createXYLineChart(null, DISTANCE_LABEL, valueLabel,
                new XYSeriesCollection(series), PlotOrientation.VERTICAL, false, false, false);
        XYPlot plot = chart.getXYPlot();
        plot.setDomainCrosshairVisible(false);
        plot.setRangeCrosshairVisible(false);
        XYItemRenderer renderer = plot.getRenderer();
        renderer.setSeriesPaint(0, paint);
        renderer.setSeriesStroke(0, new BasicStroke(1f));
        return chart;
    }

    private JFreeChart histogram(double[] values, String valueLabel, Paint paint) {
        HistogramDataset dataset = new HistogramDataset();
        dataset.addSeries(valueLabel, values, histogramBins);
        JFreeChart chart = ChartFactory.createHistogram(null, valueLabel, COUNTS_LABEL, dataset,
                PlotOrientation.VERTICAL, false, false, false);
        XYPlot plot = chart.getXYPlot();
        XYBarRenderer renderer = (XYBarRenderer) plot.getRenderer();
        renderer.setSeriesPaint(0, paint);
        renderer.setShadowVisible(false);
        renderer.setDrawBarOutline(false);
        return chart;
    }

    private static void requireSamples(ProfileTable table) {
        Objects.requireNonNull(table, "table");
        if (table.isEmpty()) {
            throw new IllegalArgumentException("Cannot chart an empty profile");
        }
    }

    private static double[] toDoubles(int[] values) {
        return Arrays.stream(values).asDoubleStream().toArray();
    }
}

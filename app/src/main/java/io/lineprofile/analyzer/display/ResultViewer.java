package io.lineprofile.analyzer.display;

import io.lineprofile.analyzer.annotate.AnnotatedImages;
import io.lineprofile.analyzer.chart.ChartGrid;

/**
 * Presents analysis output to the user once everything has been written.
 */
public interface ResultViewer {

    void show(ChartGrid plots, ChartGrid histograms, AnnotatedImages images);
}

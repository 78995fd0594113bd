package io.lineprofile.analyzer.display;

import io.lineprofile.analyzer.annotate.AnnotatedImages;
import io.lineprofile.analyzer.chart.ChartGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Viewer used when interactive display is disabled.
 */
public class NoOpResultViewer implements ResultViewer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NoOpResultViewer.class);

    @Override
    public void show(ChartGrid plots, ChartGrid histograms, AnnotatedImages images) {
        LOGGER.debug("Display disabled; skipping preview of {} and {}", plots.title(), histograms.title());
    }
}

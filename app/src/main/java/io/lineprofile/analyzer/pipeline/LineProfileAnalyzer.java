package io.lineprofile.analyzer.pipeline;

import io.lineprofile.analyzer.annotate.AnnotatedImageWriter;
import io.lineprofile.analyzer.annotate.AnnotatedImages;
import io.lineprofile.analyzer.annotate.LineAnnotator;
import io.lineprofile.analyzer.chart.ChartGrid;
import io.lineprofile.analyzer.chart.ProfileChartRenderer;
import io.lineprofile.analyzer.config.Config;
import io.lineprofile.analyzer.display.NoOpResultViewer;
import io.lineprofile.analyzer.display.ResultViewer;
import io.lineprofile.analyzer.display.SwingResultViewer;
import io.lineprofile.analyzer.export.ProfileCsvWriter;
import io.lineprofile.analyzer.image.ImageLoader;
import io.lineprofile.analyzer.output.OutputLayout;
import io.lineprofile.analyzer.sample.LineProfileSampler;
import io.lineprofile.analyzer.sample.ProfileTable;
import io.lineprofile.analyzer.sample.RgbImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the load, sample, export, chart, annotate and display stages for one image.
 */
public class LineProfileAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineProfileAnalyzer.class);
    static final String MDC_IMAGE = "image";

    private final Path outputRoot;
    private final ImageLoader imageLoader;
    private final LineProfileSampler sampler;
    private final ProfileCsvWriter csvWriter;
    private final ProfileChartRenderer chartRenderer;
    private final LineAnnotator annotator;
    private final AnnotatedImageWriter imageWriter;
    private final ResultViewer resultViewer;
    private final int chartWidth;
    private final int chartHeight;

    public LineProfileAnalyzer(Path outputRoot,
                               ImageLoader imageLoader,
                               LineProfileSampler sampler,
                               ProfileCsvWriter csvWriter,
                               ProfileChartRenderer chartRenderer,
                               LineAnnotator annotator,
                               AnnotatedImageWriter imageWriter,
                               ResultViewer resultViewer,
                               int chartWidth,
                               int chartHeight) {
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
        this.imageLoader = Objects.requireNonNull(imageLoader, "imageLoader");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.csvWriter = Objects.requireNonNull(csvWriter, "csvWriter");
        this.chartRenderer = Objects.requireNonNull(chartRenderer, "chartRenderer");
        this.annotator = Objects.requireNonNull(annotator, "annotator");
        this.imageWriter = Objects.requireNonNull(imageWriter, "imageWriter");
        this.resultViewer = Objects.requireNonNull(resultViewer, "resultViewer");
        this.chartWidth = chartWidth;
        this.chartHeight = chartHeight;
    }

    public static LineProfileAnalyzer fromConfig(Config config) {
        ResultViewer viewer = config.show()
                ? new SwingResultViewer(config.chartWidth(), config.chartHeight())
                : new NoOpResultViewer();
        return new LineProfileAnalyzer(config.outputRoot(),
                new ImageLoader(),
                new LineProfileSampler(),
                new ProfileCsvWriter(),
                new ProfileChartRenderer(config.histogramBins()),
                new LineAnnotator(config.overlayStyle()),
                new AnnotatedImageWriter(),
                viewer,
                config.chartWidth(),
                config.chartHeight());
    }

    public AnalysisResult analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        String imageName = request.resolvedImageName();
        OutputLayout layout = new OutputLayout(outputRoot, imageName);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_IMAGE, imageName)) {
            RgbImage image = imageLoader.load(request.imagePath());
            LOGGER.info("Loaded {} ({}x{})", request.imagePath(), image.width(), image.height());

            ProfileTable table = sampler.sample(image, request.from(), request.to());
            LOGGER.info("Sampled {} points from {} to {}", table.size(), request.from(), request.to());

            Path directory = layout.create();
            List<Path> written = new ArrayList<>();

            csvWriter.write(layout.csvFile(), table);
            written.add(layout.csvFile());
            LOGGER.debug("Wrote {}", layout.csvFile());

            ChartGrid plots = chartRenderer.renderPlots(table);
            ChartGrid histograms = chartRenderer.renderHistograms(table);
            plots.writePng(layout.plotsFile(), chartWidth, chartHeight);
            histograms.writePng(layout.histogramsFile(), chartWidth, chartHeight);
            written.add(layout.plotsFile());
            written.add(layout.histogramsFile());
            LOGGER.debug("Wrote {} and {}", layout.plotsFile(), layout.histogramsFile());

            AnnotatedImages annotated = annotator.annotate(image, request.from(), request.to());
            written.addAll(imageWriter.write(layout, annotated));
            LOGGER.info("Wrote {} files to {}", written.size(), directory);

            resultViewer.show(plots, histograms, annotated);
            return new AnalysisResult(imageName, table, directory, written);
        }
    }
}

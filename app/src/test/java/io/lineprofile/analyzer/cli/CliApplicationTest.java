package io.lineprofile.analyzer.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.lineprofile.analyzer.TestImages;
import io.lineprofile.analyzer.annotate.AnnotatedImageWriter;
import io.lineprofile.analyzer.annotate.LineAnnotator;
import io.lineprofile.analyzer.chart.ProfileChartRenderer;
import io.lineprofile.analyzer.config.Config;
import io.lineprofile.analyzer.config.ConfigLoader;
import io.lineprofile.analyzer.export.ProfileCsvWriter;
import io.lineprofile.analyzer.image.ImageLoader;
import io.lineprofile.analyzer.pipeline.AnalysisRequest;
import io.lineprofile.analyzer.pipeline.AnalysisResult;
import io.lineprofile.analyzer.pipeline.LineProfileAnalyzer;
import io.lineprofile.analyzer.sample.CoordinateOutOfBoundsException;
import io.lineprofile.analyzer.sample.LineProfileSampler;
import io.lineprofile.analyzer.sample.Point;
import io.lineprofile.analyzer.sample.ProfileTable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void runCompletesWithSuccessWhenRequiredArgsProvided() {
        List<AnalysisRequest> requests = new ArrayList<>();
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, requests, null));

        int exitCode = application.run(new String[] {
                "Photos/UnknownThickness/DSL30001.TIF",
                "--from", "1454,627",
                "--to", "1548,772",
                "--output-root", tempDir.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).from()).isEqualTo(new Point(1454, 627));
        assertThat(requests.get(0).to()).isEqualTo(new Point(1548, 772));
        assertThat(requests.get(0).resolvedImageName()).isEqualTo("DSL30001");
    }

    @Test
    void missingEndpointIsInvalidInput() {
        List<AnalysisRequest> requests = new ArrayList<>();
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, requests, null));

        int exitCode = application.run(new String[] {"scan.png", "--from", "1,1"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(requests).isEmpty();
    }

    @Test
    void malformedPointIsInvalidInput() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, new ArrayList<>(), null));

        int exitCode = application.run(new String[] {"scan.png", "--from", "1;1", "--to", "2,2"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void unknownLogFormatIsInvalidInput() {
        List<AnalysisRequest> requests = new ArrayList<>();
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, requests, null));

        int exitCode = application.run(new String[] {"scan.png", "--from", "1,1", "--to", "2,2", "--log-format", "xml"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(requests).isEmpty();
    }

    @Test
    void invalidConfigurationIsInvalidInput() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, new ArrayList<>(), null));

        int exitCode = application.run(new String[] {"scan.png", "--from", "1,1", "--to", "2,2", "--line-thickness", "0"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void helpExitsWithoutAnalysis() {
        List<AnalysisRequest> requests = new ArrayList<>();
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, requests, null));

        int exitCode = application.run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(requests).isEmpty();
    }

    @Test
    void analysisFailureMapsToExitCodeOne() {
        CoordinateOutOfBoundsException failure = new CoordinateOutOfBoundsException(new Point(20, 0), 10, 10);
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                config -> new RecordingAnalyzer(config, new ArrayList<>(), failure));

        int exitCode = application.run(new String[] {"scan.png", "--from", "0,0", "--to", "20,0"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_ANALYSIS_FAILED);
    }

    @Test
    void missingImageFileMapsToExitCodeOne() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                LineProfileAnalyzer::fromConfig);

        int exitCode = application.run(new String[] {
                tempDir.resolve("absent.png").toString(),
                "--from", "0,0", "--to", "1,1",
                "--output-root", tempDir.resolve("Output").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_ANALYSIS_FAILED);
    }

    @Test
    void endToEndRunWritesCsv() throws Exception {
        assumeTrue(TestImages.fontsAvailable(), "chart rendering needs fonts");
        Path image = TestImages.writePng(TestImages.coordinateGradient(10, 10), tempDir.resolve("grid.png"));
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                LineProfileAnalyzer::fromConfig);

        int exitCode = application.run(new String[] {
                image.toString(), "--from", "0,0", "--to", "9,0",
                "--output-root", tempDir.resolve("Output").toString()
        });

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("Output/grid/RGB_Channels.csv")).isRegularFile();
    }

    private static final class RecordingAnalyzer extends LineProfileAnalyzer {

        private final List<AnalysisRequest> requests;
        private final RuntimeException failure;

        RecordingAnalyzer(Config config, List<AnalysisRequest> requests, RuntimeException failure) {
            super(config.outputRoot(), new ImageLoader(),
                    new LineProfileSampler(),
                    new ProfileCsvWriter(),
                    new ProfileChartRenderer(config.histogramBins()),
                    new LineAnnotator(config.overlayStyle()),
                    new AnnotatedImageWriter(),
                    (plots, histograms, images) -> { },
                    config.chartWidth(), config.chartHeight());
            this.requests = requests;
            this.failure = failure;
        }

        @Override
        public AnalysisResult analyze(AnalysisRequest request) {
            requests.add(request);
            if (failure != null) {
                throw failure;
            }
            return new AnalysisResult(request.resolvedImageName(), new ProfileTable(List.of()), Path.of("out"), List.of());
        }
    }
}

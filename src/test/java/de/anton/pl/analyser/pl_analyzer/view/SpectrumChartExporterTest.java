package de.anton.pl.analyser.pl_analyzer.view;

import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisConfiguration;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisResult;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisService;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.Marker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.ui.Layer;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.GraphicsEnvironment;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpectrumChartExporterTest {

    private static final Spectrum SPECTRUM = Spectrum.of(
            new double[]{500, 502, 504, 506, 508, 510, 512},
            new double[]{0.1, 0.3, 0.9, 0.3, 0.1, 0.5, 0.1});

    @TempDir
    Path tempDir;

    private final SpectrumChartExporter exporter = new SpectrumChartExporter();

    private static AnalysisResult analyse(Spectrum spectrum) {
        return new AnalysisService().runFullAnalysis("C7", spectrum, AnalysisConfiguration.defaults());
    }

    private static boolean fontsAvailable() {
        try {
            return GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames().length > 0;
        } catch (Throwable t) {
            return false;
        }
    }

    @Test
    void shouldPlotProcessedAndFittedSeriesWithPeakMarkers() {
        JFreeChart chart = exporter.createChart(analyse(SPECTRUM));

        XYPlot plot = chart.getXYPlot();
        assertThat(chart.getTitle().getText()).isEqualTo("Sample C7");
        assertThat(plot.getDataset().getSeriesCount()).isEqualTo(2);
        assertThat(plot.getDataset().getSeriesKey(1)).isEqualTo("Fit (gaussian)");
        assertThat(plot.getDataset().getItemCount(0)).isEqualTo(SPECTRUM.size());
        assertThat(plot.getDomainMarkers(Layer.FOREGROUND)).hasSize(2);
    }

    @Test
    void shouldLabelPeakMarkersIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            JFreeChart chart = exporter.createChart(analyse(SPECTRUM));

            assertThat(chart.getXYPlot().getDomainMarkers(Layer.FOREGROUND))
                    .extracting(marker -> ((Marker) marker).getLabel())
                    .containsExactlyInAnyOrder("504.0", "510.0");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shouldPlotOnlyProcessedSeriesWithoutPeaks() {
        Spectrum rising = Spectrum.of(new double[]{500, 501, 502}, new double[]{0.1, 0.2, 0.3});

        JFreeChart chart = exporter.createChart(analyse(rising));

        assertThat(chart.getXYPlot().getDataset().getSeriesCount()).isEqualTo(1);
    }

    @Test
    void shouldWritePngFile() throws IOException {
        Assumptions.assumeTrue(fontsAvailable(), "No fonts available for chart rendering");
        File file = tempDir.resolve("chart.png").toFile();

        exporter.exportChart(analyse(SPECTRUM), file, 400, 300);

        assertThat(file).exists();
        assertThat(file.length()).isPositive();
    }

    @Test
    void shouldRejectNonPositiveSize() {
        File file = tempDir.resolve("chart.png").toFile();

        assertThatThrownBy(() -> exporter.exportChart(analyse(SPECTRUM), file, 0, 300))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

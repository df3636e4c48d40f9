package de.anton.pl.analyser.pl_analyzer.view;

import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.SpectralPoint;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisResult;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders an analysis result (processed spectrum, fitted curve, peak markers) to a PNG image.
 */
public class SpectrumChartExporter {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumChartExporter.class);

    private static final Color PROCESSED_COLOR = new Color(31, 119, 180);
    private static final Color FITTED_COLOR = new Color(214, 39, 40);
    private static final Color PEAK_MARKER_COLOR = new Color(120, 120, 120);
    private static final Stroke FITTED_STROKE = new BasicStroke(1.5f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
            10.0f, new float[]{6.0f, 4.0f}, 0.0f);

    public static final int DEFAULT_WIDTH = 1000;
    public static final int DEFAULT_HEIGHT = 600;

    /** Builds the chart without rendering it. */
    public JFreeChart createChart(AnalysisResult result) {
        Objects.requireNonNull(result, "Analysis result cannot be null.");
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(toSeries("Processed", result.processed()));
        result.fitting().ifPresent(fit -> dataset.addSeries(toSeries("Fit (" + fit.model().getKey() + ")", fit.fittedData())));

        JFreeChart chart = ChartFactory.createXYLineChart(
                "Sample " + result.sampleId(),
                "Wavelength (nm)",
                "Intensity (a.u.)",
                dataset,
                PlotOrientation.VERTICAL,
                true, false, false);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        renderer.setSeriesPaint(0, PROCESSED_COLOR);
        if (dataset.getSeriesCount() > 1) {
            renderer.setSeriesPaint(1, FITTED_COLOR);
            renderer.setSeriesStroke(1, FITTED_STROKE);
        }
        plot.setRenderer(renderer);

        for (Peak peak : result.peaks()) {
            ValueMarker marker = new ValueMarker(peak.position());
            marker.setPaint(PEAK_MARKER_COLOR);
            marker.setLabel(String.format(Locale.ROOT, "%.1f", peak.position()));
            plot.addDomainMarker(marker);
        }
        return chart;
    }

    /** Renders the chart to a PNG file. */
    public void exportChart(AnalysisResult result, File file, int width, int height) throws IOException {
        Objects.requireNonNull(file, "Output file cannot be null.");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Chart size must be positive, got " + width + "x" + height);
        }
        JFreeChart chart = createChart(result);
        try {
            ChartUtils.saveChartAsPNG(file, chart, width, height);
            logger.info("Chart for sample '{}' written to {}", result.sampleId(), file.getAbsolutePath());
        } catch (IOException e) {
            logger.error("Could not write chart to {}", file.getAbsolutePath(), e);
            throw e;
        }
    }

    public void exportChart(AnalysisResult result, File file) throws IOException {
        exportChart(result, file, DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    // Duplicate wavelengths are allowed in a spectrum, so the series must allow duplicate x values.
    private XYSeries toSeries(String name, Spectrum spectrum) {
        XYSeries series = new XYSeries(name, false, true);
        for (SpectralPoint point : spectrum) {
            series.add(point.wavelength(), point.intensity());
        }
        return series;
    }
}

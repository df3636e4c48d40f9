package de.anton.pl.analyser.pl_analyzer.controller;

import de.anton.pl.analyser.pl_analyzer.algorithms.PeakDetector;
import de.anton.pl.analyser.pl_analyzer.algorithms.SpectrumPreprocessor;
import de.anton.pl.analyser.pl_analyzer.exception.SpectrumAnalysisException;
import de.anton.pl.analyser.pl_analyzer.model.BaselineMethod;
import de.anton.pl.analyser.pl_analyzer.model.CsvExporter;
import de.anton.pl.analyser.pl_analyzer.model.ExcelExporter;
import de.anton.pl.analyser.pl_analyzer.model.FittingResult;
import de.anton.pl.analyser.pl_analyzer.model.NormalizationMethod;
import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.PeakModel;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumStatistics;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisConfiguration;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisResult;
import de.anton.pl.analyser.pl_analyzer.service.AnalysisService;
import de.anton.pl.analyser.pl_analyzer.service.DetectionParameters;
import de.anton.pl.analyser.pl_analyzer.service.PreprocessingConfig;
import de.anton.pl.analyser.pl_analyzer.service.SpectrumDataService;
import de.anton.pl.analyser.pl_analyzer.view.SpectrumChartExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Loads a spectrum file, runs the analysis and prints/exports the results.
 */
@Command(
    name = "analyze",
    mixinStandardHelpOptions = true,
    description = "Preprocess a spectrum, detect peaks, fit a model curve and report statistics"
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "Input file (.csv, .txt, .xlsx, .xls)")
    private File inputFile;

    @Option(names = {"--sample-id"}, description = "Sample identifier (default: input file name)")
    private String sampleId;

    @Option(names = {"--outliers"}, description = "Enable z-score outlier removal")
    private boolean outlierRemoval;

    @Option(names = {"--outlier-threshold"}, description = "Z-score threshold (default: ${DEFAULT-VALUE})")
    private double outlierThreshold = SpectrumPreprocessor.DEFAULT_OUTLIER_THRESHOLD;

    @Option(names = {"--smooth-window"}, description = "Enable noise reduction with this window length (>= 3)")
    private Integer smoothWindow;

    @Option(names = {"--smooth-order"}, description = "Savitzky-Golay polynomial order, recorded only (default: ${DEFAULT-VALUE})")
    private int smoothOrder = 2;

    @Option(names = {"--baseline"}, converter = BaselineMethodConverter.class,
            description = "Baseline correction method: polynomial or als")
    private BaselineMethod baselineMethod;

    @Option(names = {"--baseline-degree"}, description = "Polynomial baseline degree (default: ${DEFAULT-VALUE})")
    private int baselineDegree = SpectrumPreprocessor.DEFAULT_BASELINE_DEGREE;

    @Option(names = {"--als-lambda"}, description = "ALS smoothness parameter, recorded only")
    private Double alsLambda;

    @Option(names = {"--als-p"}, description = "ALS asymmetry parameter, recorded only")
    private Double alsP;

    @Option(names = {"--normalize"}, converter = NormalizationMethodConverter.class,
            description = "Normalization method: max or area")
    private NormalizationMethod normalization;

    @Option(names = {"--prominence"}, description = "Minimum peak prominence (default: ${DEFAULT-VALUE})")
    private double prominence = PeakDetector.DEFAULT_PROMINENCE;

    @Option(names = {"--min-height"}, description = "Minimum peak height (default: ${DEFAULT-VALUE})")
    private double minHeight = PeakDetector.DEFAULT_MIN_HEIGHT;

    @Option(names = {"--model"}, converter = PeakModelConverter.class,
            description = "Peak model: gaussian, lorentzian or voigt (default: gaussian)")
    private PeakModel model = PeakModel.GAUSSIAN;

    @Option(names = {"--csv"}, description = "Write the processed spectrum to this CSV file")
    private File csvOutput;

    @Option(names = {"--xlsx"}, description = "Write the full analysis to this Excel file")
    private File xlsxOutput;

    @Option(names = {"--chart"}, description = "Render the processed spectrum and fit to this PNG file")
    private File chartOutput;

    private final SpectrumDataService dataService;
    private final AnalysisService analysisService;

    public AnalyzeCommand() {
        this(new SpectrumDataService(), new AnalysisService());
    }

    AnalyzeCommand(SpectrumDataService dataService, AnalysisService analysisService) {
        this.dataService = dataService;
        this.analysisService = analysisService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            AnalysisConfiguration config = buildConfiguration();
            Spectrum raw = dataService.loadSpectrum(inputFile);
            String id = sampleId != null ? sampleId : inputFile.getName();

            AnalysisResult result = analysisService.runFullAnalysis(id, raw, config);
            printResult(out, result);

            if (csvOutput != null) {
                new CsvExporter().exportSpectrum(result.processed(), csvOutput);
            }
            if (xlsxOutput != null) {
                new ExcelExporter().exportAnalysis(result, raw, xlsxOutput);
            }
            if (chartOutput != null) {
                new SpectrumChartExporter().exportChart(result, chartOutput);
            }
            return 0;
        } catch (IOException | SpectrumAnalysisException | IllegalArgumentException e) {
            logger.debug("Analyze command failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    AnalysisConfiguration buildConfiguration() {
        PreprocessingConfig.Builder builder = PreprocessingConfig.builder();
        if (outlierRemoval) {
            builder.outlierRemoval(outlierThreshold);
        }
        if (smoothWindow != null) {
            builder.noiseReduction(smoothWindow, smoothOrder);
        }
        if (baselineMethod == BaselineMethod.POLYNOMIAL) {
            builder.polynomialBaseline(baselineDegree);
        } else if (baselineMethod == BaselineMethod.ALS) {
            builder.baselineCorrection(PreprocessingConfig.BaselineCorrection.als(alsLambda, alsP));
        }
        if (normalization != null) {
            builder.normalization(normalization);
        }
        return new AnalysisConfiguration(builder.build(), new DetectionParameters(prominence, minHeight), model);
    }

    private void printResult(PrintWriter out, AnalysisResult result) {
        out.printf(Locale.ROOT, "Sample: %s (%d points after preprocessing)%n", result.sampleId(), result.processed().size());
        out.printf(Locale.ROOT, "Peaks: %d%n", result.peaks().size());
        if (!result.peaks().isEmpty()) {
            out.printf(Locale.ROOT, "  %-4s %12s %12s %10s %12s %12s%n", "#", "Position", "Amplitude", "FWHM", "Area", "Prominence");
            int n = 1;
            for (Peak peak : result.peaks()) {
                out.printf(Locale.ROOT, "  %-4d %12.3f %12.5g %10.3f %12.5g %12.5g%n",
                        n++, peak.position(), peak.amplitude(), peak.fwhm(), peak.area(), peak.prominence());
            }
        }
        if (result.fitting().isPresent()) {
            FittingResult fit = result.fitting().get();
            String note = fit.model().isApproximated() ? " (computed as " + fit.model().profile().getKey() + ")" : "";
            out.printf(Locale.ROOT, "Fit: %s%s, R²=%.4f, RMSE=%.4g%n", fit.model().getKey(), note, fit.rSquared(), fit.rmse());
        } else {
            out.println("Fit: skipped, no peaks found");
        }
        SpectrumStatistics stats = result.statistics();
        out.printf(Locale.ROOT, "Statistics: mean=%.5g, std=%.5g, max=%.5g, min=%.5g, area=%.5g%n",
                stats.meanIntensity(), stats.stdIntensity(), stats.maxIntensity(), stats.minIntensity(), stats.totalArea());
        out.flush();
    }

    static class PeakModelConverter implements CommandLine.ITypeConverter<PeakModel> {
        @Override
        public PeakModel convert(String value) {
            PeakModel model = PeakModel.fromKey(value);
            if (model == null) {
                throw new CommandLine.TypeConversionException("Unknown peak model '" + value + "'");
            }
            return model;
        }
    }

    static class BaselineMethodConverter implements CommandLine.ITypeConverter<BaselineMethod> {
        @Override
        public BaselineMethod convert(String value) {
            BaselineMethod method = BaselineMethod.fromKey(value);
            if (method == null) {
                throw new CommandLine.TypeConversionException("Unknown baseline method '" + value + "'");
            }
            return method;
        }
    }

    static class NormalizationMethodConverter implements CommandLine.ITypeConverter<NormalizationMethod> {
        @Override
        public NormalizationMethod convert(String value) {
            NormalizationMethod method = NormalizationMethod.fromKey(value);
            if (method == null) {
                throw new CommandLine.TypeConversionException("Unknown normalization method '" + value + "'");
            }
            return method;
        }
    }
}

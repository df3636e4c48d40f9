package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.algorithms.CurveFitter;
import de.anton.pl.analyser.pl_analyzer.algorithms.PeakDetector;
import de.anton.pl.analyser.pl_analyzer.algorithms.StatisticsCalculator;
import de.anton.pl.analyser.pl_analyzer.exception.InvalidSpectrumException;
import de.anton.pl.analyser.pl_analyzer.exception.SpectrumAnalysisException;
import de.anton.pl.analyser.pl_analyzer.model.FittingResult;
import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Service responsible for performing the analysis steps on one spectrum:
 * preprocessing, peak detection, curve fitting and statistics.
 * Holds no state between runs, so independent samples may be analysed concurrently.
 */
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final PreprocessingPipeline pipeline;

    public AnalysisService() {
        this(new PreprocessingPipeline());
    }

    public AnalysisService(PreprocessingPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "Pipeline cannot be null.");
    }

    /**
     * Executes the complete analysis pipeline on a raw spectrum.
     *
     * @param sampleId identifier of the sample the spectrum belongs to.
     * @param raw      the raw spectrum, sorted by wavelength.
     * @param config   preprocessing, detection and model settings.
     * @return the result; {@link FittingStatus#NO_PEAKS} if nothing was detected.
     * @throws InvalidSpectrumException if the raw spectrum is empty.
     * @throws SpectrumAnalysisException for any other failure of a stage (singular baseline fit, failed fit).
     */
    public AnalysisResult runFullAnalysis(String sampleId, Spectrum raw, AnalysisConfiguration config) {
        Objects.requireNonNull(sampleId, "Sample id cannot be null.");
        Objects.requireNonNull(raw, "Raw spectrum cannot be null.");
        Objects.requireNonNull(config, "Analysis configuration cannot be null.");
        logger.info("Service: Starting analysis of sample '{}' ({} points, model={}, prominence={}, minHeight={}).",
                sampleId, raw.size(), config.model(), config.detection().prominence(), config.detection().minHeight());

        if (raw.isEmpty()) {
            logger.warn("Service: Analysis of sample '{}' aborted: spectrum is empty.", sampleId);
            throw new InvalidSpectrumException(0, "sample '" + sampleId + "' has no data points");
        }

        try {
            // 1. Preprocessing
            Spectrum processed = pipeline.process(raw, config.preprocessing());

            // 2. Peak detection
            PeakDetector detector = new PeakDetector(config.detection().prominence(), config.detection().minHeight());
            List<Peak> peaks = detector.detect(processed);
            logger.info("Service: Sample '{}': {} peaks detected.", sampleId, peaks.size());

            // 3. Curve fitting
            FittingStatus status;
            FittingResult fitting = null;
            if (peaks.isEmpty()) {
                status = FittingStatus.NO_PEAKS;
                logger.info("Service: Sample '{}': no peaks found, fitting skipped.", sampleId);
            } else {
                fitting = CurveFitter.fit(processed, peaks, config.model());
                status = FittingStatus.FITTED;
                logger.info("Service: Sample '{}': {} fit R²={}, RMSE={}.",
                        sampleId, fitting.model(), String.format("%.4f", fitting.rSquared()), String.format("%.4f", fitting.rmse()));
            }

            // 4. Statistics
            SpectrumStatistics statistics = StatisticsCalculator.calculate(processed);

            logger.info("Service: Analysis of sample '{}' completed successfully.", sampleId);
            return new AnalysisResult(sampleId, config.preprocessing(), processed, peaks, status, fitting, statistics);
        } catch (SpectrumAnalysisException e) {
            logger.error("Service: Error during analysis of sample '{}'", sampleId, e);
            throw e;
        }
    }
}

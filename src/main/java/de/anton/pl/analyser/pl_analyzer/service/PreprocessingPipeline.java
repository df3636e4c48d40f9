package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.algorithms.SpectrumPreprocessor;
import de.anton.pl.analyser.pl_analyzer.exception.InvalidSpectrumException;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies the configured preprocessing stages in fixed order:
 * outlier removal, noise reduction, baseline correction, normalization.
 */
public class PreprocessingPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PreprocessingPipeline.class);

    /**
     * @throws InvalidSpectrumException if the input spectrum is empty.
     */
    public Spectrum process(Spectrum raw, PreprocessingConfig config) {
        Objects.requireNonNull(raw, "Raw spectrum cannot be null.");
        Objects.requireNonNull(config, "Preprocessing configuration cannot be null.");
        if (raw.isEmpty()) {
            throw new InvalidSpectrumException(0, "cannot preprocess an empty spectrum");
        }

        Spectrum processed = raw;

        // 1. Outlier removal
        PreprocessingConfig.OutlierRemoval outliers = config.outlierRemoval();
        if (outliers != null && outliers.enabled()) {
            processed = SpectrumPreprocessor.removeOutliers(processed, outliers.threshold());
        }

        // 2. Noise reduction
        PreprocessingConfig.NoiseReduction noise = config.noiseReduction();
        if (noise != null) {
            processed = SpectrumPreprocessor.smooth(processed, noise.windowLength());
        }

        // 3. Baseline correction
        PreprocessingConfig.BaselineCorrection baseline = config.baselineCorrection();
        if (baseline != null) {
            if (baseline.method().isImplemented()) {
                processed = SpectrumPreprocessor.correctBaselinePolynomial(processed, baseline.polynomialDegree());
            } else {
                logger.warn("Baseline method '{}' is not implemented; baseline correction skipped.", baseline.method());
            }
        }

        // 4. Normalization
        PreprocessingConfig.Normalization normalization = config.normalization();
        if (normalization != null) {
            processed = SpectrumPreprocessor.normalize(processed, normalization.method());
        }

        logger.debug("Preprocessing finished: {} -> {} points.", raw.size(), processed.size());
        return processed;
    }
}

package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.model.PeakModel;

import java.util.Objects;

/**
 * Immutable configuration object holding all parameters for an analysis run.
 */
public record AnalysisConfiguration(
    PreprocessingConfig preprocessing,
    DetectionParameters detection,
    PeakModel model
) {
    public AnalysisConfiguration {
        Objects.requireNonNull(preprocessing, "Preprocessing configuration cannot be null.");
        Objects.requireNonNull(detection, "Detection parameters cannot be null.");
        Objects.requireNonNull(model, "Peak model cannot be null.");
    }

    /** No preprocessing, default detection thresholds, Gaussian model. */
    public static AnalysisConfiguration defaults() {
        return new AnalysisConfiguration(PreprocessingConfig.none(), DetectionParameters.defaults(), PeakModel.GAUSSIAN);
    }
}

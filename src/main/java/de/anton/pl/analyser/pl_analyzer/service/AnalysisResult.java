package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.model.FittingResult;
import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumStatistics;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete result of a single analysis run, as handed to storage and reporting.
 *
 * @param sampleId      opaque identifier of the analysed sample
 * @param preprocessing configuration the processed spectrum was produced with
 * @param processed     spectrum after preprocessing
 * @param peaks         detected peaks
 * @param fittingStatus whether a curve was fitted
 * @param fittingResult the fit, null when {@code fittingStatus} is {@link FittingStatus#NO_PEAKS}
 * @param statistics    statistics of the processed spectrum
 */
public record AnalysisResult(
    String sampleId,
    PreprocessingConfig preprocessing,
    Spectrum processed,
    List<Peak> peaks,
    FittingStatus fittingStatus,
    FittingResult fittingResult,
    SpectrumStatistics statistics
) {
    public AnalysisResult {
        Objects.requireNonNull(sampleId, "Sample id cannot be null.");
        Objects.requireNonNull(preprocessing, "Preprocessing configuration cannot be null.");
        Objects.requireNonNull(processed, "Processed spectrum cannot be null.");
        Objects.requireNonNull(fittingStatus, "Fitting status cannot be null.");
        Objects.requireNonNull(statistics, "Statistics cannot be null.");
        peaks = List.copyOf(Objects.requireNonNull(peaks, "Peak list cannot be null."));
        if ((fittingStatus == FittingStatus.FITTED) != (fittingResult != null)) {
            throw new IllegalArgumentException("Fitting result must be present exactly when status is FITTED, status=" + fittingStatus);
        }
    }

    public Optional<FittingResult> fitting() {
        return Optional.ofNullable(fittingResult);
    }
}

package de.anton.pl.analyser.pl_analyzer.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of synthesizing a model curve from detected peaks and scoring it against the observed data.
 *
 * @param model      the requested model (VOIGT is kept as requested even though it is drawn as Gaussian)
 * @param peaks      the peaks the curve was built from, in wavelength order
 * @param rSquared   coefficient of determination
 * @param rmse       root mean squared error
 * @param fittedData synthesized curve on the observed wavelength grid
 */
public record FittingResult(PeakModel model, List<Peak> peaks, double rSquared, double rmse, Spectrum fittedData) {

    public FittingResult {
        Objects.requireNonNull(model, "Model cannot be null.");
        Objects.requireNonNull(fittedData, "Fitted data cannot be null.");
        peaks = List.copyOf(Objects.requireNonNull(peaks, "Peak list cannot be null."));
    }
}

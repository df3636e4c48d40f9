package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.exception.CurveFittingException;
import de.anton.pl.analyser.pl_analyzer.exception.DimensionMismatchException;
import de.anton.pl.analyser.pl_analyzer.model.FittingResult;
import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.PeakModel;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds a model curve as the superposition of one line shape per detected peak and scores it
 * against the observed spectrum. Peak parameters are taken from detection as they are; there is
 * no iterative refinement.
 */
public final class CurveFitter {

    private static final Logger logger = LoggerFactory.getLogger(CurveFitter.class);

    private CurveFitter() { throw new IllegalStateException("Utility class"); }

    /**
     * Synthesizes the model curve on the wavelength grid of {@code spectrum}.
     * VOIGT is evaluated with the Gaussian profile.
     */
    public static Spectrum fitCurve(Spectrum spectrum, List<Peak> peaks, PeakModel model) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        Objects.requireNonNull(peaks, "Peak list cannot be null.");
        Objects.requireNonNull(model, "Model cannot be null.");

        PeakModel profile = model.profile();
        double[] wavelengths = spectrum.wavelengths();
        double[] fitted = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            double x = wavelengths[i];
            double sum = 0.0;
            for (Peak peak : peaks) {
                sum += evaluate(profile, x, peak);
            }
            fitted[i] = sum;
        }
        return spectrum.withIntensities(fitted);
    }

    private static double evaluate(PeakModel profile, double x, Peak peak) {
        switch (profile) {
            case GAUSSIAN:
                return PeakShapes.gaussian(x, peak.amplitude(), peak.position(), peak.fwhm() / PeakShapes.FWHM_TO_SIGMA);
            case LORENTZIAN:
                return PeakShapes.lorentzian(x, peak.amplitude(), peak.position(), peak.fwhm() / 2.0);
            default:
                throw new IllegalStateException("No profile for model " + profile);
        }
    }

    /**
     * Synthesizes the curve and scores it.
     *
     * @throws CurveFittingException if the curve or its scores are not finite.
     */
    public static FittingResult fit(Spectrum observed, List<Peak> peaks, PeakModel model) {
        Objects.requireNonNull(model, "Model cannot be null.");
        if (model.isApproximated()) {
            logger.warn("Model '{}' is not implemented as a distinct profile; using '{}' instead.", model, model.profile());
        }
        Spectrum fitted = fitCurve(observed, peaks, model);

        double[] predicted = fitted.intensities();
        for (int i = 0; i < predicted.length; i++) {
            if (!Double.isFinite(predicted[i])) {
                throw new CurveFittingException("Fitted intensity is not finite at " + fitted.get(i).wavelength() + " nm");
            }
        }

        double[] obs = observed.intensities();
        double rSquared = calculateRSquared(obs, predicted);
        double rmse = calculateRmse(obs, predicted);
        if (!Double.isFinite(rSquared) || !Double.isFinite(rmse)) {
            throw new CurveFittingException("Goodness of fit is not finite: R²=" + rSquared + ", RMSE=" + rmse);
        }
        logger.debug("Fitted {} peaks with {} model: R²={}, RMSE={}", peaks.size(), model, rSquared, rmse);
        return new FittingResult(model, peaks, rSquared, rmse, fitted);
    }

    /**
     * {@code 1 - SS_res / SS_tot}. Returns 0 for empty input or flat observed data.
     *
     * @throws DimensionMismatchException if the arrays differ in length.
     */
    public static double calculateRSquared(double[] observed, double[] predicted) {
        checkAligned(observed, predicted);
        if (observed.length == 0) return 0.0;

        double mean = NumericUtils.mean(observed);
        double ssTotal = 0.0;
        double ssResidual = 0.0;
        for (int i = 0; i < observed.length; i++) {
            double dt = observed[i] - mean;
            double dr = observed[i] - predicted[i];
            ssTotal += dt * dt;
            ssResidual += dr * dr;
        }
        if (ssTotal == 0.0) return 0.0;
        return 1.0 - ssResidual / ssTotal;
    }

    /**
     * Root mean squared error. Returns 0 for empty input.
     *
     * @throws DimensionMismatchException if the arrays differ in length.
     */
    public static double calculateRmse(double[] observed, double[] predicted) {
        checkAligned(observed, predicted);
        if (observed.length == 0) return 0.0;

        double sumSq = 0.0;
        for (int i = 0; i < observed.length; i++) {
            double d = observed[i] - predicted[i];
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / observed.length);
    }

    private static void checkAligned(double[] observed, double[] predicted) {
        Objects.requireNonNull(observed, "Observed values cannot be null.");
        Objects.requireNonNull(predicted, "Predicted values cannot be null.");
        if (observed.length != predicted.length) {
            throw new DimensionMismatchException(observed.length, predicted.length);
        }
    }
}

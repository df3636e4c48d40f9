package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.model.NormalizationMethod;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The individual preprocessing stages. Each stage returns a new spectrum and leaves its input untouched.
 * Empty spectra pass through every stage unchanged.
 */
public final class SpectrumPreprocessor {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumPreprocessor.class);

    public static final double DEFAULT_OUTLIER_THRESHOLD = 3.0;
    public static final int DEFAULT_BASELINE_DEGREE = 2;

    private SpectrumPreprocessor() { throw new IllegalStateException("Utility class"); }

    /**
     * Z-score outlier removal: keeps points with {@code |I - mean| <= threshold * std}
     * (population std). A constant spectrum is returned as is.
     */
    public static Spectrum removeOutliers(Spectrum spectrum, double threshold) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        if (spectrum.isEmpty()) return spectrum;

        double[] intensities = spectrum.intensities();
        double mean = NumericUtils.mean(intensities);
        double std = NumericUtils.populationStdDev(intensities);
        if (std == 0.0) {
            logger.debug("Outlier removal skipped: intensities are constant.");
            return spectrum;
        }

        double limit = threshold * std;
        Spectrum result = spectrum.filter(p -> Math.abs(p.intensity() - mean) <= limit);
        logger.debug("Outlier removal (threshold={}): mean={}, std={}, removed {} of {} points.",
                threshold, mean, std, spectrum.size() - result.size(), spectrum.size());
        return result;
    }

    /**
     * Centered moving average. An even window is widened by one; windows are truncated at the
     * edges, so boundary points average only the neighbours that exist.
     */
    public static Spectrum smooth(Spectrum spectrum, int windowLength) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        if (windowLength < 1) {
            throw new IllegalArgumentException("Window length must be positive, got " + windowLength);
        }
        if (spectrum.isEmpty()) return spectrum;

        int window = (windowLength % 2 == 0) ? windowLength + 1 : windowLength;
        int halfWindow = window / 2;

        double[] in = spectrum.intensities();
        double[] out = new double[in.length];
        for (int i = 0; i < in.length; i++) {
            int from = Math.max(0, i - halfWindow);
            int to = Math.min(in.length - 1, i + halfWindow);
            double sum = 0.0;
            for (int j = from; j <= to; j++) {
                sum += in[j];
            }
            out[i] = sum / (to - from + 1);
        }
        logger.debug("Smoothed {} points with moving average window {}.", in.length, window);
        return spectrum.withIntensities(out);
    }

    /**
     * Subtracts a least-squares polynomial baseline fitted against the point index
     * (not the wavelength) and clamps the result at 0.
     *
     * @throws de.anton.pl.analyser.pl_analyzer.exception.SingularMatrixException
     *         if the spectrum has too few points for the requested degree.
     */
    public static Spectrum correctBaselinePolynomial(Spectrum spectrum, int degree) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        if (spectrum.isEmpty()) return spectrum;

        double[] y = spectrum.intensities();
        double[] x = new double[y.length];
        for (int i = 0; i < x.length; i++) x[i] = i;

        double[] coeffs = PolynomialFit.fit(x, y, degree);

        double[] corrected = new double[y.length];
        int clamped = 0;
        for (int i = 0; i < y.length; i++) {
            double value = y[i] - PolynomialFit.evaluate(coeffs, x[i]);
            if (value < 0.0) {
                value = 0.0;
                clamped++;
            }
            corrected[i] = value;
        }
        logger.debug("Polynomial baseline (degree {}) subtracted; {} of {} points clamped to 0.", degree, clamped, y.length);
        return spectrum.withIntensities(corrected);
    }

    /**
     * Divides all intensities by the maximum intensity or by the trapezoidal area.
     * A zero divisor leaves the spectrum unchanged.
     */
    public static Spectrum normalize(Spectrum spectrum, NormalizationMethod method) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        Objects.requireNonNull(method, "Normalization method cannot be null.");
        if (spectrum.isEmpty()) return spectrum;

        double divisor;
        switch (method) {
            case MAX:
                divisor = NumericUtils.max(spectrum.intensities());
                break;
            case AREA:
                divisor = NumericUtils.integrateTrapezoidal(spectrum);
                break;
            default:
                throw new IllegalArgumentException("Unsupported normalization method: " + method);
        }

        if (divisor == 0.0) {
            logger.warn("Normalization by {} skipped: divisor is 0.", method);
            return spectrum;
        }

        double[] in = spectrum.intensities();
        double[] out = new double[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = in[i] / divisor;
        }
        logger.debug("Normalized {} points by {} (divisor={}).", in.length, method, divisor);
        return spectrum.withIntensities(out);
    }
}

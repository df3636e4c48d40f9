package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.model.SpectralPoint;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;

import java.util.List;
import java.util.Objects;

/**
 * Basic numeric helpers shared by the preprocessing, detection and statistics code.
 */
public final class NumericUtils {

    private NumericUtils() { throw new IllegalStateException("Utility class"); }

    /**
     * Trapezoidal integral of intensity over wavelength.
     * Spectra with fewer than two points have zero area.
     */
    public static double integrateTrapezoidal(Spectrum spectrum) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        return integrateTrapezoidal(spectrum.getPoints());
    }

    static double integrateTrapezoidal(List<SpectralPoint> points) {
        double area = 0.0;
        for (int i = 1; i < points.size(); i++) {
            SpectralPoint prev = points.get(i - 1);
            SpectralPoint curr = points.get(i);
            double dx = curr.wavelength() - prev.wavelength();
            double avgY = (curr.intensity() + prev.intensity()) / 2.0;
            area += dx * avgY;
        }
        return area;
    }

    /** Arithmetic mean, 0 for an empty array. */
    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation (divides by N), 0 for an empty array. */
    public static double populationStdDev(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) min = Math.min(min, v);
        return min;
    }
}

package de.anton.pl.analyser.pl_analyzer.algorithms;

/**
 * Line-shape functions. A zero width yields 0 for both shapes.
 */
public final class PeakShapes {

    /** FWHM of a Gaussian in units of sigma, {@code 2 * sqrt(2 * ln 2)} to three decimals. */
    public static final double FWHM_TO_SIGMA = 2.355;

    private PeakShapes() { throw new IllegalStateException("Utility class"); }

    public static double gaussian(double x, double amplitude, double center, double sigma) {
        if (sigma == 0.0) return 0.0;
        double d = x - center;
        return amplitude * Math.exp(-(d * d) / (2.0 * sigma * sigma));
    }

    public static double lorentzian(double x, double amplitude, double center, double halfWidth) {
        if (halfWidth == 0.0) return 0.0;
        double u = (x - center) / halfWidth;
        return amplitude / (1.0 + u * u);
    }
}

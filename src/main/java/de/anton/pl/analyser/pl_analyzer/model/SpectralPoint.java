package de.anton.pl.analyser.pl_analyzer.model;

/**
 * A single photoluminescence measurement: emission intensity at a wavelength (nm).
 */
public record SpectralPoint(double wavelength, double intensity) {

    /** Returns a point at the same wavelength carrying a new intensity. */
    public SpectralPoint withIntensity(double newIntensity) {
        return new SpectralPoint(wavelength, newIntensity);
    }
}

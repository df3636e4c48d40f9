package de.anton.pl.analyser.pl_analyzer.model;

/**
 * Comparison of two spectra by their dominant emission maximum.
 *
 * @param referencePeakWavelength wavelength of the reference spectrum's maximum
 * @param comparedPeakWavelength  wavelength of the compared spectrum's maximum
 * @param spectralShift           {@code compared - reference} wavelength (nm); positive means red shift
 * @param intensityRatio          {@code compared / reference} maximum intensity
 */
public record SpectrumComparison(double referencePeakWavelength, double comparedPeakWavelength,
                                 double spectralShift, double intensityRatio) {

    /** True if the compared sample emits more strongly than the reference. */
    public boolean isEnhanced() {
        return intensityRatio > 1.0;
    }

    /** True if the compared sample emits more weakly than the reference (quenching). */
    public boolean isQuenched() {
        return intensityRatio < 1.0;
    }
}

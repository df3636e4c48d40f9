package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.exception.InvalidSpectrumException;
import de.anton.pl.analyser.pl_analyzer.model.SpectralPoint;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compares two spectra (e.g. before and after modification) by their global emission maximum.
 */
public final class SpectrumComparator {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumComparator.class);

    private SpectrumComparator() { throw new IllegalStateException("Utility class"); }

    /**
     * @throws InvalidSpectrumException if either spectrum is empty or the reference maximum is 0.
     */
    public static SpectrumComparison compare(Spectrum reference, Spectrum compared) {
        Objects.requireNonNull(reference, "Reference spectrum cannot be null.");
        Objects.requireNonNull(compared, "Compared spectrum cannot be null.");
        SpectralPoint refMax = maximum(reference, "reference");
        SpectralPoint cmpMax = maximum(compared, "compared");
        if (refMax.intensity() == 0.0) {
            throw new InvalidSpectrumException(reference.size(), "reference maximum intensity is 0, intensity ratio undefined");
        }

        SpectrumComparison comparison = new SpectrumComparison(
                refMax.wavelength(),
                cmpMax.wavelength(),
                cmpMax.wavelength() - refMax.wavelength(),
                cmpMax.intensity() / refMax.intensity());
        logger.debug("Comparison: shift={} nm, ratio={}", comparison.spectralShift(), comparison.intensityRatio());
        return comparison;
    }

    /** First point with the highest intensity. */
    static SpectralPoint maximum(Spectrum spectrum, String label) {
        if (spectrum.isEmpty()) {
            throw new InvalidSpectrumException(0, label + " spectrum is empty");
        }
        SpectralPoint best = spectrum.get(0);
        for (SpectralPoint p : spectrum) {
            if (p.intensity() > best.intensity()) {
                best = p;
            }
        }
        return best;
    }
}

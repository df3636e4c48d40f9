package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes intensity summary statistics and total area of a spectrum.
 */
public final class StatisticsCalculator {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsCalculator.class);

    private StatisticsCalculator() { throw new IllegalStateException("Utility class"); }

    /** Returns {@link SpectrumStatistics#EMPTY} for an empty spectrum. */
    public static SpectrumStatistics calculate(Spectrum spectrum) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        if (spectrum.isEmpty()) {
            logger.debug("Statistics requested for empty spectrum, returning zeros.");
            return SpectrumStatistics.EMPTY;
        }
        double[] intensities = spectrum.intensities();
        return new SpectrumStatistics(
                NumericUtils.mean(intensities),
                NumericUtils.populationStdDev(intensities),
                NumericUtils.max(intensities),
                NumericUtils.min(intensities),
                NumericUtils.integrateTrapezoidal(spectrum));
    }
}

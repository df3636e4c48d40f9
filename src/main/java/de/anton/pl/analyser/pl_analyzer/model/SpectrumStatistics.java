package de.anton.pl.analyser.pl_analyzer.model;

/**
 * Summary statistics of a spectrum's intensities. Standard deviation is the population one.
 */
public record SpectrumStatistics(double meanIntensity, double stdIntensity, double maxIntensity,
                                 double minIntensity, double totalArea) {

    /** All-zero statistics reported for an empty spectrum. */
    public static final SpectrumStatistics EMPTY = new SpectrumStatistics(0.0, 0.0, 0.0, 0.0, 0.0);
}

package de.anton.pl.analyser.pl_analyzer.service;

/**
 * Outcome of the fitting step of an analysis run. A failed fit is not a status:
 * it surfaces as a {@link de.anton.pl.analyser.pl_analyzer.exception.CurveFittingException}.
 */
public enum FittingStatus {
    FITTED,
    NO_PEAKS
}

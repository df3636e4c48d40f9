package de.anton.pl.analyser.pl_analyzer.exception;

/**
 * Thrown when curve synthesis or its goodness-of-fit scoring produces
 * non-finite values. Distinct from "no peaks found", which is not an error.
 */
public class CurveFittingException extends SpectrumAnalysisException {

    public CurveFittingException(String message) {
        super(message);
    }
}

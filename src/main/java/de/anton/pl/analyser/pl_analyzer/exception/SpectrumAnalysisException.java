package de.anton.pl.analyser.pl_analyzer.exception;

/**
 * Base exception for all failures of the spectral analysis engine.
 * All domain exceptions extend this class so callers can handle engine errors in one place.
 */
public class SpectrumAnalysisException extends RuntimeException {

    public SpectrumAnalysisException(String message) {
        super(message);
    }

    public SpectrumAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.anton.pl.analyser.pl_analyzer.exception;

/**
 * Thrown when a spectrum is empty, too small for the requested operation,
 * or otherwise violates the ordering rules of a {@code Spectrum}.
 */
public class InvalidSpectrumException extends SpectrumAnalysisException {

    private final int pointCount;

    public InvalidSpectrumException(String reason) {
        this(-1, reason);
    }

    public InvalidSpectrumException(int pointCount, String reason) {
        super(pointCount >= 0
                ? "Invalid spectrum (" + pointCount + " points): " + reason
                : "Invalid spectrum: " + reason);
        this.pointCount = pointCount;
    }

    /** Number of points in the offending spectrum, or -1 if not applicable. */
    public int getPointCount() {
        return pointCount;
    }
}

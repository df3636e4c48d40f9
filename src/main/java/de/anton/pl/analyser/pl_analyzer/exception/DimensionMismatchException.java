package de.anton.pl.analyser.pl_analyzer.exception;

/**
 * Thrown when two series that must be index-aligned (observed vs. predicted,
 * x vs. y values) have different lengths.
 */
public class DimensionMismatchException extends SpectrumAnalysisException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + " values but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}

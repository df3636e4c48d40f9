package de.anton.pl.analyser.pl_analyzer.exception;

/**
 * Thrown when Gaussian elimination cannot find a usable pivot, i.e. the normal
 * equations of a polynomial least-squares fit are (numerically) singular.
 */
public class SingularMatrixException extends SpectrumAnalysisException {

    private final int pivotRow;

    public SingularMatrixException(int pivotRow, double pivot) {
        super("Singular matrix: pivot " + pivot + " at row " + pivotRow + " is numerically zero");
        this.pivotRow = pivotRow;
    }

    public SingularMatrixException(String message) {
        super(message);
        this.pivotRow = -1;
    }

    public int getPivotRow() {
        return pivotRow;
    }
}

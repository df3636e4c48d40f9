package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.exception.DimensionMismatchException;
import de.anton.pl.analyser.pl_analyzer.exception.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Least-squares polynomial fitting via the normal equations, solved with
 * Gaussian elimination and partial pivoting.
 */
public final class PolynomialFit {

    private static final Logger logger = LoggerFactory.getLogger(PolynomialFit.class);

    /**
     * A pivot is treated as zero when it is at most this fraction of the largest
     * absolute entry of its column in the diagonally equilibrated matrix.
     */
    static final double SINGULARITY_TOLERANCE = 1e-12;

    private PolynomialFit() { throw new IllegalStateException("Utility class"); }

    /**
     * Fits a polynomial of the given degree to (xs, ys).
     *
     * @return coefficients in ascending powers, length {@code degree + 1}.
     * @throws DimensionMismatchException if xs and ys differ in length.
     * @throws SingularMatrixException    if the normal equations are singular
     *                                    (e.g. fewer distinct x values than coefficients).
     */
    public static double[] fit(double[] xs, double[] ys, int degree) {
        Objects.requireNonNull(xs, "x values cannot be null.");
        Objects.requireNonNull(ys, "y values cannot be null.");
        if (xs.length != ys.length) {
            throw new DimensionMismatchException(xs.length, ys.length);
        }
        if (degree < 0) {
            throw new IllegalArgumentException("Polynomial degree must be non-negative, got " + degree);
        }

        int k = degree + 1;
        double[][] a = new double[k][k];
        double[] b = new double[k];

        // Normal equations: A[r][c] = sum x^(r+c), B[r] = sum y * x^r
        for (int i = 0; i < xs.length; i++) {
            double x = xs[i];
            double y = ys[i];
            for (int r = 0; r < k; r++) {
                b[r] += y * Math.pow(x, r);
                for (int c = 0; c < k; c++) {
                    a[r][c] += Math.pow(x, r + c);
                }
            }
        }
        logger.trace("Built {}x{} normal equations from {} points.", k, k, xs.length);

        return solve(a, b);
    }

    /**
     * Solves {@code a * x = b} with partial pivoting. Both arguments are overwritten.
     * The system is first equilibrated symmetrically by its diagonal, so the pivot test does not
     * depend on the magnitude of the power sums.
     *
     * @throws SingularMatrixException if a pivot is numerically zero or the solution is not finite.
     */
    static double[] solve(double[][] a, double[] b) {
        int n = b.length;

        double[] scale = equilibrationScale(a);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                a[r][c] *= scale[r] * scale[c];
            }
            b[r] *= scale[r];
        }

        double[] columnScale = new double[n];
        for (int c = 0; c < n; c++) {
            for (int r = 0; r < n; r++) {
                columnScale[c] = Math.max(columnScale[c], Math.abs(a[r][c]));
            }
        }

        for (int i = 0; i < n; i++) {
            // Pivot selection
            int maxRow = i;
            double maxEl = Math.abs(a[i][i]);
            for (int r = i + 1; r < n; r++) {
                if (Math.abs(a[r][i]) > maxEl) {
                    maxEl = Math.abs(a[r][i]);
                    maxRow = r;
                }
            }

            double[] tmpRow = a[maxRow];
            a[maxRow] = a[i];
            a[i] = tmpRow;
            double tmp = b[maxRow];
            b[maxRow] = b[i];
            b[i] = tmp;

            double pivot = a[i][i];
            if (!Double.isFinite(pivot) || Math.abs(pivot) <= SINGULARITY_TOLERANCE * columnScale[i]) {
                logger.debug("Elimination stopped at row {}: pivot {} (column scale {}).", i, pivot, columnScale[i]);
                throw new SingularMatrixException(i, pivot);
            }

            for (int r = i + 1; r < n; r++) {
                double factor = -a[r][i] / pivot;
                a[r][i] = 0.0;
                for (int c = i + 1; c < n; c++) {
                    a[r][c] += factor * a[i][c];
                }
                b[r] += factor * b[i];
            }
        }

        // Back substitution, then undo the column scaling
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = 0.0;
            for (int j = i + 1; j < n; j++) {
                sum += a[i][j] * x[j];
            }
            x[i] = (b[i] - sum) / a[i][i];
        }
        for (int i = 0; i < n; i++) {
            x[i] *= scale[i];
            if (!Double.isFinite(x[i])) {
                throw new SingularMatrixException("Non-finite coefficient " + x[i] + " at index " + i);
            }
        }
        return x;
    }

    /**
     * {@code 1 / sqrt|a[i][i]|} per row. Rows with a zero or non-finite diagonal fall back to
     * their largest entry, all-zero rows to 1.
     */
    private static double[] equilibrationScale(double[][] a) {
        int n = a.length;
        double[] scale = new double[n];
        for (int i = 0; i < n; i++) {
            double d = Math.abs(a[i][i]);
            if (d == 0.0 || !Double.isFinite(d)) {
                d = 0.0;
                for (int c = 0; c < n; c++) {
                    d = Math.max(d, Math.abs(a[i][c]));
                }
            }
            scale[i] = (d > 0.0 && Double.isFinite(d)) ? 1.0 / Math.sqrt(d) : 1.0;
        }
        return scale;
    }

    /** Evaluates {@code sum coeffs[i] * x^i}. */
    public static double evaluate(double[] coeffs, double x) {
        Objects.requireNonNull(coeffs, "Coefficients cannot be null.");
        double value = 0.0;
        for (int i = 0; i < coeffs.length; i++) {
            value += coeffs[i] * Math.pow(x, i);
        }
        return value;
    }
}

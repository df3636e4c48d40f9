package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.exception.DimensionMismatchException;
import de.anton.pl.analyser.pl_analyzer.model.FittingResult;
import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.PeakModel;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CurveFitterTest {

    private static Spectrum grid(int from, int to) {
        double[] wavelengths = new double[to - from + 1];
        for (int i = 0; i < wavelengths.length; i++) {
            wavelengths[i] = from + i;
        }
        return Spectrum.of(wavelengths, new double[wavelengths.length]);
    }

    private static final List<Peak> PEAKS = List.of(
            new Peak(510, 1.0, 6.0, 6.4, 0.8),
            new Peak(530, 0.5, 4.0, 2.1, 0.4));

    @Test
    void shouldPlaceAmplitudeAtPeakPosition() {
        Spectrum curve = CurveFitter.fitCurve(grid(500, 540), List.of(PEAKS.get(0)), PeakModel.GAUSSIAN);

        assertThat(curve.get(10).wavelength()).isEqualTo(510.0);
        assertThat(curve.get(10).intensity()).isEqualTo(1.0);
        assertThat(curve.wavelengths()).containsExactly(grid(500, 540).wavelengths());
    }

    @Test
    void shouldSuperimposeAllPeaks() {
        Spectrum grid = grid(500, 540);

        Spectrum sum = CurveFitter.fitCurve(grid, PEAKS, PeakModel.LORENTZIAN);
        Spectrum first = CurveFitter.fitCurve(grid, PEAKS.subList(0, 1), PeakModel.LORENTZIAN);
        Spectrum second = CurveFitter.fitCurve(grid, PEAKS.subList(1, 2), PeakModel.LORENTZIAN);

        for (int i = 0; i < grid.size(); i++) {
            assertThat(sum.get(i).intensity())
                    .isCloseTo(first.get(i).intensity() + second.get(i).intensity(), within(1e-12));
        }
    }

    @Test
    void shouldScorePerfectFit() {
        Spectrum observed = CurveFitter.fitCurve(grid(500, 540), PEAKS, PeakModel.GAUSSIAN);

        FittingResult result = CurveFitter.fit(observed, PEAKS, PeakModel.GAUSSIAN);

        assertThat(result.rSquared()).isCloseTo(1.0, within(1e-12));
        assertThat(result.rmse()).isCloseTo(0.0, within(1e-12));
        assertThat(result.peaks()).isEqualTo(PEAKS);
        assertThat(result.fittedData()).isEqualTo(observed);
    }

    @Test
    void shouldEvaluateVoigtAsGaussian() {
        Spectrum grid = grid(500, 540);

        FittingResult voigt = CurveFitter.fit(grid, PEAKS, PeakModel.VOIGT);
        FittingResult gaussian = CurveFitter.fit(grid, PEAKS, PeakModel.GAUSSIAN);

        assertThat(voigt.model()).isEqualTo(PeakModel.VOIGT);
        assertThat(voigt.fittedData()).isEqualTo(gaussian.fittedData());
    }

    @Test
    void shouldProduceZeroCurveWithoutPeaks() {
        Spectrum curve = CurveFitter.fitCurve(grid(500, 505), List.of(), PeakModel.GAUSSIAN);

        assertThat(curve.intensities()).containsOnly(0.0);
    }

    @Test
    void shouldReturnZeroScoresForDegenerateInput() {
        assertThat(CurveFitter.calculateRSquared(new double[0], new double[0])).isZero();
        assertThat(CurveFitter.calculateRmse(new double[0], new double[0])).isZero();
        assertThat(CurveFitter.calculateRSquared(new double[]{2, 2, 2}, new double[]{1, 2, 3})).isZero();
    }

    @Test
    void shouldComputeRmse() {
        assertThat(CurveFitter.calculateRmse(new double[]{1, 2, 3, 4}, new double[]{2, 3, 4, 5})).isEqualTo(1.0);
        assertThat(CurveFitter.calculateRSquared(new double[]{1, 2, 3}, new double[]{1, 2, 4}))
                .isCloseTo(0.5, within(1e-12));
    }

    @Test
    void shouldRejectMisalignedArrays() {
        assertThatThrownBy(() -> CurveFitter.calculateRSquared(new double[]{1, 2}, new double[]{1}))
                .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> CurveFitter.calculateRmse(new double[]{1}, new double[]{1, 2}))
                .isInstanceOf(DimensionMismatchException.class);
    }
}

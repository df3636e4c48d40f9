package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NumericUtilsTest {

    @Test
    void shouldIntegrateIrregularGridWithTrapezoids() {
        Spectrum spectrum = Spectrum.of(new double[]{0, 1, 3}, new double[]{0, 2, 2});

        // (1 * 1) + (2 * 2)
        assertThat(NumericUtils.integrateTrapezoidal(spectrum)).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void shouldReturnZeroAreaForFewerThanTwoPoints() {
        assertThat(NumericUtils.integrateTrapezoidal(Spectrum.empty())).isZero();
        assertThat(NumericUtils.integrateTrapezoidal(Spectrum.of(new double[]{500}, new double[]{3}))).isZero();
    }

    @Test
    void shouldComputePopulationStandardDeviation() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(NumericUtils.mean(values)).isEqualTo(5.0);
        assertThat(NumericUtils.populationStdDev(values)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void shouldReturnZeroMeanAndStdForEmptyInput() {
        assertThat(NumericUtils.mean(new double[0])).isZero();
        assertThat(NumericUtils.populationStdDev(new double[0])).isZero();
    }

    @Test
    void shouldFindExtremes() {
        double[] values = {0.3, -1.5, 7.25, 2};

        assertThat(NumericUtils.max(values)).isEqualTo(7.25);
        assertThat(NumericUtils.min(values)).isEqualTo(-1.5);
    }
}

package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.exception.InvalidSpectrumException;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumComparison;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpectrumComparatorTest {

    private static final Spectrum BEFORE = Spectrum.of(new double[]{500, 510, 520, 530}, new double[]{0.1, 0.4, 0.8, 0.2});
    private static final Spectrum AFTER = Spectrum.of(new double[]{500, 510, 520, 530}, new double[]{0.1, 0.3, 0.5, 1.2});

    @Test
    void shouldReportShiftAndRatioOfMaxima() {
        SpectrumComparison comparison = SpectrumComparator.compare(BEFORE, AFTER);

        assertThat(comparison.referencePeakWavelength()).isEqualTo(520.0);
        assertThat(comparison.comparedPeakWavelength()).isEqualTo(530.0);
        assertThat(comparison.spectralShift()).isEqualTo(10.0);
        assertThat(comparison.intensityRatio()).isCloseTo(1.5, within(1e-12));
        assertThat(comparison.isEnhanced()).isTrue();
        assertThat(comparison.isQuenched()).isFalse();
    }

    @Test
    void shouldReportQuenchingWhenSwapped() {
        SpectrumComparison comparison = SpectrumComparator.compare(AFTER, BEFORE);

        assertThat(comparison.spectralShift()).isEqualTo(-10.0);
        assertThat(comparison.isQuenched()).isTrue();
    }

    @Test
    void shouldUseFirstOfEqualMaxima() {
        Spectrum twin = Spectrum.of(new double[]{500, 510, 520}, new double[]{1.0, 0.2, 1.0});

        assertThat(SpectrumComparator.compare(twin, twin).referencePeakWavelength()).isEqualTo(500.0);
    }

    @Test
    void shouldRejectEmptySpectra() {
        assertThatThrownBy(() -> SpectrumComparator.compare(Spectrum.empty(), AFTER))
                .isInstanceOf(InvalidSpectrumException.class)
                .hasMessageContaining("reference");
        assertThatThrownBy(() -> SpectrumComparator.compare(BEFORE, Spectrum.empty()))
                .isInstanceOf(InvalidSpectrumException.class)
                .hasMessageContaining("compared");
    }

    @Test
    void shouldRejectZeroReferenceMaximum() {
        Spectrum dark = Spectrum.of(new double[]{500, 510}, new double[]{0, 0});

        assertThatThrownBy(() -> SpectrumComparator.compare(dark, AFTER))
                .isInstanceOf(InvalidSpectrumException.class);
    }
}

package de.anton.pl.analyser.pl_analyzer.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PeakModelTest {

    @Test
    void shouldResolveKeys() {
        assertThat(PeakModel.fromKey("lorentzian")).isEqualTo(PeakModel.LORENTZIAN);
        assertThat(PeakModel.fromKey("VOIGT")).isEqualTo(PeakModel.VOIGT);
        assertThat(PeakModel.fromKey("pearson")).isNull();
        assertThat(BaselineMethod.fromKey("als")).isEqualTo(BaselineMethod.ALS);
        assertThat(NormalizationMethod.fromKey("area")).isEqualTo(NormalizationMethod.AREA);
    }

    @Test
    void shouldFlagApproximatedModels() {
        assertThat(PeakModel.VOIGT.isApproximated()).isTrue();
        assertThat(PeakModel.VOIGT.profile()).isEqualTo(PeakModel.GAUSSIAN);
        assertThat(PeakModel.LORENTZIAN.isApproximated()).isFalse();
        assertThat(BaselineMethod.ALS.isImplemented()).isFalse();
        assertThat(BaselineMethod.POLYNOMIAL.isImplemented()).isTrue();
    }
}

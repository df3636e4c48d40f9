package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.model.BaselineMethod;
import de.anton.pl.analyser.pl_analyzer.model.NormalizationMethod;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreprocessingConfigTest {

    @Test
    void shouldSkipEveryStageByDefault() {
        PreprocessingConfig config = PreprocessingConfig.none();

        assertThat(config.getOutlierRemoval()).isEmpty();
        assertThat(config.getNoiseReduction()).isEmpty();
        assertThat(config.getBaselineCorrection()).isEmpty();
        assertThat(config.getNormalization()).isEmpty();
        assertThat(PreprocessingConfig.builder().build()).isEqualTo(config);
    }

    @Test
    void shouldBuildConfiguredStages() {
        PreprocessingConfig config = PreprocessingConfig.builder()
                .outlierRemoval(2.5)
                .noiseReduction(6, 3)
                .polynomialBaseline(3)
                .normalization(NormalizationMethod.AREA)
                .build();

        assertThat(config.outlierRemoval().threshold()).isEqualTo(2.5);
        assertThat(config.noiseReduction().effectiveWindowLength()).isEqualTo(7);
        assertThat(config.baselineCorrection().method()).isEqualTo(BaselineMethod.POLYNOMIAL);
        assertThat(config.baselineCorrection().polynomialDegree()).isEqualTo(3);
        assertThat(config.normalization().method()).isEqualTo(NormalizationMethod.AREA);
    }

    @Test
    void shouldUseDocumentedDefaults() {
        assertThat(PreprocessingConfig.OutlierRemoval.withDefaultThreshold().threshold()).isEqualTo(3.0);
        assertThat(PreprocessingConfig.BaselineCorrection.polynomial().polynomialDegree()).isEqualTo(2);
        assertThat(DetectionParameters.defaults()).isEqualTo(new DetectionParameters(0.1, 0.05));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new PreprocessingConfig.OutlierRemoval(true, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PreprocessingConfig.OutlierRemoval(true, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PreprocessingConfig.NoiseReduction(2, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PreprocessingConfig.BaselineCorrection.polynomial(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectionParameters(Double.POSITIVE_INFINITY, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

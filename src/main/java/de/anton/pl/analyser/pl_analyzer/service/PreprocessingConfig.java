package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.algorithms.SpectrumPreprocessor;
import de.anton.pl.analyser.pl_analyzer.model.BaselineMethod;
import de.anton.pl.analyser.pl_analyzer.model.NormalizationMethod;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable preprocessing configuration. Each stage is configured by its own sub-record;
 * a null sub-record means the stage is skipped.
 */
public record PreprocessingConfig(
    OutlierRemoval outlierRemoval,
    NoiseReduction noiseReduction,
    BaselineCorrection baselineCorrection,
    Normalization normalization
) {

    private static final PreprocessingConfig NONE = new PreprocessingConfig(null, null, null, null);

    /** Z-score outlier removal; only applied if {@code enabled}. */
    public record OutlierRemoval(boolean enabled, double threshold) {
        public OutlierRemoval {
            if (!Double.isFinite(threshold) || threshold < 0) {
                throw new IllegalArgumentException("Outlier threshold must be a finite non-negative number, got " + threshold);
            }
        }

        public static OutlierRemoval withDefaultThreshold() {
            return new OutlierRemoval(true, SpectrumPreprocessor.DEFAULT_OUTLIER_THRESHOLD);
        }
    }

    /**
     * Noise reduction configured as Savitzky-Golay. The smoothing performed is a centered moving
     * average over {@code windowLength} points; {@code polynomialOrder} is stored and reported
     * but does not change the result.
     */
    public record NoiseReduction(int windowLength, int polynomialOrder) {
        public static final String METHOD = "savitzky-golay";

        public NoiseReduction {
            if (windowLength < 3) {
                throw new IllegalArgumentException("Window length must be at least 3, got " + windowLength);
            }
            if (polynomialOrder < 0) {
                throw new IllegalArgumentException("Polynomial order must be non-negative, got " + polynomialOrder);
            }
        }

        /** Window actually used: even lengths are widened by one. */
        public int effectiveWindowLength() {
            return windowLength % 2 == 0 ? windowLength + 1 : windowLength;
        }
    }

    /** Baseline correction. {@code lambda} and {@code p} belong to ALS and are not used. */
    public record BaselineCorrection(BaselineMethod method, int polynomialDegree, Double lambda, Double p) {
        public BaselineCorrection {
            Objects.requireNonNull(method, "Baseline method cannot be null.");
            if (polynomialDegree < 0) {
                throw new IllegalArgumentException("Polynomial degree must be non-negative, got " + polynomialDegree);
            }
        }

        public static BaselineCorrection polynomial(int degree) {
            return new BaselineCorrection(BaselineMethod.POLYNOMIAL, degree, null, null);
        }

        public static BaselineCorrection polynomial() {
            return polynomial(SpectrumPreprocessor.DEFAULT_BASELINE_DEGREE);
        }

        public static BaselineCorrection als(Double lambda, Double p) {
            return new BaselineCorrection(BaselineMethod.ALS, SpectrumPreprocessor.DEFAULT_BASELINE_DEGREE, lambda, p);
        }
    }

    public record Normalization(NormalizationMethod method) {
        public Normalization {
            Objects.requireNonNull(method, "Normalization method cannot be null.");
        }
    }

    /** Configuration that skips every stage. */
    public static PreprocessingConfig none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<OutlierRemoval> getOutlierRemoval() { return Optional.ofNullable(outlierRemoval); }
    public Optional<NoiseReduction> getNoiseReduction() { return Optional.ofNullable(noiseReduction); }
    public Optional<BaselineCorrection> getBaselineCorrection() { return Optional.ofNullable(baselineCorrection); }
    public Optional<Normalization> getNormalization() { return Optional.ofNullable(normalization); }

    /** Fluent builder; unset stages stay skipped. */
    public static final class Builder {
        private OutlierRemoval outlierRemoval;
        private NoiseReduction noiseReduction;
        private BaselineCorrection baselineCorrection;
        private Normalization normalization;

        private Builder() { }

        public Builder outlierRemoval(double threshold) {
            this.outlierRemoval = new OutlierRemoval(true, threshold);
            return this;
        }

        public Builder outlierRemoval(OutlierRemoval config) {
            this.outlierRemoval = config;
            return this;
        }

        public Builder noiseReduction(int windowLength, int polynomialOrder) {
            this.noiseReduction = new NoiseReduction(windowLength, polynomialOrder);
            return this;
        }

        public Builder baselineCorrection(BaselineCorrection config) {
            this.baselineCorrection = config;
            return this;
        }

        public Builder polynomialBaseline(int degree) {
            return baselineCorrection(BaselineCorrection.polynomial(degree));
        }

        public Builder normalization(NormalizationMethod method) {
            this.normalization = new Normalization(method);
            return this;
        }

        public PreprocessingConfig build() {
            return new PreprocessingConfig(outlierRemoval, noiseReduction, baselineCorrection, normalization);
        }
    }
}

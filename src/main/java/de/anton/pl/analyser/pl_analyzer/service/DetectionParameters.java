package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.algorithms.PeakDetector;

/**
 * Peak detection thresholds.
 */
public record DetectionParameters(double prominence, double minHeight) {

    public DetectionParameters {
        if (!Double.isFinite(prominence)) throw new IllegalArgumentException("Prominence must be finite, got " + prominence);
        if (!Double.isFinite(minHeight)) throw new IllegalArgumentException("Minimum height must be finite, got " + minHeight);
    }

    public static DetectionParameters defaults() {
        return new DetectionParameters(PeakDetector.DEFAULT_PROMINENCE, PeakDetector.DEFAULT_MIN_HEIGHT);
    }
}

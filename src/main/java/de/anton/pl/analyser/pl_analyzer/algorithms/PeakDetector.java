package de.anton.pl.analyser.pl_analyzer.algorithms;

import de.anton.pl.analyser.pl_analyzer.model.Peak;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Local-maximum peak detector.
 * <p>
 * An interior point is a candidate when it is strictly higher than both neighbours and at least
 * {@code minHeight}. For every candidate the FWHM, area and prominence are computed; the
 * prominence threshold is applied afterwards. Prominence here is the height above the lower
 * direct neighbour, not the topographic prominence.
 */
public class PeakDetector {

    private static final Logger logger = LoggerFactory.getLogger(PeakDetector.class);

    public static final double DEFAULT_PROMINENCE = 0.1;
    public static final double DEFAULT_MIN_HEIGHT = 0.05;

    private final double prominenceThreshold;
    private final double minHeight;

    public PeakDetector(double prominenceThreshold, double minHeight) {
        if (Double.isNaN(prominenceThreshold)) throw new IllegalArgumentException("Prominence threshold must be a number.");
        if (Double.isNaN(minHeight)) throw new IllegalArgumentException("Minimum height must be a number.");
        this.prominenceThreshold = prominenceThreshold;
        this.minHeight = minHeight;
    }

    public PeakDetector() {
        this(DEFAULT_PROMINENCE, DEFAULT_MIN_HEIGHT);
    }

    public double getProminenceThreshold() { return prominenceThreshold; }
    public double getMinHeight() { return minHeight; }

    /**
     * Detects peaks in ascending wavelength order. Spectra with fewer than three points have no
     * interior points and yield an empty list.
     */
    public List<Peak> detect(Spectrum spectrum) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        if (spectrum.size() < 3) {
            logger.debug("Peak detection skipped: {} points, no interior points.", spectrum.size());
            return Collections.emptyList();
        }

        double[] intensities = spectrum.intensities();
        List<Peak> candidates = new ArrayList<>();
        for (int i = 1; i < intensities.length - 1; i++) {
            double prev = intensities[i - 1];
            double curr = intensities[i];
            double next = intensities[i + 1];
            if (curr > prev && curr > next && curr >= minHeight) {
                double fwhm = fullWidthAtHalfMaximum(spectrum, i);
                double position = spectrum.get(i).wavelength();
                double area = NumericUtils.integrateTrapezoidal(spectrum.window(position - fwhm, position + fwhm));
                double prominence = curr - Math.min(prev, next);
                candidates.add(new Peak(position, curr, fwhm, area, prominence));
                logger.trace("Candidate at {} nm: amplitude={}, fwhm={}, area={}, prominence={}",
                        position, curr, fwhm, area, prominence);
            }
        }

        List<Peak> peaks = new ArrayList<>(candidates.size());
        for (Peak candidate : candidates) {
            if (candidate.prominence() >= prominenceThreshold) {
                peaks.add(candidate);
            }
        }
        logger.debug("Peak detection: {} candidates, {} kept (prominence >= {}, minHeight={}).",
                candidates.size(), peaks.size(), prominenceThreshold, minHeight);
        return Collections.unmodifiableList(peaks);
    }

    /**
     * Walks outwards from the peak until the first point at or below half the peak intensity
     * (or the spectrum edge) on each side and returns the wavelength distance between them.
     */
    static double fullWidthAtHalfMaximum(Spectrum spectrum, int peakIndex) {
        double halfMax = spectrum.get(peakIndex).intensity() / 2.0;

        int left = peakIndex;
        while (left > 0 && spectrum.get(left).intensity() > halfMax) {
            left--;
        }
        int right = peakIndex;
        while (right < spectrum.size() - 1 && spectrum.get(right).intensity() > halfMax) {
            right++;
        }
        return spectrum.get(right).wavelength() - spectrum.get(left).wavelength();
    }
}

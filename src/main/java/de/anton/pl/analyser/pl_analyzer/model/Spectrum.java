package de.anton.pl.analyser.pl_analyzer.model;

import de.anton.pl.analyser.pl_analyzer.exception.DimensionMismatchException;
import de.anton.pl.analyser.pl_analyzer.exception.InvalidSpectrumException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable, ordered sequence of {@link SpectralPoint}s sorted ascending by wavelength.
 * Duplicate wavelengths and irregular spacing are allowed; descending steps are not.
 * Every transformation returns a new instance, the receiver is never modified.
 */
public final class Spectrum implements Iterable<SpectralPoint> {

    private static final Spectrum EMPTY = new Spectrum(Collections.emptyList());

    private final List<SpectralPoint> points;

    private Spectrum(List<SpectralPoint> points) {
        this.points = points;
    }

    /**
     * Creates a spectrum from points that are already in ascending wavelength order.
     *
     * @throws InvalidSpectrumException if a point is null, a wavelength is not finite, or the wavelengths decrease.
     */
    public static Spectrum of(List<SpectralPoint> points) {
        Objects.requireNonNull(points, "Point list cannot be null.");
        List<SpectralPoint> copy = new ArrayList<>(points.size());
        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < points.size(); i++) {
            SpectralPoint p = points.get(i);
            if (p == null) {
                throw new InvalidSpectrumException(points.size(), "null point at index " + i);
            }
            if (!Double.isFinite(p.wavelength())) {
                throw new InvalidSpectrumException(points.size(), "non-finite wavelength " + p.wavelength() + " at index " + i);
            }
            if (p.wavelength() < previous) {
                throw new InvalidSpectrumException(points.size(),
                        "wavelengths must be ascending, found " + p.wavelength() + " after " + previous + " at index " + i);
            }
            previous = p.wavelength();
            copy.add(p);
        }
        return copy.isEmpty() ? EMPTY : new Spectrum(Collections.unmodifiableList(copy));
    }

    /** Creates a spectrum from points in any order, stably sorting them by wavelength. */
    public static Spectrum sortedOf(List<SpectralPoint> points) {
        Objects.requireNonNull(points, "Point list cannot be null.");
        List<SpectralPoint> sorted = new ArrayList<>(points);
        if (sorted.contains(null)) {
            throw new InvalidSpectrumException(points.size(), "contains null points");
        }
        sorted.sort(Comparator.comparingDouble(SpectralPoint::wavelength));
        return of(sorted);
    }

    /** Creates a spectrum from parallel wavelength and intensity arrays. */
    public static Spectrum of(double[] wavelengths, double[] intensities) {
        Objects.requireNonNull(wavelengths, "Wavelength array cannot be null.");
        Objects.requireNonNull(intensities, "Intensity array cannot be null.");
        if (wavelengths.length != intensities.length) {
            throw new DimensionMismatchException(wavelengths.length, intensities.length);
        }
        List<SpectralPoint> list = new ArrayList<>(wavelengths.length);
        for (int i = 0; i < wavelengths.length; i++) {
            list.add(new SpectralPoint(wavelengths[i], intensities[i]));
        }
        return of(list);
    }

    public static Spectrum empty() {
        return EMPTY;
    }

    public int size() { return points.size(); }
    public boolean isEmpty() { return points.isEmpty(); }
    public SpectralPoint get(int index) { return points.get(index); }
    public List<SpectralPoint> getPoints() { return points; }

    public double[] wavelengths() {
        double[] result = new double[points.size()];
        for (int i = 0; i < result.length; i++) result[i] = points.get(i).wavelength();
        return result;
    }

    public double[] intensities() {
        double[] result = new double[points.size()];
        for (int i = 0; i < result.length; i++) result[i] = points.get(i).intensity();
        return result;
    }

    /**
     * Returns a spectrum on the same wavelength grid carrying the given intensities.
     *
     * @throws DimensionMismatchException if the array length differs from {@link #size()}.
     */
    public Spectrum withIntensities(double[] newIntensities) {
        Objects.requireNonNull(newIntensities, "Intensity array cannot be null.");
        if (newIntensities.length != points.size()) {
            throw new DimensionMismatchException(points.size(), newIntensities.length);
        }
        List<SpectralPoint> list = new ArrayList<>(points.size());
        for (int i = 0; i < newIntensities.length; i++) {
            list.add(points.get(i).withIntensity(newIntensities[i]));
        }
        return list.isEmpty() ? EMPTY : new Spectrum(Collections.unmodifiableList(list));
    }

    /** Keeps the points matching the predicate, preserving their order. */
    public Spectrum filter(Predicate<SpectralPoint> predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null.");
        List<SpectralPoint> kept = new ArrayList<>();
        for (SpectralPoint p : points) {
            if (predicate.test(p)) kept.add(p);
        }
        return kept.isEmpty() ? EMPTY : new Spectrum(Collections.unmodifiableList(kept));
    }

    /** Points whose wavelength lies in {@code [from, to]}. */
    public Spectrum window(double from, double to) {
        return filter(p -> p.wavelength() >= from && p.wavelength() <= to);
    }

    @Override
    public Iterator<SpectralPoint> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return points.equals(((Spectrum) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        if (points.isEmpty()) return "Spectrum{empty}";
        return "Spectrum{" + points.size() + " points, " + points.get(0).wavelength()
                + ".." + points.get(points.size() - 1).wavelength() + " nm}";
    }
}

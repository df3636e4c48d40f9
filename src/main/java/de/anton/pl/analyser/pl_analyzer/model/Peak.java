package de.anton.pl.analyser.pl_analyzer.model;

/**
 * An emission peak as found by the peak detector.
 *
 * @param position   wavelength of the local maximum (nm)
 * @param amplitude  intensity at the maximum
 * @param fwhm       full width at half maximum (nm), snapped to sample points
 * @param area       trapezoidal area within {@code position ± fwhm}
 * @param prominence height above the lower of the two direct neighbours
 */
public record Peak(double position, double amplitude, double fwhm, double area, double prominence) {
}

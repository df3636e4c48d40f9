package de.anton.pl.analyser.pl_analyzer.service;

import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Objects;

/**
 * Service responsible for loading spectra from measurement files.
 */
public class SpectrumDataService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumDataService.class);
    private final SpectrumReader spectrumReader;

    public SpectrumDataService() {
        this(new SpectrumReader());
    }

    public SpectrumDataService(SpectrumReader spectrumReader) {
        this.spectrumReader = Objects.requireNonNull(spectrumReader, "Reader cannot be null.");
    }

    /**
     * Loads a spectrum from the specified file.
     *
     * @param file The CSV, TXT or Excel file to load.
     * @return The spectrum, sorted by wavelength.
     * @throws IOException          If the file cannot be read or contains no spectral data.
     * @throws NullPointerException if the file is null.
     */
    public Spectrum loadSpectrum(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        logger.info("Data Service: Attempting to load spectrum file: {}", file.getAbsolutePath());
        try {
            Spectrum spectrum = spectrumReader.read(file);
            logger.info("Data Service: {} points loaded from {}", spectrum.size(), file.getName());
            return spectrum;
        } catch (IOException | RuntimeException e) {
            logger.error("Data Service: Failed to load or parse spectrum file: {}", file.getAbsolutePath(), e);
            throw new IOException("Error reading spectrum file " + file.getName() + ": " + e.getMessage(), e);
        }
    }
}

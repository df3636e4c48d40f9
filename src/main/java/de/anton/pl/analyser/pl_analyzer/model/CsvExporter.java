package de.anton.pl.analyser.pl_analyzer.model;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;

/**
 * Writes a spectrum as comma-separated values with a header row.
 */
public class CsvExporter {

    private static final Logger logger = LoggerFactory.getLogger(CsvExporter.class);

    public static final CSVFormat SPECTRUM_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(ExcelExporter.HEADER_WAVELENGTH, ExcelExporter.HEADER_INTENSITY)
            .setRecordSeparator('\n')
            .build();

    public void exportSpectrum(Spectrum spectrum, File file) throws IOException {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, SPECTRUM_FORMAT)) {
            for (SpectralPoint point : spectrum) {
                printer.printRecord(point.wavelength(), point.intensity());
            }
        }
        logger.info("CSV export of {} points completed to: {}", spectrum.size(), file.getAbsolutePath());
    }
}

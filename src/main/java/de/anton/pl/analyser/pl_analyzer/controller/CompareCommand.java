package de.anton.pl.analyser.pl_analyzer.controller;

import de.anton.pl.analyser.pl_analyzer.algorithms.SpectrumComparator;
import de.anton.pl.analyser.pl_analyzer.exception.SpectrumAnalysisException;
import de.anton.pl.analyser.pl_analyzer.model.Spectrum;
import de.anton.pl.analyser.pl_analyzer.model.SpectrumComparison;
import de.anton.pl.analyser.pl_analyzer.service.SpectrumDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Compares the emission maximum of two spectra (e.g. before and after modification).
 */
@Command(
    name = "compare",
    mixinStandardHelpOptions = true,
    description = "Report the spectral shift and intensity ratio between two spectra"
)
public class CompareCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CompareCommand.class);

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "Reference spectrum file")
    private File referenceFile;

    @Parameters(index = "1", description = "Compared spectrum file")
    private File comparedFile;

    private final SpectrumDataService dataService = new SpectrumDataService();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Spectrum reference = dataService.loadSpectrum(referenceFile);
            Spectrum compared = dataService.loadSpectrum(comparedFile);
            SpectrumComparison comparison = SpectrumComparator.compare(reference, compared);

            out.printf(Locale.ROOT, "Reference peak: %.2f nm (%s)%n", comparison.referencePeakWavelength(), referenceFile.getName());
            out.printf(Locale.ROOT, "Compared peak:  %.2f nm (%s)%n", comparison.comparedPeakWavelength(), comparedFile.getName());
            out.printf(Locale.ROOT, "Spectral shift: %+.2f nm%n", comparison.spectralShift());
            String trend = comparison.isEnhanced() ? "enhanced" : comparison.isQuenched() ? "quenched" : "unchanged";
            out.printf(Locale.ROOT, "Intensity ratio: %.3f (%s, %.1f%%)%n", comparison.intensityRatio(), trend,
                    Math.abs((comparison.intensityRatio() - 1.0) * 100.0));
            out.flush();
            return 0;
        } catch (IOException | SpectrumAnalysisException e) {
            logger.debug("Compare command failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

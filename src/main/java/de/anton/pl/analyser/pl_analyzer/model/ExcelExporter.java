package de.anton.pl.analyser.pl_analyzer.model;

import de.anton.pl.analyser.pl_analyzer.service.AnalysisResult;
import de.anton.pl.analyser.pl_analyzer.service.PreprocessingConfig;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Exports spectra and analysis results to Excel files (.xlsx).
 */
public class ExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(ExcelExporter.class);

    public static final String SHEET_SPECTRAL_DATA = "Spectral Data";
    public static final String SHEET_RAW_DATA = "Raw Data";
    public static final String SHEET_PEAKS = "Peaks";
    public static final String SHEET_STATISTICS = "Statistics";
    public static final String SHEET_FITTING = "Fitting";
    public static final String SHEET_PREPROCESSING = "Preprocessing";

    static final String HEADER_WAVELENGTH = "Wavelength (nm)";
    static final String HEADER_INTENSITY = "Intensity (a.u.)";
    private static final List<String> PEAK_COLUMNS = List.of("Peak", "Position (nm)", "Amplitude", "FWHM (nm)", "Area", "Prominence");
    private static final int COLUMN_WIDTH = 20 * 256;

    /** Writes a single spectrum as a two-column sheet. */
    public void exportSpectrum(Spectrum spectrum, File file) throws IOException {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        logger.info("Starting spectrum export ({} points) to: {}", spectrum.size(), file.getAbsolutePath());
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            writeSpectrumSheet(workbook.createSheet(SHEET_SPECTRAL_DATA), headerStyle, spectrum, HEADER_INTENSITY);
            write(workbook, file);
        }
    }

    /**
     * Writes an analysis result as a workbook with one sheet per aspect.
     *
     * @param raw optional raw spectrum, written to its own sheet when not null.
     */
    public void exportAnalysis(AnalysisResult result, Spectrum raw, File file) throws IOException {
        Objects.requireNonNull(result, "Analysis result cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        logger.info("Starting analysis export for sample '{}' to: {}", result.sampleId(), file.getAbsolutePath());

        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);

            // Processed and fitted intensities share the processed wavelength grid
            Sheet data = workbook.createSheet(SHEET_SPECTRAL_DATA);
            Spectrum processed = result.processed();
            Spectrum fitted = result.fitting().map(FittingResult::fittedData).orElse(null);
            createHeaderRow(data, headerStyle, fitted != null
                    ? List.of(HEADER_WAVELENGTH, "Processed Intensity (a.u.)", "Fitted Intensity (a.u.)")
                    : List.of(HEADER_WAVELENGTH, "Processed Intensity (a.u.)"));
            for (int i = 0; i < processed.size(); i++) {
                Row row = data.createRow(i + 1);
                createNumericCell(row, 0, processed.get(i).wavelength());
                createNumericCell(row, 1, processed.get(i).intensity());
                if (fitted != null) {
                    createNumericCell(row, 2, fitted.get(i).intensity());
                }
            }
            setColumnWidths(data, 3);

            if (raw != null) {
                writeSpectrumSheet(workbook.createSheet(SHEET_RAW_DATA), headerStyle, raw, HEADER_INTENSITY);
            }

            Sheet peaksSheet = workbook.createSheet(SHEET_PEAKS);
            createHeaderRow(peaksSheet, headerStyle, PEAK_COLUMNS);
            int rowNum = 1;
            for (Peak peak : result.peaks()) {
                Row row = peaksSheet.createRow(rowNum);
                row.createCell(0).setCellValue(rowNum);
                createNumericCell(row, 1, peak.position());
                createNumericCell(row, 2, peak.amplitude());
                createNumericCell(row, 3, peak.fwhm());
                createNumericCell(row, 4, peak.area());
                createNumericCell(row, 5, peak.prominence());
                rowNum++;
            }
            setColumnWidths(peaksSheet, PEAK_COLUMNS.size());

            Sheet statsSheet = workbook.createSheet(SHEET_STATISTICS);
            createHeaderRow(statsSheet, headerStyle, List.of("Parameter", "Value"));
            SpectrumStatistics stats = result.statistics();
            writeNumericEntry(statsSheet, 1, "Mean Intensity", stats.meanIntensity());
            writeNumericEntry(statsSheet, 2, "Std Deviation", stats.stdIntensity());
            writeNumericEntry(statsSheet, 3, "Max Intensity", stats.maxIntensity());
            writeNumericEntry(statsSheet, 4, "Min Intensity", stats.minIntensity());
            writeNumericEntry(statsSheet, 5, "Total Area", stats.totalArea());
            setColumnWidths(statsSheet, 2);

            Sheet fitSheet = workbook.createSheet(SHEET_FITTING);
            createHeaderRow(fitSheet, headerStyle, List.of("Parameter", "Value"));
            writeTextEntry(fitSheet, 1, "Sample", result.sampleId());
            writeTextEntry(fitSheet, 2, "Status", result.fittingStatus().name());
            result.fitting().ifPresent(fit -> {
                writeTextEntry(fitSheet, 3, "Model", fit.model().getKey());
                writeTextEntry(fitSheet, 4, "Profile", fit.model().profile().getKey());
                writeNumericEntry(fitSheet, 5, "R²", fit.rSquared());
                writeNumericEntry(fitSheet, 6, "RMSE", fit.rmse());
            });
            setColumnWidths(fitSheet, 2);

            writePreprocessingSheet(workbook.createSheet(SHEET_PREPROCESSING), headerStyle, result.preprocessing());

            write(workbook, file);
        }
    }

    private void writePreprocessingSheet(Sheet sheet, CellStyle headerStyle, PreprocessingConfig config) {
        createHeaderRow(sheet, headerStyle, List.of("Stage", "Setting"));
        int rowNum = 1;
        PreprocessingConfig.OutlierRemoval outliers = config.outlierRemoval();
        writeTextEntry(sheet, rowNum++, "Outlier Removal", outliers == null || !outliers.enabled()
                ? "off" : "z-score (threshold=" + outliers.threshold() + ")");
        PreprocessingConfig.NoiseReduction noise = config.noiseReduction();
        writeTextEntry(sheet, rowNum++, "Noise Reduction", noise == null
                ? "off" : PreprocessingConfig.NoiseReduction.METHOD + " (window=" + noise.windowLength()
                        + ", order=" + noise.polynomialOrder() + ")");
        PreprocessingConfig.BaselineCorrection baseline = config.baselineCorrection();
        writeTextEntry(sheet, rowNum++, "Baseline Correction", baseline == null ? "off" : describe(baseline));
        PreprocessingConfig.Normalization normalization = config.normalization();
        writeTextEntry(sheet, rowNum, "Normalization", normalization == null ? "off" : normalization.method().getKey());
        setColumnWidths(sheet, 2);
    }

    private String describe(PreprocessingConfig.BaselineCorrection baseline) {
        if (baseline.method().isImplemented()) {
            return baseline.method().getKey() + " (degree=" + baseline.polynomialDegree() + ")";
        }
        StringBuilder text = new StringBuilder(baseline.method().getKey()).append(" (");
        if (baseline.lambda() != null) {
            text.append("lambda=").append(baseline.lambda()).append(", ");
        }
        if (baseline.p() != null) {
            text.append("p=").append(baseline.p()).append(", ");
        }
        return text.append("not applied)").toString();
    }

    private void writeSpectrumSheet(Sheet sheet, CellStyle headerStyle, Spectrum spectrum, String intensityHeader) {
        createHeaderRow(sheet, headerStyle, List.of(HEADER_WAVELENGTH, intensityHeader));
        int rowNum = 1;
        for (SpectralPoint point : spectrum) {
            Row row = sheet.createRow(rowNum++);
            createNumericCell(row, 0, point.wavelength());
            createNumericCell(row, 1, point.intensity());
        }
        setColumnWidths(sheet, 2);
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFont(headerFont);
        return headerStyle;
    }

    private void createHeaderRow(Sheet sheet, CellStyle headerStyle, List<String> names) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < names.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(names.get(i));
            cell.setCellStyle(headerStyle);
        }
    }

    private void writeNumericEntry(Sheet sheet, int rowNum, String label, double value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        createNumericCell(row, 1, value);
    }

    private void writeTextEntry(Sheet sheet, int rowNum, String label, String value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
    }

    // autoSizeColumn needs AWT fonts, which headless hosts often lack
    private void setColumnWidths(Sheet sheet, int columns) {
        for (int i = 0; i < columns; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
    }

    private void write(Workbook workbook, File file) throws IOException {
        try (FileOutputStream fileOut = new FileOutputStream(file)) {
            workbook.write(fileOut);
            logger.info("Excel export completed successfully to: {}", file.getAbsolutePath());
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", file.getAbsolutePath(), e);
            throw e;
        }
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (Double.isFinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}

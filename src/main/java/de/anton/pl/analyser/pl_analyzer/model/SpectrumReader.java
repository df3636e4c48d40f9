package de.anton.pl.analyser.pl_analyzer.model;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads a spectrum from a two-column measurement file.
 * <ul>
 *   <li>{@code .csv} / {@code .txt}: delimited text, delimiter detected from the first non-blank line
 *       (comma, tab or semicolon)</li>
 *   <li>{@code .xlsx} / {@code .xls}: first sheet of the workbook</li>
 * </ul>
 * Column 1 is the wavelength (nm), column 2 the intensity. A header row is skipped if the first cell
 * of the first row is not a number. Rows with fewer than two cells or with non-numeric values are dropped.
 */
public class SpectrumReader {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumReader.class);
    private static final char[] CANDIDATE_DELIMITERS = {',', '\t', ';'};
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Reads the file and returns its spectrum sorted ascending by wavelength.
     *
     * @throws IOException if the file cannot be read, has an unsupported extension,
     *                     or contains no valid spectral data.
     */
    public Spectrum read(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        String name = file.getName().toLowerCase(Locale.ROOT);
        logger.info("Starting to read spectrum file: {}", file.getAbsolutePath());

        List<List<String>> rows;
        if (name.endsWith(".csv") || name.endsWith(".txt")) {
            rows = readDelimitedRows(file);
        } else if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            rows = readWorkbookRows(file);
        } else {
            throw new IOException("Unsupported file type: " + file.getName() + " (expected .csv, .txt, .xlsx or .xls)");
        }

        Spectrum spectrum = parseSpectralData(rows);
        logger.info("Finished reading {}: {} points, {}", file.getName(), spectrum.size(), spectrum);
        return spectrum;
    }

    /**
     * Turns raw rows into a sorted spectrum.
     *
     * @throws IOException if no row yields a valid point.
     */
    Spectrum parseSpectralData(List<List<String>> rawData) throws IOException {
        int startRow = 0;
        if (!rawData.isEmpty()) {
            List<String> first = rawData.get(0);
            if (first.isEmpty() || Double.isNaN(parseNumber(first.get(0)))) {
                logger.debug("First row treated as header: {}", first);
                startRow = 1;
            }
        }

        List<SpectralPoint> points = new ArrayList<>();
        int dropped = 0;
        for (int i = startRow; i < rawData.size(); i++) {
            List<String> row = rawData.get(i);
            if (row.size() < 2) {
                dropped++;
                continue;
            }
            double wavelength = parseNumber(row.get(0));
            double intensity = parseNumber(row.get(1));
            if (Double.isNaN(wavelength) || Double.isNaN(intensity)) {
                logger.trace("Skipping non-numeric row {}: {}", i + 1, row);
                dropped++;
                continue;
            }
            points.add(new SpectralPoint(wavelength, intensity));
        }

        if (points.isEmpty()) {
            throw new IOException("No valid spectral data found in file");
        }
        if (dropped > 0) {
            logger.warn("Dropped {} rows without a numeric wavelength/intensity pair.", dropped);
        }
        return Spectrum.sortedOf(points);
    }

    /** Parses a finite number; returns NaN for blank, non-numeric or non-finite text. */
    static double parseNumber(String text) {
        if (text == null) return Double.NaN;
        String cleaned = text.trim();
        if (!cleaned.isEmpty() && cleaned.charAt(0) == BYTE_ORDER_MARK) {
            cleaned = cleaned.substring(1).trim();
        }
        if (cleaned.isEmpty()) return Double.NaN;
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isFinite(value) ? value : Double.NaN;
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    // --- Delimited text ---

    private List<List<String>> readDelimitedRows(File file) throws IOException {
        char delimiter = detectDelimiter(file);
        logger.debug("Using delimiter '{}' for {}", delimiter == '\t' ? "\\t" : String.valueOf(delimiter), file.getName());
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        List<List<String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(value);
                }
                rows.add(cells);
            }
        }
        return rows;
    }

    private char detectDelimiter(File file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    return detectDelimiter(line);
                }
            }
        }
        return ',';
    }

    /** Most frequent candidate delimiter in the line; comma when none occurs. */
    static char detectDelimiter(String line) {
        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = 0;
            for (int i = 0; i < line.length(); i++) {
                if (line.charAt(i) == candidate) count++;
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    // --- Workbooks ---

    private List<List<String>> readWorkbookRows(File file) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (InputStream fis = new FileInputStream(file);
             Workbook workbook = WorkbookFactory.create(fis)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook contains no sheets: " + file.getName());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            logger.debug("Reading sheet '{}' ({} rows) from {}", sheet.getSheetName(), sheet.getLastRowNum() + 1, file.getName());

            for (int i = sheet.getFirstRowNum(); i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null || row.getLastCellNum() <= 0) {
                    continue; // blank row
                }
                List<String> cells = new ArrayList<>(row.getLastCellNum());
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    cells.add(getCellValueAsString(row.getCell(c), formatter, evaluator));
                }
                rows.add(cells);
            }
        } catch (IOException ioe) {
            logger.error("IO error reading workbook: {}", file.getAbsolutePath(), ioe);
            throw ioe;
        } catch (Exception e) {
            logger.error("Error processing workbook: {}", file.getAbsolutePath(), e);
            throw new IOException("Error processing Excel file: " + e.getMessage(), e);
        }
        return rows;
    }

    /**
     * Cell content as text. Numbers keep full precision, formulas are evaluated,
     * blank and error cells become an empty string.
     */
    private String getCellValueAsString(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            CellValue value = evaluator.evaluate(cell);
            switch (value.getCellType()) {
                case NUMERIC:
                    return Double.toString(value.getNumberValue());
                case STRING:
                    return value.getStringValue();
                case ERROR:
                    logger.warn("Formula in cell {} resulted in an error: {}", cell.getAddress(),
                            FormulaError.forInt(value.getErrorValue()).getString());
                    return "";
                default:
                    return "";
            }
        }
        switch (type) {
            case NUMERIC:
                return Double.toString(cell.getNumericCellValue());
            case STRING:
                return cell.getStringCellValue();
            case BLANK:
            case ERROR:
                return "";
            default:
                return formatter.formatCellValue(cell);
        }
    }
}

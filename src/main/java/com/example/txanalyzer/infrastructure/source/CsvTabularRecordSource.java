package com.example.txanalyzer.infrastructure.source;

import com.example.txanalyzer.domain.model.RawRecord;
import com.example.txanalyzer.domain.model.TabularData;
import com.example.txanalyzer.domain.model.TabularRecordSource;
import com.example.txanalyzer.infrastructure.exception.SourceUnavailableException;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Infrastructure adapter that reads a CSV transaction export with OpenCSV.
 * The first line is the header; every cell stays text so the cleaner decides how to coerce it.
 * Quoting follows RFC 4180, so backslashes in bank descriptions are kept as-is.
 */
public class CsvTabularRecordSource implements TabularRecordSource {

    private static final Logger log = LoggerFactory.getLogger(CsvTabularRecordSource.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String sourceName;
    private final ReaderOpener opener;

    private CsvTabularRecordSource(String sourceName, ReaderOpener opener) {
        this.sourceName = sourceName;
        this.opener = opener;
    }

	/**
	 * Creates a source backed by a file on disk. The file is opened lazily by {@link #read()}.
	 *
	 * @param path CSV file
	 * @return source named after the file
	 */
    public static CsvTabularRecordSource fromPath(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        return new CsvTabularRecordSource(name, () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

	/**
	 * Creates a source over an in-memory upload.
	 *
	 * @param sourceName display name, typically the uploaded file name
	 * @param bytes      UTF-8 encoded CSV content
	 * @return source reading the given bytes
	 */
    public static CsvTabularRecordSource fromBytes(String sourceName, byte[] bytes) {
        byte[] content = bytes == null ? new byte[0] : bytes.clone();
        return new CsvTabularRecordSource(sourceName,
                () -> new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8));
    }

	/**
	 * Reads header and rows. An empty file yields no columns, which the loader then rejects.
	 *
	 * @return parsed table
	 * @throws SourceUnavailableException when the file cannot be opened or is not valid CSV
	 */
    @Override
    public TabularData read() {
        try (Reader reader = opener.open();
             CSVReader csvReader = new CSVReaderBuilder(reader)
                     .withCSVParser(new RFC4180ParserBuilder().build())
                     .build()) {
            String[] header = csvReader.readNext();
            if (header == null) {
                log.warn("CSV source {} is empty.", sourceName);
                return new TabularData(sourceName, List.of(), List.of());
            }
            List<String> columns = normalizeHeader(header);

            List<RawRecord> rows = new ArrayList<>();
            String[] cells;
            int rowNumber = 1;
            while ((cells = csvReader.readNext()) != null) {
                if (isBlankLine(cells)) {
                    continue;
                }
                if (cells.length > columns.size()) {
                    log.debug("Row {} of {} has {} cells for {} columns; extra cells ignored.",
                            rowNumber, sourceName, cells.length, columns.size());
                }
                rows.add(toRecord(rowNumber, columns, cells));
                rowNumber++;
            }
            log.info("Read {} row(s) with columns {} from {}.", rows.size(), columns, sourceName);
            return new TabularData(sourceName, columns, rows);
        } catch (IOException | CsvValidationException e) {
            throw new SourceUnavailableException("Unable to read transactions from " + sourceName + ".", e);
        }
    }

    public String getSourceName() {
        return sourceName;
    }

    private List<String> normalizeHeader(String[] header) {
        List<String> columns = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            String column = header[i] == null ? "" : header[i];
            if (i == 0 && !column.isEmpty() && column.charAt(0) == BYTE_ORDER_MARK) {
                column = column.substring(1);
            }
            columns.add(column.trim());
        }
        return columns;
    }

    private boolean isBlankLine(String[] cells) {
        return Arrays.stream(cells).allMatch(cell -> cell == null || cell.isBlank());
    }

    private RawRecord toRecord(int rowNumber, List<String> columns, String[] cells) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            values.put(columns.get(i), i < cells.length ? cells[i] : null);
        }
        return new RawRecord(rowNumber, values);
    }

    @FunctionalInterface
    private interface ReaderOpener {
        Reader open() throws IOException;
    }
}

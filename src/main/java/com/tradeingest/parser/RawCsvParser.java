package com.tradeingest.parser;

import com.tradeingest.config.IngestionProperties;
import com.tradeingest.domain.model.ParsedCsv;
import com.tradeingest.exception.CsvValidationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns uploaded text into a header row plus header-keyed row maps.
 *
 * <p>The first non-empty record is the header row. Values are trimmed, a leading byte-order mark is
 * stripped, rows whose cells are all blank are dropped, and columns with a blank header are ignored.
 * When a header repeats, the first non-blank value wins.
 */
@Component
public class RawCsvParser {

    private static final Logger log = LoggerFactory.getLogger(RawCsvParser.class);

    static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setTrim(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final IngestionProperties ingestionProperties;

    public RawCsvParser(IngestionProperties ingestionProperties) {
        this.ingestionProperties = ingestionProperties;
    }

    /**
     * Parses the whole file.
     *
     * @throws CsvValidationException if the file is empty, oversized, has no header or data rows, or is
     *     not parseable as delimited text
     */
    public ParsedCsv parse(String content) {
        long fileSize = checkSize(content);
        String text = stripByteOrderMark(content);

        List<List<String>> records = readRecords(text);
        if (records.isEmpty()) {
            throw new CsvValidationException("File is empty");
        }

        List<String> rawHeaders = records.get(0);
        List<String> headers = distinctNonBlank(rawHeaders);
        if (headers.isEmpty()) {
            throw new CsvValidationException("No header row found");
        }

        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> values = records.get(i);
            if (values.stream().allMatch(String::isBlank)) {
                continue;
            }
            rows.add(toRow(rawHeaders, values));
        }
        if (rows.isEmpty()) {
            throw new CsvValidationException("CSV contains a header row but no data rows");
        }

        log.debug("Parsed CSV: headers={} rows={} bytes={}", headers.size(), rows.size(), fileSize);
        return ParsedCsv.builder()
                .headers(headers)
                .rows(rows)
                .fileSize(fileSize)
                .sampleSize(ingestionProperties.getSampleRowCount())
                .build();
    }

    /** Byte length of the content, rejecting empty and oversized files. */
    public long checkSize(String content) {
        if (content == null || content.isBlank()) {
            throw new CsvValidationException("File is empty");
        }
        long fileSize = content.getBytes(StandardCharsets.UTF_8).length;
        if (fileSize > ingestionProperties.getMaxFileBytes()) {
            throw new CsvValidationException(
                    "File too large",
                    List.of("File is " + fileSize + " bytes; the maximum is "
                            + ingestionProperties.getMaxFileBytes() + " bytes"));
        }
        return fileSize;
    }

    /** Parses one delimited line into trimmed cells. Used by the multi-section parser. */
    public static List<String> parseLine(String line) {
        List<List<String>> records = readRecords(line);
        return records.isEmpty() ? List.of() : records.get(0);
    }

    static String stripByteOrderMark(String content) {
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            return content.substring(1);
        }
        return content;
    }

    private static List<List<String>> readRecords(String text) {
        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(record.size());
                record.forEach(value -> values.add(value == null ? "" : value));
                records.add(values);
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new CsvValidationException(
                    "Unparsable CSV structure", List.of("Unparsable CSV structure: " + e.getMessage()));
        }
        return records;
    }

    private static List<String> distinctNonBlank(List<String> rawHeaders) {
        Set<String> headers = new LinkedHashSet<>();
        for (String header : rawHeaders) {
            if (!header.isBlank()) {
                headers.add(header);
            }
        }
        return new ArrayList<>(headers);
    }

    private static Map<String, String> toRow(List<String> rawHeaders, List<String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < rawHeaders.size(); i++) {
            String header = rawHeaders.get(i);
            if (header.isBlank()) {
                continue;
            }
            String value = i < values.size() ? values.get(i) : "";
            String existing = row.get(header);
            if (existing == null || existing.isEmpty()) {
                row.put(header, value);
            }
        }
        return row;
    }
}

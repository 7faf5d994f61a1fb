package com.eyelevel.jobrelay.service.csv;

import com.eyelevel.jobrelay.exception.InvalidDatasetException;
import com.eyelevel.jobrelay.model.CsvDataset;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the CSV datasets exchanged with workers. The first record is the header; every
 * data row is padded to the header's width.
 */
@Slf4j
@Component
public class CsvDatasetCodec {

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
                                                                  .setIgnoreEmptyLines(true)
                                                                  .build();

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
                                                                   .setRecordSeparator("\n")
                                                                   .build();

    /**
     * Parses a UTF-8 CSV document, with or without a byte order mark.
     *
     * @throws InvalidDatasetException if the document is not CSV, has no header, or has a row wider
     *                                 than its header.
     */
    public CsvDataset parse(final byte[] content) {
        try (Reader reader = new InputStreamReader(
                BOMInputStream.builder().setInputStream(new ByteArrayInputStream(content)).get(),
                StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            List<String> header = null;
            final List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                final List<String> values = record.toList();
                if (header == null) {
                    header = List.copyOf(values);
                    continue;
                }
                if (values.size() > header.size()) {
                    throw new InvalidDatasetException(String.format(
                            "Row %d has %d fields but the header has %d.", record.getRecordNumber(),
                            values.size(), header.size()));
                }
                rows.add(pad(values, header.size()));
            }
            if (header == null) {
                throw new InvalidDatasetException("The CSV document is empty; a header row is required.");
            }
            log.debug("Parsed CSV with {} column(s) and {} row(s).", header.size(), rows.size());
            return new CsvDataset(header, rows);
        } catch (IOException | UncheckedIOException e) {
            throw new InvalidDatasetException("The uploaded file could not be read as CSV: " + e.getMessage(), e);
        }
    }

    public byte[] write(final CsvDataset dataset) {
        final StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, WRITE_FORMAT)) {
            printer.printRecord(dataset.header());
            for (List<String> row : dataset.rows()) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Appends datasets in the given order. When headers differ, the result carries every column in
     * first-seen order and rows are aligned by column name, leaving absent cells empty.
     */
    public CsvDataset concat(final List<CsvDataset> parts) {
        if (parts.isEmpty()) {
            return new CsvDataset(List.of(), List.of());
        }
        final List<String> firstHeader = parts.get(0).header();
        final boolean sameHeader = parts.stream().allMatch(part -> part.header().equals(firstHeader));
        final List<List<String>> rows = new ArrayList<>();
        if (sameHeader) {
            parts.forEach(part -> rows.addAll(part.rows()));
            return new CsvDataset(firstHeader, rows);
        }

        final Set<String> columns = new LinkedHashSet<>();
        parts.forEach(part -> columns.addAll(part.header()));
        final List<String> header = List.copyOf(columns);
        log.info("Merging CSV parts with differing headers into {} column(s).", header.size());
        for (CsvDataset part : parts) {
            final Map<String, Integer> positions = new HashMap<>();
            for (int i = 0; i < part.header().size(); i++) {
                positions.putIfAbsent(part.header().get(i), i);
            }
            for (List<String> row : part.rows()) {
                final String[] aligned = new String[header.size()];
                Arrays.fill(aligned, "");
                for (int i = 0; i < header.size(); i++) {
                    final Integer position = positions.get(header.get(i));
                    if (position != null && position < row.size()) {
                        aligned[i] = row.get(position);
                    }
                }
                rows.add(List.of(aligned));
            }
        }
        return new CsvDataset(header, rows);
    }

    private static List<String> pad(final List<String> values, final int width) {
        if (values.size() == width) {
            return List.copyOf(values);
        }
        final List<String> padded = new ArrayList<>(values);
        while (padded.size() < width) {
            padded.add("");
        }
        return List.copyOf(padded);
    }
}

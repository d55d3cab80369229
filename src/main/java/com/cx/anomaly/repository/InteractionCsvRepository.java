package com.cx.anomaly.repository;

import com.cx.anomaly.config.DetectorProperties;
import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.pipeline.DataTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads interaction tables from CSV and writes result tables back out.
 * Configured numeric feature columns are parsed to doubles; blank cells become missing values.
 */
@Repository
public class InteractionCsvRepository {

    private static final Logger log = LoggerFactory.getLogger(InteractionCsvRepository.class);

    private final CsvMapper csvMapper;
    private final Set<String> numericColumns;

    public InteractionCsvRepository(DetectorProperties properties) {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.numericColumns = new HashSet<>(properties.getFeatures().getNumeric());
    }

    public DataTable read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new IOException("Input file not found: " + path.toAbsolutePath()));
        }
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(path.toFile())) {
            if (!it.hasNext()) {
                throw DetectorException.schema("Input file has no header row: " + path);
            }
            List<String> columns = Arrays.asList(it.next());
            List<Map<String, Object>> rows = new ArrayList<>();
            int line = 1;
            while (it.hasNext()) {
                String[] cells = it.next();
                line++;
                if (cells.length == 1 && cells[0].isBlank()) continue;
                rows.add(toRow(columns, cells, line));
            }
            log.info("Read {} rows x {} columns from {}", rows.size(), columns.size(), path);
            return new DataTable(columns, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public void write(Path path, DataTable table) {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        table.getColumns().forEach(schema::addColumn);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (SequenceWriter writer = csvMapper.writer(schema.build()).writeValues(path.toFile())) {
                for (Map<String, Object> row : table.getRows()) {
                    writer.write(row);
                }
            }
            log.info("Wrote {} rows to {}", table.size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    private Map<String, Object> toRow(List<String> columns, String[] cells, int line) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            String column = columns.get(c);
            String cell = c < cells.length ? cells[c] : null;
            if (cell == null || cell.isBlank()) {
                row.put(column, null);
            } else if (numericColumns.contains(column)) {
                try {
                    row.put(column, DataTable.toDouble(cell, column));
                } catch (DetectorException e) {
                    throw DetectorException.schema("Line " + line + ": " + e.getMessage());
                }
            } else {
                row.put(column, cell);
            }
        }
        return row;
    }
}

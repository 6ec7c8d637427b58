package io.evalrelay.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class Csvs {
    private static final CsvMapper MAPPER = new CsvMapper();

    private Csvs() {
    }

    static CsvMapper mapper() {
        return MAPPER;
    }

    /**
     * Reads a headed CSV file into one map per row, after checking the required columns exist.
     */
    static List<Map<String, String>> readRows(Path file, List<String> requiredColumns) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> it = MAPPER.readerFor(Map.class).with(schema).readValues(reader)) {
            List<Map<String, String>> rows = new ArrayList<>();
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
            CsvSchema parsed = (CsvSchema) it.getParserSchema();
            List<String> header = new ArrayList<>();
            if (parsed != null) {
                for (CsvSchema.Column column : parsed) {
                    header.add(column.getName());
                }
            }
            for (String required : requiredColumns) {
                if (!header.contains(required)) {
                    throw new IllegalArgumentException(
                            "CSV " + file + " is missing column '" + required + "' (header: " + header + ")"
                    );
                }
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read CSV: " + file, e);
        }
    }
}

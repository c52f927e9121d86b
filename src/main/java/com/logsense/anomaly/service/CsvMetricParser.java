package com.logsense.anomaly.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.logsense.anomaly.engine.SchemaException;
import com.logsense.anomaly.model.MetricPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads uploaded CSV with header {@code ts,cpu,ram,disk,latency_ms}. Extra columns are ignored;
 * a missing required column or an unparsable number rejects the whole file.
 */
@Component
public class CsvMetricParser {

    public static final List<String> REQUIRED_COLUMNS = List.of("ts", "cpu", "ram", "disk", "latency_ms");

    // plain decimal with optional exponent; no hex, no f/d suffixes, no NaN or Infinity
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final CsvMapper csvMapper;

    public CsvMetricParser() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public List<MetricPoint> parse(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(in)) {

            CsvSchema header = (CsvSchema) rows.getParserSchema();
            Set<String> columns = new LinkedHashSet<>();
            header.forEach(column -> columns.add(column.getName().trim()));
            List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !columns.contains(c)).toList();
            if (!missing.isEmpty()) {
                throw new SchemaException("CSV is missing required column(s): " + String.join(", ", missing),
                        "file");
            }

            List<MetricPoint> points = new ArrayList<>();
            int line = 1;
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                points.add(MetricPoint.builder()
                        .ts(row.get("ts"))
                        .cpu(number(row, "cpu", line))
                        .ram(number(row, "ram", line))
                        .disk(number(row, "disk", line))
                        .latencyMs(number(row, "latency_ms", line))
                        .build());
            }
            return points;
        }
    }

    private Double number(Map<String, String> row, String column, int line) {
        String raw = row.get(column);
        if (raw == null || raw.isBlank()) {
            throw new SchemaException("line " + line + ": missing value for '" + column + "'", column);
        }
        String value = raw.trim();
        if (!DECIMAL.matcher(value).matches()) {
            throw new SchemaException("line " + line + ": '" + raw + "' is not a number for '" + column + "'",
                    column);
        }
        return Double.valueOf(value);
    }
}

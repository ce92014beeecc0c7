package com.querywatch.controller.rest.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Writes projected rows as CSV: a header row of column names, then one line per row in the same
 * column order. Timestamps are RFC3339 (UTC), string arrays are joined with {@code ;}, nulls are
 * empty cells.
 */
@Component
public class QueryLogCsvWriter {

    static final String ARRAY_SEPARATOR = ";";

    // kept out of the context: a CsvMapper bean would displace the JSON ObjectMapper
    private final CsvMapper mapper = new CsvMapper();

    public void write(List<String> columns, List<Map<String, Object>> rows, OutputStream out) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);
        // header goes out as a plain row so an empty result still carries it
        try (SequenceWriter writer = mapper.writer(schema.build().withoutHeader())
                .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(out)) {
            writer.write(columns.toArray(String[]::new));
            for (Map<String, Object> row : rows) {
                String[] cells = new String[columns.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = format(row.get(columns.get(i)));
                }
                writer.write(cells);
            }
        }
        out.flush();
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Instant instant) {
            return DateTimeFormatter.ISO_INSTANT.format(instant);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(ARRAY_SEPARATOR));
        }
        return String.valueOf(value);
    }
}

package io.seqwarehouse.core.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.seqwarehouse.core.model.DataType;
import io.seqwarehouse.core.model.FieldSpec;
import io.seqwarehouse.core.model.ReconciledRecord;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.model.ValidatedRecord;
import io.seqwarehouse.core.validate.DateFormats;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes reconciled records as one delimited table.
 *
 * <p>
 * Columns are the fields of the given schemas in order; an attribute declared by several schemas
 * appears once, described by the first schema declaring it. A record without nested children
 * yields one row. A record with children yields one row per child, kinds in the record's order:
 * the parent's attributes are repeated on every row and the child's non-null values replace them
 * for that row.
 *
 * <p>
 * Dates are written in their field's date format and numbers in plain notation, so an export with
 * {@link HeaderStyle#FIELD} headers validates against the same schema as its sources.
 */
public final class CanonicalExporter {

    private static final Logger LOG = LoggerFactory.getLogger(CanonicalExporter.class);

    private static final CsvMapper MAPPER = new CsvMapper();

    private final HeaderStyle headerStyle;
    private final char delimiter;

    public CanonicalExporter() {
        this(HeaderStyle.FIELD, ',');
    }

    public CanonicalExporter(HeaderStyle headerStyle, char delimiter) {
        this.headerStyle = Objects.requireNonNull(headerStyle, "headerStyle must not be null");
        this.delimiter = delimiter;
    }

    /**
     * Writes the records to a file, replacing it.
     *
     * @return number of data rows written
     * @throws IOException if the file cannot be written
     */
    public int export(List<ReconciledRecord> records, List<Schema> schemas, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            int rows = write(records, schemas, writer);
            LOG.info("Exported {} records as {} rows to {}", records.size(), rows, target);
            return rows;
        }
    }

    /**
     * Writes the records to an open writer, which is left open.
     *
     * @return number of data rows written
     */
    public int write(List<ReconciledRecord> records, List<Schema> schemas, Writer writer) throws IOException {
        List<FieldSpec> columns = columns(schemas);
        CsvSchema format = CsvSchema.emptySchema().withColumnSeparator(delimiter).withLineSeparator("\n");
        int rows = 0;
        try (SequenceWriter out = MAPPER.writer(format)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(writer)) {
            out.write(columns.stream().map(headerStyle::headerOf).toArray(String[]::new));
            for (ReconciledRecord record : records) {
                for (Map<String, Object> row : flatten(record)) {
                    out.write(render(row, columns));
                    rows++;
                }
            }
        }
        return rows;
    }

    /** Rows a record expands to, as attribute maps, before formatting. */
    public static List<Map<String, Object>> flatten(ReconciledRecord record) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (List<ValidatedRecord> children : record.children().values()) {
            for (ValidatedRecord child : children) {
                Map<String, Object> row = new LinkedHashMap<>(record.attributes());
                child.attributes().forEach((attribute, value) -> {
                    if (value != null) {
                        row.put(attribute, value);
                    }
                });
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            rows.add(new LinkedHashMap<>(record.attributes()));
        }
        return rows;
    }

    private static List<FieldSpec> columns(List<Schema> schemas) {
        Map<String, FieldSpec> columns = new LinkedHashMap<>();
        for (Schema schema : schemas) {
            for (FieldSpec field : schema.fields()) {
                columns.putIfAbsent(field.attributeName(), field);
            }
        }
        return new ArrayList<>(columns.values());
    }

    private static String[] render(Map<String, Object> row, List<FieldSpec> columns) {
        String[] cells = new String[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            FieldSpec field = columns.get(i);
            cells[i] = format(row.get(field.attributeName()), field);
        }
        return cells;
    }

    static String format(Object value, FieldSpec field) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDate date && field.dataType() == DataType.DATE) {
            return DateFormats.format(date, field.dateFormat());
        }
        if (value instanceof Double d && !d.isNaN() && !d.isInfinite()) {
            return BigDecimal.valueOf(d).toPlainString();
        }
        return value.toString();
    }
}

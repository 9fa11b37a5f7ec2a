package io.seqwarehouse.core.tabular;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.spi.TabularLoader;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads comma- and tab-delimited text. The first non-empty line is the header. Cells are kept as
 * text; an empty cell becomes {@code null}. A line with more cells than the header keeps its
 * leading cells and is flagged with a parse issue; a shorter line leaves the remaining columns
 * blank. A record that cannot be parsed at all, such as one with text after a closing quote,
 * becomes a row without values that carries the parse error.
 */
public final class DelimitedTableLoader implements TabularLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DelimitedTableLoader.class);

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    @Override
    public Set<String> extensions() {
        return Set.of("csv", "tsv", "txt");
    }

    @Override
    public Stream<RawRow> load(Path source) {
        char separator = separatorFor(source);
        ObjectReader reader = MAPPER.readerForListOf(String.class)
                .with(CsvSchema.emptySchema().withColumnSeparator(separator));
        BufferedReader in;
        try {
            in = Files.newBufferedReader(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceUnreadableException("Cannot open delimited file: " + e.getMessage(), e, source.toString());
        }
        LOG.debug("Reading delimited file {} (separator '{}')", source, separator == '\t' ? "\\t" : separator);
        return RowStreams.of(new DelimitedRows(source, in, reader, separator), in);
    }

    static char separatorFor(Path source) {
        return LoaderRegistry.extensionOf(source).equals("csv") ? ',' : '\t';
    }

    /**
     * Splits the input into records and parses each one on its own, so a record Jackson rejects
     * becomes a flagged row and the rest of the file is still read. Line breaks inside a quoted
     * cell do not end a record.
     */
    private static final class DelimitedRows extends RowStreams.LazyIterator {

        private static final int NONE = -2;

        private final Path source;
        private final BufferedReader in;
        private final ObjectReader reader;
        private final char separator;
        private int pending = NONE;
        private List<String> header;
        private int row;

        DelimitedRows(Path source, BufferedReader in, ObjectReader reader, char separator) {
            this.source = source;
            this.in = in;
            this.reader = reader;
            this.separator = separator;
        }

        @Override
        protected RawRow computeNext() {
            while (true) {
                String record = nextRecord();
                if (record == null) {
                    return null;
                }
                if (record.isEmpty()) {
                    continue;
                }
                if (header == null) {
                    header = new ArrayList<>();
                    for (String cell : parseHeader(record.startsWith("\uFEFF") ? record.substring(1) : record)) {
                        header.add(cell == null ? "" : cell.trim());
                    }
                    continue;
                }
                row++;
                List<String> cells;
                try {
                    cells = reader.readValue(record);
                } catch (JsonProcessingException e) {
                    LOG.debug("Unparseable record at data row {} of {}: {}", row, source, e.getOriginalMessage());
                    return new RawRow(Map.of(), SourceLocation.of(source, row),
                            "Unparseable row: " + e.getOriginalMessage());
                }
                RawRow raw = toRow(cells == null ? List.of() : cells);
                if (raw.isBlank() && raw.parseIssue() == null) {
                    continue;
                }
                return raw;
            }
        }

        private List<String> parseHeader(String record) {
            try {
                List<String> cells = reader.readValue(record);
                return cells == null ? List.of() : cells;
            } catch (JsonProcessingException e) {
                throw new SourceUnreadableException(
                        "Cannot parse delimited header: " + e.getOriginalMessage(), e, source.toString());
            }
        }

        /** The next record without its line terminator, or {@code null} at the end of input. */
        private String nextRecord() {
            StringBuilder record = new StringBuilder();
            boolean quoted = false;
            boolean cellStart = true;
            try {
                int c;
                while ((c = read()) != -1) {
                    if (quoted) {
                        if (c == '"') {
                            int following = read();
                            if (following == '"') {
                                record.append('"');
                            } else {
                                quoted = false;
                                pending = following;
                            }
                        }
                    } else if (c == '\n') {
                        return withoutReturn(record);
                    } else if (c == '"' && cellStart) {
                        quoted = true;
                    }
                    cellStart = !quoted && c == separator;
                    record.append((char) c);
                }
            } catch (IOException e) {
                throw new SourceUnreadableException(
                        "Cannot read delimited file after data row " + row + ": " + e.getMessage(),
                        e,
                        source.toString());
            }
            return record.length() == 0 ? null : withoutReturn(record);
        }

        private int read() throws IOException {
            if (pending != NONE) {
                int c = pending;
                pending = NONE;
                return c;
            }
            return in.read();
        }

        private static String withoutReturn(StringBuilder record) {
            int end = record.length();
            if (end > 0 && record.charAt(end - 1) == '\r') {
                end--;
            }
            return record.substring(0, end);
        }

        private RawRow toRow(List<String> cells) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                String cell = i < cells.size() ? cells.get(i) : null;
                values.putIfAbsent(header.get(i), cell == null || cell.isEmpty() ? null : cell);
            }
            String issue = null;
            if (cells.size() > header.size() && hasContent(cells.subList(header.size(), cells.size()))) {
                issue = "Row has " + cells.size() + " cells but the header declares " + header.size();
            }
            return new RawRow(values, SourceLocation.of(source, row), issue);
        }

        private static boolean hasContent(List<String> cells) {
            for (String cell : cells) {
                if (cell != null && !cell.isBlank()) {
                    return true;
                }
            }
            return false;
        }
    }
}

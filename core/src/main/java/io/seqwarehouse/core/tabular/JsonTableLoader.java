package io.seqwarehouse.core.tabular;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.spi.TabularLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads JSON summary files: a single object becomes one row, an array of objects one row per
 * element. Nested objects are flattened with dotted keys ({@code reads.total}); arrays are kept
 * as their JSON text. A non-object array element yields a malformed row.
 *
 * <p>Summary files are small, so the whole document is read when the stream is opened.
 */
public final class JsonTableLoader implements TabularLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Set<String> extensions() {
        return Set.of("json");
    }

    @Override
    public Stream<RawRow> load(Path source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(source.toFile());
        } catch (IOException e) {
            throw new SourceUnreadableException("Cannot read JSON file: " + e.getMessage(), e, source.toString());
        }
        if (root == null || root.isMissingNode()) {
            return Stream.empty();
        }
        List<RawRow> rows = new ArrayList<>();
        if (root.isObject()) {
            rows.add(toRow(root, source, 1));
        } else if (root.isArray()) {
            int row = 0;
            for (JsonNode element : root) {
                row++;
                if (element.isObject()) {
                    rows.add(toRow(element, source, row));
                } else {
                    rows.add(new RawRow(
                            Map.of(),
                            SourceLocation.of(source, row),
                            "Expected an object but found " + element.getNodeType()));
                }
            }
        } else {
            throw new SourceUnreadableException(
                    "JSON summary must be an object or an array of objects, found " + root.getNodeType(),
                    source.toString());
        }
        return rows.stream().filter(raw -> !raw.isBlank() || raw.parseIssue() != null);
    }

    private static RawRow toRow(JsonNode object, Path source, int row) {
        Map<String, Object> values = new LinkedHashMap<>();
        flatten("", object, values);
        return new RawRow(values, SourceLocation.of(source, row));
    }

    private static void flatten(String prefix, JsonNode object, Map<String, Object> values) {
        for (Map.Entry<String, JsonNode> entry : object.properties()) {
            String key = prefix + entry.getKey();
            JsonNode value = entry.getValue();
            if (value.isObject()) {
                flatten(key + ".", value, values);
            } else {
                values.put(key, scalar(value));
            }
        }
    }

    private static Object scalar(JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.textValue();
            return text.isEmpty() ? null : text;
        }
        return value.toString();
    }
}

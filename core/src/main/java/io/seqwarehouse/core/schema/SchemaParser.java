package io.seqwarehouse.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.seqwarehouse.core.error.SchemaException;
import io.seqwarehouse.core.model.DataType;
import io.seqwarehouse.core.model.FieldSpec;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.validate.DateFormats;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses YAML schema descriptor files into {@link Schema} instances.
 *
 * <p>
 * A descriptor maps attribute names to field definitions:
 *
 * <pre>
 * STUDY_ID:
 *   field: study_id
 *   label: Study ID
 *   identifier: true
 * DATE:
 *   field: date
 *   datatype: date
 *   dateformat: "%Y/%m/%d"
 * </pre>
 *
 * Attribute names are normalised to upper case. Keys this parser does not know are ignored so
 * that older builds accept newer descriptors.
 *
 * <p>
 * Thread-safe.
 */
public final class SchemaParser {

    private final DescriptorReader reader;

    public SchemaParser() {
        this.reader = new DescriptorReader(DescriptorReader.FIELD_DESCRIPTOR_SCHEMA);
    }

    /**
     * Parses the descriptor at the given path.
     *
     * @param path     path to the YAML descriptor
     * @param kind     source kind the schema describes
     * @param category category of the kind, or null to use the kind itself
     * @return the immutable schema
     * @throws SchemaException if the descriptor is unreadable, structurally invalid, or violates a
     *                         schema invariant
     */
    public Schema parse(Path path, String kind, String category) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        String source = path.toString();

        JsonNode root = readYaml(path, kind, source);
        if (!root.isObject()) {
            throw new SchemaException("Schema descriptor must be a mapping of attribute names", kind, source);
        }
        List<String> violations = reader.violations(root);
        if (!violations.isEmpty()) {
            throw new SchemaException("Invalid schema descriptor: " + violations, kind, source);
        }

        List<FieldSpec> fields = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : root.properties()) {
            fields.add(parseField(entry.getKey(), entry.getValue(), kind, source));
        }
        return Schema.of(kind, category, fields, source);
    }

    /** Parses a descriptor whose kind is its file name without extension. */
    public Schema parse(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String kind = dot > 0 ? fileName.substring(0, dot) : fileName;
        return parse(path, kind, null);
    }

    private FieldSpec parseField(String key, JsonNode node, String kind, String source) {
        String attribute = key.trim().toUpperCase(Locale.ROOT);
        String field = node.get("field").asText().trim();
        String label = optionalText(node, "label");

        String datatypeName = optionalText(node, "datatype");
        DataType dataType = datatypeName == null ? DataType.STR : DataType.fromDescriptor(datatypeName);
        if (dataType == null) {
            throw new SchemaException(
                    "Unknown datatype '" + datatypeName + "' for attribute '" + attribute
                            + "' (expected one of: str, int, float, date)",
                    kind,
                    source);
        }

        String dateFormat = optionalText(node, "dateformat");
        if (dateFormat != null && dataType == DataType.DATE) {
            try {
                DateFormats.formatter(dateFormat);
            } catch (IllegalArgumentException e) {
                throw new SchemaException(
                        "Invalid dateformat for attribute '" + attribute + "': " + e.getMessage(), e, kind, source);
            }
        }
        Pattern pattern = null;
        String patternText = optionalText(node, "pattern");
        if (patternText != null) {
            try {
                pattern = Pattern.compile(patternText);
            } catch (PatternSyntaxException e) {
                throw new SchemaException(
                        "Invalid pattern for attribute '" + attribute + "': " + e.getDescription(), e, kind, source);
            }
        }

        return new FieldSpec(
                attribute,
                field,
                label,
                dataType,
                dateFormat,
                node.path("required").asBoolean(false),
                node.path("identifier").asBoolean(false),
                node.path("unique").asBoolean(false),
                pattern);
    }

    private JsonNode readYaml(Path path, String kind, String source) {
        try {
            return reader.read(path);
        } catch (IOException e) {
            throw new SchemaException("Failed to read or parse YAML: " + e.getMessage(), e, kind, source);
        }
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}

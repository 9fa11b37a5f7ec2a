package io.seqwarehouse.core.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads declarative YAML descriptors and checks their structure against a bundled JSON Schema
 * (2020-12). Duplicate mapping keys are rejected rather than silently overwritten.
 *
 * <p>
 * Thread-safe: the YAML mapper and compiled JSON Schema are immutable after construction.
 */
public final class DescriptorReader {

    /** Structural schema for per-source field descriptors. */
    public static final String FIELD_DESCRIPTOR_SCHEMA = "/descriptor-schemas/field-descriptor.schema.json";

    /** Structural schema for target descriptor trees. */
    public static final String TARGET_DESCRIPTOR_SCHEMA = "/descriptor-schemas/target-descriptor.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
            new YAMLFactory().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION));
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema structure;

    /**
     * Creates a reader validating against the given classpath JSON Schema.
     *
     * @param schemaResource classpath location of the JSON Schema
     */
    public DescriptorReader(String schemaResource) {
        Objects.requireNonNull(schemaResource, "schemaResource must not be null");
        try (InputStream in = DescriptorReader.class.getResourceAsStream(schemaResource)) {
            if (in == null) {
                throw new IllegalStateException("Descriptor schema not on classpath: " + schemaResource);
            }
            this.structure = SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read descriptor schema " + schemaResource, e);
        }
    }

    /**
     * Parses a YAML file into a tree.
     *
     * @throws IOException if the file cannot be read, is not valid YAML, or repeats a key
     */
    public JsonNode read(Path path) throws IOException {
        return readTree(path);
    }

    /**
     * Parses a YAML file into a tree without structural validation.
     *
     * @throws IOException if the file cannot be read, is not valid YAML, or repeats a key
     */
    public static JsonNode readTree(Path path) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(path.toFile());
        return root != null ? root : YAML_MAPPER.missingNode();
    }

    /**
     * Validates a descriptor tree against the structural schema.
     *
     * @return human-readable violations, empty when the tree conforms
     */
    public List<String> violations(JsonNode root) {
        Set<ValidationMessage> messages = structure.validate(root);
        return messages.stream().map(ValidationMessage::getMessage).sorted().toList();
    }
}

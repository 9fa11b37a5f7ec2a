package io.seqwarehouse.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.seqwarehouse.core.error.SchemaException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lists the schema descriptors of every data source, grouped by category. Parsed from a YAML
 * catalog such as:
 *
 * <pre>
 * experimental:
 *   label: Experimental Data
 *   sources:
 *     - kind: seqlib
 *       label: Sequencing library
 *       path: dataschemas/experimental/seqlib.yml
 * </pre>
 *
 * Descriptor paths are resolved against the catalog's directory.
 *
 * @param categories categories in declaration order
 */
public record DataSourceCatalog(List<Category> categories) {

    /**
     * A group of related source kinds.
     *
     * @param name    category key, e.g. {@code experimental}
     * @param label   human-readable label
     * @param sources sources in the category
     */
    public record Category(String name, String label, List<Source> sources) {}

    /**
     * One source kind and the descriptor describing it.
     *
     * @param kind       source kind, unique across the catalog
     * @param label      human-readable label
     * @param descriptor resolved descriptor path
     */
    public record Source(String kind, String label, Path descriptor) {}

    public DataSourceCatalog {
        categories = List.copyOf(categories);
    }

    /**
     * Parses a catalog file.
     *
     * @throws SchemaException if the catalog is unreadable or an entry is incomplete
     */
    public static DataSourceCatalog parse(Path catalogPath) {
        Objects.requireNonNull(catalogPath, "catalogPath must not be null");
        String source = catalogPath.toString();
        Path baseDir = catalogPath.toAbsolutePath().getParent();
        JsonNode root;
        try {
            root = DescriptorReader.readTree(catalogPath);
        } catch (IOException e) {
            throw new SchemaException("Failed to read data source catalog: " + e.getMessage(), e, null, source);
        }
        if (!root.isObject()) {
            throw new SchemaException("Data source catalog must be a mapping of categories", null, source);
        }

        List<Category> categories = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : root.properties()) {
            String name = entry.getKey();
            JsonNode node = entry.getValue();
            JsonNode sourcesNode = node.path("sources");
            if (!sourcesNode.isArray() || sourcesNode.isEmpty()) {
                throw new SchemaException("Category '" + name + "' must list at least one source", null, source);
            }
            List<Source> sources = new ArrayList<>();
            for (JsonNode sourceNode : sourcesNode) {
                String kind = sourceNode.path("kind").asText(null);
                String path = sourceNode.path("path").asText(null);
                if (kind == null || kind.isBlank() || path == null || path.isBlank()) {
                    throw new SchemaException(
                            "Every source in category '" + name + "' requires 'kind' and 'path'", kind, source);
                }
                String label = sourceNode.path("label").asText(kind);
                sources.add(new Source(kind, label, baseDir.resolve(path).normalize()));
            }
            categories.add(new Category(name, node.path("label").asText(name), sources));
        }
        return new DataSourceCatalog(categories);
    }
}

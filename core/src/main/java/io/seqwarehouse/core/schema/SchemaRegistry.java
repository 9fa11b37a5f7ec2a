package io.seqwarehouse.core.schema;

import io.seqwarehouse.core.error.SchemaException;
import io.seqwarehouse.core.model.Schema;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable set of schemas, one per source kind. Schemas of different kinds are independent; the
 * registry never merges them.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, Schema> schemas;

    private SchemaRegistry(Map<String, Schema> schemas) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    /**
     * Creates an empty registry with no schemas.
     *
     * @return an empty, immutable registry
     */
    public static SchemaRegistry empty() {
        return new SchemaRegistry(Map.of());
    }

    /**
     * Returns a new {@link Builder} for constructing a registry incrementally.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads every descriptor listed in a data source catalog.
     *
     * @param catalogPath path to the catalog YAML
     * @param parser      parser used for each descriptor
     * @return the loaded registry
     * @throws SchemaException if the catalog or any descriptor is invalid
     */
    public static SchemaRegistry load(Path catalogPath, SchemaParser parser) {
        DataSourceCatalog catalog = DataSourceCatalog.parse(catalogPath);
        Builder builder = builder();
        for (DataSourceCatalog.Category category : catalog.categories()) {
            for (DataSourceCatalog.Source source : category.sources()) {
                builder.add(parser.parse(source.descriptor(), source.kind(), category.name()));
            }
        }
        SchemaRegistry registry = builder.build();
        LOG.info("Schemas loaded: kinds={}", registry.kinds());
        return registry;
    }

    /**
     * Looks up a schema by source kind.
     *
     * @return the schema, or {@code null} if the kind is not registered
     */
    public Schema schema(String kind) {
        return schemas.get(kind);
    }

    /**
     * Looks up a schema that must be present.
     *
     * @throws SchemaException if the kind is not registered
     */
    public Schema require(String kind) {
        Schema schema = schemas.get(kind);
        if (schema == null) {
            throw new SchemaException(
                    "No schema registered for kind '" + kind + "' (known: " + schemas.keySet() + ")", kind, null);
        }
        return schema;
    }

    /** Registered kinds in registration order. */
    public Set<String> kinds() {
        return schemas.keySet();
    }

    /** Schemas whose category equals the given one, in registration order. */
    public List<Schema> byCategory(String category) {
        return schemas.values().stream()
                .filter(schema -> schema.category().equals(category))
                .toList();
    }

    public int size() {
        return schemas.size();
    }

    /** Builder for constructing a {@link SchemaRegistry} incrementally. */
    public static final class Builder {

        private final Map<String, Schema> schemas = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers a schema under its kind.
         *
         * @throws SchemaException if the kind is already registered
         */
        public Builder add(Schema schema) {
            if (schemas.putIfAbsent(schema.kind(), schema) != null) {
                throw new SchemaException("Schema kind '" + schema.kind() + "' registered twice", schema.kind(), null);
            }
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(schemas);
        }
    }
}

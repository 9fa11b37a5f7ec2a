package io.seqwarehouse.core.engine;

import io.seqwarehouse.core.aggregate.Aggregator;
import io.seqwarehouse.core.config.WarehouseConfig;
import io.seqwarehouse.core.error.SchemaException;
import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.export.CanonicalExporter;
import io.seqwarehouse.core.model.AggregationReport;
import io.seqwarehouse.core.model.ExperimentWorkbook;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.ReconciliationResult;
import io.seqwarehouse.core.model.ResolvedTarget;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.model.SummaryCollection;
import io.seqwarehouse.core.model.TargetDescriptor;
import io.seqwarehouse.core.model.ValidationResult;
import io.seqwarehouse.core.reconcile.IdentifierReconciler;
import io.seqwarehouse.core.reconcile.TableInput;
import io.seqwarehouse.core.schema.SchemaParser;
import io.seqwarehouse.core.schema.SchemaRegistry;
import io.seqwarehouse.core.tabular.ExperimentIds;
import io.seqwarehouse.core.tabular.ExperimentWorkbookReader;
import io.seqwarehouse.core.tabular.LoaderRegistry;
import io.seqwarehouse.core.tabular.SequenceSummaryCollector;
import io.seqwarehouse.core.tabular.SpreadsheetTableLoader;
import io.seqwarehouse.core.target.TargetParser;
import io.seqwarehouse.core.target.TargetResolver;
import io.seqwarehouse.core.validate.MetadataValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the warehouse components together from one {@link WarehouseConfig}: schema loading,
 * source validation, reconciliation, target resolution, aggregation and export.
 *
 * <p>
 * The schema registry is held in an {@link AtomicReference}; {@link #reloadSchemas()} replaces it
 * as a whole, so a caller always sees one consistent set of schemas. A failed reload keeps the
 * previous registry.
 */
public final class WarehouseEngine {

    private static final Logger LOG = LoggerFactory.getLogger(WarehouseEngine.class);

    private final WarehouseConfig config;
    private final AtomicReference<SchemaRegistry> registry = new AtomicReference<>(SchemaRegistry.empty());
    private final SchemaParser schemaParser = new SchemaParser();
    private final LoaderRegistry loaders = LoaderRegistry.withDefaults();
    private final MetadataValidator validator = new MetadataValidator();
    private final IdentifierReconciler reconciler;
    private final TargetParser targetParser = new TargetParser();
    private final TargetResolver resolver = new TargetResolver();
    private final Aggregator aggregator;
    private final ExperimentWorkbookReader workbookReader;
    private final SequenceSummaryCollector summaryCollector;
    private final CanonicalExporter exporter;

    public WarehouseEngine(WarehouseConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        ExperimentIds experimentIds = new ExperimentIds(config.experimentIdPattern());
        this.reconciler = new IdentifierReconciler(config.tablePrecedence());
        this.aggregator = new Aggregator(config.ambiguityPolicy(), resolver);
        this.workbookReader = new ExperimentWorkbookReader(new SpreadsheetTableLoader(), validator, experimentIds);
        this.summaryCollector = new SequenceSummaryCollector(loaders, experimentIds);
        this.exporter = new CanonicalExporter(config.headerStyle(), config.delimiter());
    }

    public WarehouseConfig config() {
        return config;
    }

    /** The current schema registry; empty until {@link #reloadSchemas()} succeeds. */
    public SchemaRegistry schemas() {
        return registry.get();
    }

    /** Installs a registry built elsewhere, replacing the current one. */
    public void useSchemas(SchemaRegistry schemas) {
        registry.set(Objects.requireNonNull(schemas, "schemas must not be null"));
    }

    /**
     * Loads every schema listed in the configured catalog and swaps it in.
     *
     * @throws SchemaException if any descriptor is invalid; the previous registry stays active
     */
    public SchemaRegistry reloadSchemas() {
        SchemaRegistry loaded;
        try {
            loaded = SchemaRegistry.load(config.schemaCatalog(), schemaParser);
        } catch (SchemaException e) {
            LOG.error("Schema reload failed, keeping {} previous schemas: {}", registry.get().size(), e.getMessage());
            throw e;
        }
        registry.set(loaded);
        return loaded;
    }

    /**
     * Loads one source file and validates it against the schema of {@code kind}.
     *
     * @throws SchemaException           if {@code kind} has no schema
     * @throws SourceUnreadableException if the file cannot be read
     */
    public ValidationResult validateSource(Path file, String kind) {
        Schema schema = registry.get().require(kind);
        try (Stream<RawRow> rows = loaders.load(file)) {
            return validator.validate(rows, schema);
        }
    }

    /** Validates rows already loaded, e.g. collected sequence summaries. */
    public ValidationResult validateRows(List<RawRow> rows, String kind) {
        return validator.validate(rows, registry.get().require(kind));
    }

    /** Reads an experiment workbook with the schemas of the two given kinds. */
    public ExperimentWorkbook readWorkbook(Path workbook, String experimentKind, String reactionKind) {
        SchemaRegistry schemas = registry.get();
        return workbookReader.read(workbook, schemas.require(experimentKind), schemas.require(reactionKind));
    }

    /** Collects sequence summaries matching {@code glob} below {@code root}. */
    public SummaryCollection collectSummaries(Path root, String glob) {
        return summaryCollector.collect(root, glob);
    }

    /**
     * Reconciles the given tables. A table without a category takes the category of the schema
     * registered for its kind, so catalog kinds rank by the configured precedence.
     */
    public ReconciliationResult reconcile(Map<String, TableInput> tables) {
        SchemaRegistry schemas = registry.get();
        Map<String, TableInput> categorized = new LinkedHashMap<>();
        tables.forEach((kind, table) -> {
            Schema schema = schemas.schema(kind);
            boolean inherit = table.category() == null && schema != null;
            categorized.put(kind, inherit ? table.withCategory(schema.category()) : table);
        });
        return reconciler.reconcile(categorized);
    }

    /** Parses the configured target descriptors and resolves them under {@code root}. */
    public List<ResolvedTarget> resolveTargets(Path root) {
        return resolver.resolveAll(root, targetParser.parse(config.targetsFile()));
    }

    /** Resolves the configured targets under {@code root} and copies them below {@code destination}. */
    public AggregationReport aggregate(Path root, Path destination) {
        return aggregator.aggregate(resolveTargets(root), destination);
    }

    /** Aggregates every experiment folder under {@code sequenceRoot}, one destination per experiment. */
    public Map<String, AggregationReport> aggregateExperiments(Path sequenceRoot, Path destination) {
        List<TargetDescriptor> descriptors = targetParser.parse(config.targetsFile());
        return aggregator.aggregateExperiments(sequenceRoot, config.experimentIdPattern(), descriptors, destination);
    }

    /**
     * Exports reconciled records with the columns of the given kinds, in order.
     *
     * @return number of rows written
     */
    public int export(ReconciliationResult result, List<String> kinds, Path target) throws IOException {
        SchemaRegistry schemas = registry.get();
        List<Schema> columns = kinds.stream().map(schemas::require).toList();
        return exporter.export(result.records(), columns, target);
    }
}

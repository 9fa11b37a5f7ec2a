package io.seqwarehouse.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.seqwarehouse.core.error.WarehouseException;
import io.seqwarehouse.core.model.AggregationReport;
import io.seqwarehouse.core.model.CopyStatus;
import io.seqwarehouse.core.model.FileCopy;
import io.seqwarehouse.core.model.KindValue;
import io.seqwarehouse.core.model.ReconciliationIssue;
import io.seqwarehouse.core.model.ReconciliationResult;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.model.TargetOutcome;
import io.seqwarehouse.core.model.TargetState;
import io.seqwarehouse.core.model.ValidationIssue;
import io.seqwarehouse.core.model.ValidationResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured summary of one run: validation issues per table, reconciliation issues, aggregation
 * outcomes per target, and the sources that had to be dropped. Serialised as JSON for reporting
 * tools.
 *
 * <p>
 * Immutable; assembled through {@link Builder}.
 */
public final class IssueReport {

    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final List<ValidationResult> validations;
    private final ReconciliationResult reconciliation;
    private final List<AggregationReport> aggregations;
    private final List<WarehouseException> dropped;

    private IssueReport(Builder builder) {
        this.validations = List.copyOf(builder.validations);
        this.reconciliation = builder.reconciliation;
        this.aggregations = List.copyOf(builder.aggregations);
        this.dropped = List.copyOf(builder.dropped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ValidationResult> validations() {
        return validations;
    }

    /** The reconciliation outcome, or {@code null} if the run did not reconcile. */
    public ReconciliationResult reconciliation() {
        return reconciliation;
    }

    public List<AggregationReport> aggregations() {
        return aggregations;
    }

    public List<WarehouseException> dropped() {
        return dropped;
    }

    public int validationIssueCount() {
        return validations.stream().mapToInt(v -> v.issues().size()).sum();
    }

    public int reconciliationIssueCount() {
        return reconciliation == null ? 0 : reconciliation.issues().size();
    }

    public long failedTargetCount() {
        return aggregations.stream()
                .flatMap(a -> a.outcomes().stream())
                .filter(o -> o.state() == TargetState.FAILED)
                .count();
    }

    /** True when nothing was reported at all. */
    public boolean isClean() {
        return validationIssueCount() == 0 && reconciliationIssueCount() == 0 && failedTargetCount() == 0
                && dropped.isEmpty();
    }

    /** Builds the JSON tree of this report. */
    public ObjectNode toJson() {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode summary = root.putObject("summary");
        summary.put("validationIssues", validationIssueCount());
        summary.put("reconciliationIssues", reconciliationIssueCount());
        summary.put("failedTargets", failedTargetCount());
        summary.put("droppedSources", dropped.size());

        ArrayNode validationNode = root.putArray("validation");
        for (ValidationResult result : validations) {
            ObjectNode table = validationNode.addObject();
            table.put("kind", result.schemaKind());
            table.put("records", result.records().size());
            ArrayNode issues = table.putArray("issues");
            result.issues().forEach(issue -> writeIssue(issues.addObject(), issue));
        }

        if (reconciliation != null) {
            ObjectNode reconciliationNode = root.putObject("reconciliation");
            reconciliationNode.put("records", reconciliation.records().size());
            ArrayNode issues = reconciliationNode.putArray("issues");
            reconciliation.issues().forEach(issue -> writeIssue(issues.addObject(), issue));
        }

        ArrayNode aggregationNode = root.putArray("aggregation");
        for (AggregationReport report : aggregations) {
            ObjectNode run = aggregationNode.addObject();
            run.put("destinationRoot", report.destinationRoot().toString());
            ArrayNode targets = run.putArray("targets");
            report.outcomes().forEach(outcome -> writeOutcome(targets.addObject(), outcome));
        }

        ArrayNode droppedNode = root.putArray("droppedSources");
        for (WarehouseException e : dropped) {
            ObjectNode entry = droppedNode.addObject();
            entry.put("source", e.source());
            entry.put("phase", e.phase().name());
            entry.put("message", e.getMessage());
        }
        return root;
    }

    /** Renders the report as indented JSON. */
    public String render() {
        try {
            return JSON.writeValueAsString(toJson());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render issue report", e);
        }
    }

    /** Writes the report as JSON, replacing the file. */
    public void writeTo(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writeValue(target.toFile(), toJson());
    }

    private static void writeIssue(ObjectNode node, ValidationIssue issue) {
        node.put("kind", issue.kind().name());
        node.put("attribute", issue.attribute());
        node.set("rawValue", JSON.valueToTree(issue.rawValue()));
        node.put("detail", issue.detail());
        SourceLocation location = issue.location();
        if (location != null) {
            node.put("file", location.file() != null ? location.file().toString() : null);
            node.put("sheet", location.sheet());
            node.put("row", location.row());
        }
    }

    private static void writeIssue(ObjectNode node, ReconciliationIssue issue) {
        node.put("kind", issue.kind().name());
        node.put("identifier", issue.identifier());
        node.put("attribute", issue.attribute());
        ArrayNode kinds = node.putArray("tableKinds");
        issue.tableKinds().forEach(kinds::add);
        ArrayNode values = node.putArray("values");
        for (KindValue value : issue.values()) {
            ObjectNode entry = values.addObject();
            entry.put("tableKind", value.tableKind());
            entry.set("value", JSON.valueToTree(value.value()));
        }
        node.put("detail", issue.detail());
    }

    private static void writeOutcome(ObjectNode node, TargetOutcome outcome) {
        node.put("name", outcome.name());
        node.put("state", outcome.state().name());
        node.put("copyRoot", outcome.copyRoot() != null ? outcome.copyRoot().toString() : null);
        node.put("destination", outcome.destination() != null ? outcome.destination().toString() : null);
        node.put("copied", outcome.count(CopyStatus.COPIED));
        node.put("alreadyPresent", outcome.count(CopyStatus.ALREADY_PRESENT));
        node.put("failed", outcome.count(CopyStatus.FAILED));
        node.put("detail", outcome.detail());
        ArrayNode failures = node.putArray("failures");
        for (FileCopy file : outcome.files()) {
            if (file.status() == CopyStatus.FAILED) {
                ObjectNode failure = failures.addObject();
                failure.put("source", String.valueOf(file.source()));
                failure.put("error", file.error());
            }
        }
    }

    /** Collects the parts of a run report. */
    public static final class Builder {

        private final List<ValidationResult> validations = new ArrayList<>();
        private ReconciliationResult reconciliation;
        private final List<AggregationReport> aggregations = new ArrayList<>();
        private final List<WarehouseException> dropped = new ArrayList<>();

        Builder() {}

        public Builder validation(ValidationResult result) {
            validations.add(result);
            return this;
        }

        public Builder reconciliation(ReconciliationResult result) {
            this.reconciliation = result;
            return this;
        }

        public Builder aggregation(AggregationReport report) {
            aggregations.add(report);
            return this;
        }

        public Builder dropped(WarehouseException cause) {
            dropped.add(cause);
            return this;
        }

        public IssueReport build() {
            return new IssueReport(this);
        }
    }
}

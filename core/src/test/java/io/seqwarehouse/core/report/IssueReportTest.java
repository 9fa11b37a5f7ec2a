package io.seqwarehouse.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.AggregationReport;
import io.seqwarehouse.core.model.FileCopy;
import io.seqwarehouse.core.model.IssueKind;
import io.seqwarehouse.core.model.KindValue;
import io.seqwarehouse.core.model.ReconciliationIssue;
import io.seqwarehouse.core.model.ReconciliationResult;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.model.TargetOutcome;
import io.seqwarehouse.core.model.TargetState;
import io.seqwarehouse.core.model.ValidationIssue;
import io.seqwarehouse.core.model.ValidationResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IssueReportTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void emptyReportIsClean() {
        IssueReport report = IssueReport.builder().build();

        assertThat(report.isClean()).isTrue();
        JsonNode json = report.toJson();
        assertThat(json.path("summary").path("validationIssues").asInt()).isZero();
        assertThat(json.has("reconciliation")).isFalse();
        assertThat(json.path("aggregation").isArray()).isTrue();
        assertThat(json.path("droppedSources").size()).isZero();
    }

    @Test
    void summaryCountsEverySection() {
        IssueReport report = fullReport();

        assertThat(report.isClean()).isFalse();
        assertThat(report.validationIssueCount()).isEqualTo(1);
        assertThat(report.reconciliationIssueCount()).isEqualTo(1);
        assertThat(report.failedTargetCount()).isEqualTo(1);

        JsonNode summary = report.toJson().path("summary");
        assertThat(summary.path("validationIssues").asInt()).isEqualTo(1);
        assertThat(summary.path("reconciliationIssues").asInt()).isEqualTo(1);
        assertThat(summary.path("failedTargets").asInt()).isEqualTo(1);
        assertThat(summary.path("droppedSources").asInt()).isEqualTo(1);
    }

    @Test
    void validationIssuesCarryTheirLocation() {
        JsonNode table = fullReport().toJson().path("validation").get(0);

        assertThat(table.path("kind").asText()).isEqualTo("sample");
        JsonNode issue = table.path("issues").get(0);
        assertThat(issue.path("kind").asText()).isEqualTo("TYPE_MISMATCH");
        assertThat(issue.path("attribute").asText()).isEqualTo("PARASITAEMIA");
        assertThat(issue.path("rawValue").asText()).isEqualTo("lots");
        assertThat(issue.path("file").asText()).isEqualTo("samples.csv");
        assertThat(issue.path("row").asInt()).isEqualTo(2);
    }

    @Test
    void conflictValuesKeepTheirTypes() {
        JsonNode issue = fullReport().toJson().path("reconciliation").path("issues").get(0);

        assertThat(issue.path("kind").asText()).isEqualTo("CONFLICT");
        assertThat(issue.path("tableKinds").size()).isEqualTo(2);
        assertThat(issue.path("values").get(0).path("value").asText()).isEqualTo("2024-03-01");
        assertThat(issue.path("values").get(1).path("value").asText()).isEqualTo("2024-03-02");
    }

    @Test
    void aggregationOutcomesListFailures() {
        JsonNode targets = fullReport().toJson().path("aggregation").get(0).path("targets");

        assertThat(targets.size()).isEqualTo(2);
        JsonNode nomadic = targets.get(0);
        assertThat(nomadic.path("state").asText()).isEqualTo("FAILED");
        assertThat(nomadic.path("copied").asInt()).isEqualTo(1);
        assertThat(nomadic.path("failed").asInt()).isEqualTo(1);
        assertThat(nomadic.path("failures").get(0).path("error").asText()).isEqualTo("AccessDeniedException");
        assertThat(targets.get(1).path("copyRoot").isNull()).isTrue();
    }

    @Test
    void droppedSourcesNameTheirPhase() {
        JsonNode dropped = fullReport().toJson().path("droppedSources").get(0);

        assertThat(dropped.path("source").asText()).isEqualTo("SLJS034.xlsx");
        assertThat(dropped.path("phase").asText()).isEqualTo("PROCESSING");
        assertThat(dropped.path("message").asText()).isEqualTo("Workbook has no sheet 'expt_rxns'");
    }

    @Test
    void writtenReportParsesBack() throws IOException {
        Path target = tempDir.resolve("reports/run.json");

        fullReport().writeTo(target);

        JsonNode parsed = JSON.readTree(target.toFile());
        assertThat(parsed.path("summary").path("droppedSources").asInt()).isEqualTo(1);
        assertThat(JSON.readTree(fullReport().render()).equals(parsed)).isTrue();
    }

    private static IssueReport fullReport() {
        ValidationResult validation = new ValidationResult(
                "sample",
                List.of(),
                List.of(new ValidationIssue(
                        IssueKind.TYPE_MISMATCH,
                        "PARASITAEMIA",
                        "lots",
                        "'lots' is not a valid integer for int",
                        SourceLocation.of(Path.of("samples.csv"), 2))));
        ReconciliationResult reconciliation = new ReconciliationResult(
                List.of(),
                List.of(new ReconciliationIssue(
                        IssueKind.CONFLICT,
                        "SMP001",
                        "DATE",
                        List.of("experimental", "sample"),
                        List.of(
                                new KindValue("experimental", LocalDate.of(2024, 3, 1)),
                                new KindValue("sample", LocalDate.of(2024, 3, 2))),
                        "Values disagree")));
        Path destination = Path.of("warehouse");
        AggregationReport aggregation = new AggregationReport(
                destination,
                List.of(
                        new TargetOutcome(
                                "nomadic",
                                TargetState.FAILED,
                                Path.of("run/nomadic"),
                                destination.resolve("nomadic"),
                                List.of(
                                        FileCopy.copied(Path.of("run/nomadic/a.csv"), Path.of("warehouse/a.csv")),
                                        FileCopy.failed(Path.of("run/nomadic/b.csv"), null, "AccessDeniedException")),
                                "1 of 2 files failed"),
                        new TargetOutcome(
                                "minknow",
                                TargetState.NOT_FOUND,
                                null,
                                destination.resolve("minknow"),
                                List.of(),
                                "No match under run")));
        return IssueReport.builder()
                .validation(validation)
                .reconciliation(reconciliation)
                .aggregation(aggregation)
                .dropped(new SourceUnreadableException("Workbook has no sheet 'expt_rxns'", "SLJS034.xlsx"))
                .build();
    }
}

package io.seqwarehouse.core.validate;

import static io.seqwarehouse.core.testkit.Fixtures.row;
import static io.seqwarehouse.core.testkit.Fixtures.schema;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.seqwarehouse.core.error.SchemaException;
import io.seqwarehouse.core.model.DataType;
import io.seqwarehouse.core.model.FieldSpec;
import io.seqwarehouse.core.model.IssueKind;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.model.ValidatedRecord;
import io.seqwarehouse.core.model.ValidationIssue;
import io.seqwarehouse.core.model.ValidationResult;
import io.seqwarehouse.core.schema.SchemaParser;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link MetadataValidator}: raw rows into schema-typed records with attached issues. */
class MetadataValidatorTest {

    private static final Schema STUDY = Schema.of("study", List.of(
            FieldSpec.of("STUDY_ID", "study_id", DataType.STR).asRequired(),
            FieldSpec.date("DATE", "date", "%Y/%m/%d"),
            FieldSpec.of("PARASITAEMIA", "parasitaemia_p/ul", DataType.INT)));

    private final MetadataValidator validator = new MetadataValidator();

    @Nested
    @DisplayName("Study scenario")
    class StudyScenario {

        @Test
        void cleanRowIsTypedWithoutIssues() {
            RawRow raw = row(1, "study_id", "S001", "date", "2024/03/01", "parasitaemia_p/ul", "1200");

            ValidationResult result = validator.validate(List.of(raw), STUDY);

            assertThat(result.issues()).isEmpty();
            ValidatedRecord record = result.records().get(0);
            assertThat(record.attributes())
                    .containsExactly(
                            Map.entry("STUDY_ID", "S001"),
                            Map.entry("DATE", LocalDate.of(2024, 3, 1)),
                            Map.entry("PARASITAEMIA", 1200L));
            assertThat(record.isValid()).isTrue();
        }

        @Test
        void brokenRowKeepsRecordWithThreeIssues() {
            RawRow raw = row(2, "study_id", "", "date", "01-03-2024", "parasitaemia_p/ul", "abc");

            ValidationResult result = validator.validate(List.of(raw), STUDY);

            ValidatedRecord record = result.records().get(0);
            assertThat(record.attributes()).containsEntry("STUDY_ID", null)
                    .containsEntry("DATE", null)
                    .containsEntry("PARASITAEMIA", null);
            assertThat(record.issues())
                    .extracting(ValidationIssue::kind, ValidationIssue::attribute)
                    .containsExactly(
                            tuple(IssueKind.MISSING_REQUIRED_FIELD, "STUDY_ID"),
                            tuple(IssueKind.DATE_FORMAT_MISMATCH, "DATE"),
                            tuple(IssueKind.TYPE_MISMATCH, "PARASITAEMIA"));
            assertThat(result.issues()).hasSize(3);
        }

        @Test
        void issuesCarryLocationAndRawValue() {
            RawRow raw = row(7, "study_id", "S001", "parasitaemia_p/ul", "12.5");

            ValidationIssue issue = validator.validate(List.of(raw), STUDY).issues().get(0);

            assertThat(issue.location()).isEqualTo(SourceLocation.of(Path.of("test.csv"), 7));
            assertThat(issue.rawValue()).isEqualTo("12.5");
            assertThat(issue.detail()).contains("12.5");
        }
    }

    @Nested
    @DisplayName("Blank and absent values")
    class BlankValues {

        @Test
        void optionalBlankIsNullWithoutIssue() {
            RawRow raw = row(1, "study_id", "S001", "date", "   ", "parasitaemia_p/ul", null);

            ValidationResult result = validator.validate(List.of(raw), STUDY);

            assertThat(result.issues()).isEmpty();
            assertThat(result.records().get(0).get("DATE")).isNull();
        }

        @Test
        void absentRequiredColumnIsReportedAsAbsent() {
            RawRow raw = row(1, "date", "2024/03/01");

            ValidationIssue issue = validator.validate(List.of(raw), STUDY).issues().get(0);

            assertThat(issue.kind()).isEqualTo(IssueKind.MISSING_REQUIRED_FIELD);
            assertThat(issue.detail()).endsWith("is absent");
        }

        @Test
        void columnNamesMatchExactly() {
            RawRow raw = row(1, "Study_ID", "S001");

            assertThat(validator.validate(List.of(raw), STUDY).countOf(IssueKind.MISSING_REQUIRED_FIELD))
                    .isEqualTo(1);
        }

        @Test
        void undeclaredColumnsAreIgnored() {
            RawRow raw = row(1, "study_id", "S001", "freezer", "B4");

            ValidatedRecord record = validator.validate(List.of(raw), STUDY).records().get(0);

            assertThat(record.attributes()).doesNotContainKey("freezer");
            assertThat(record.isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Coercion of spreadsheet values")
    class Coercion {

        @Test
        void integralDoubleBecomesLong() {
            RawRow raw = row(1, "study_id", "S001", "parasitaemia_p/ul", 1200.0);

            assertThat(validator.validate(List.of(raw), STUDY).records().get(0).get("PARASITAEMIA"))
                    .isEqualTo(1200L);
        }

        @Test
        void fractionalDoubleIsTypeMismatchForInt() {
            RawRow raw = row(1, "study_id", "S001", "parasitaemia_p/ul", 12.5);

            assertThat(validator.validate(List.of(raw), STUDY).countOf(IssueKind.TYPE_MISMATCH)).isEqualTo(1);
        }

        @Test
        void numericIdentifierTextLosesTrailingZero() {
            RawRow raw = row(1, "study_id", 42.0);

            assertThat(validator.validate(List.of(raw), STUDY).records().get(0).get("STUDY_ID")).isEqualTo("42");
        }

        @Test
        void spreadsheetDatesPassThrough() {
            RawRow raw = row(1, "study_id", "S001", "date", LocalDateTime.of(2024, 3, 1, 9, 30));

            assertThat(validator.validate(List.of(raw), STUDY).records().get(0).get("DATE"))
                    .isEqualTo(LocalDate.of(2024, 3, 1));
        }

        @Test
        void floatAcceptsTextAndNumbers() {
            Schema schema = Schema.of("qc", List.of(FieldSpec.of("CONC", "conc", DataType.FLOAT)));

            ValidationResult result = validator.validate(
                    List.of(row(1, "conc", " 3.25 "), row(2, "conc", 7), row(3, "conc", "n/a")), schema);

            assertThat(result.records()).extracting(r -> r.get("CONC")).containsExactly(3.25, 7.0, null);
            assertThat(result.countOf(IssueKind.TYPE_MISMATCH)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Identifiers and row rules")
    class Identifiers {

        private final Schema samples = new SchemaParser().parse(schema("sample/samples.yml"), "sample", "sample");

        @Test
        void blankIdentifierIsMissingIdentifierAndNotReconcilable() {
            RawRow raw = row(1, "sample_id", " ", "study_id", "S001");

            ValidationResult result = validator.validate(List.of(raw), samples);

            assertThat(result.records().get(0).hasIssue(IssueKind.MISSING_IDENTIFIER)).isTrue();
            assertThat(result.records().get(0).hasIssue(IssueKind.MISSING_REQUIRED_FIELD)).isTrue();
            assertThat(result.records()).hasSize(1);
            assertThat(result.reconcilable()).isEmpty();
        }

        @Test
        void uniqueFieldFlagsRepeats() {
            ValidationResult result = validator.validate(
                    List.of(
                            row(1, "sample_id", "SMP001", "study_id", "S001"),
                            row(2, "sample_id", "SMP001", "study_id", "S001")),
                    samples);

            assertThat(result.records().get(0).isValid()).isTrue();
            assertThat(result.records().get(1).hasIssue(IssueKind.DUPLICATE_VALUE)).isTrue();
        }

        @Test
        void identifierOverrideMustBeDeclared() {
            assertThatThrownBy(() -> validator.validate(Stream.<RawRow>empty(), samples, "BARCODE"))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("'BARCODE' is not declared");
        }

        @Test
        void identifierOverrideMakesAttributeRequired() {
            RawRow raw = row(1, "sample_id", "SMP001", "study_id", "S001");

            ValidationResult result = validator.validate(Stream.of(raw), samples, "PARASITAEMIA");

            assertThat(result.records().get(0).hasIssue(IssueKind.MISSING_IDENTIFIER)).isTrue();
        }

        @Test
        void patternMismatchIsReported() {
            Schema schema = new SchemaParser().parse(schema("experimental/seqlib_expt.yml"), "seqlib-expt", null);

            ValidationResult result =
                    validator.validate(List.of(row(1, "expt_id", "XXJS034", "expt_rxns", "4")), schema);

            assertThat(result.issues()).extracting(ValidationIssue::kind).containsExactly(IssueKind.PATTERN_MISMATCH);
        }

        @Test
        void parseIssueBecomesMalformedRow() {
            RawRow raw = new RawRow(
                    Map.of("sample_id", "SMP001", "study_id", "S001"),
                    SourceLocation.of(Path.of("samples.csv"), 4),
                    "Row has 6 cells but the header declares 5");

            ValidatedRecord record = validator.validate(List.of(raw), samples).records().get(0);

            assertThat(record.issues()).extracting(ValidationIssue::kind).containsExactly(IssueKind.MALFORMED_ROW);
            assertThat(record.get("SAMPLE_ID")).isEqualTo("SMP001");
        }
    }
}

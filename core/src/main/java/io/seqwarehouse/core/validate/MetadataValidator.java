package io.seqwarehouse.core.validate;

import io.seqwarehouse.core.error.SchemaException;
import io.seqwarehouse.core.model.FieldSpec;
import io.seqwarehouse.core.model.IssueKind;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.model.ValidatedRecord;
import io.seqwarehouse.core.model.ValidationIssue;
import io.seqwarehouse.core.model.ValidationResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw rows into schema-typed records. Every row yields exactly one record; problems are
 * attached as {@link ValidationIssue}s and never abort the run.
 *
 * <p>
 * Per field, the raw value is looked up by exact source column name. A blank value is
 * {@code null}, and is an issue only when the field is required. Non-blank values are coerced to
 * the field's datatype; a failed coercion leaves the value {@code null} and records
 * {@link IssueKind#TYPE_MISMATCH} or {@link IssueKind#DATE_FORMAT_MISMATCH}. Raw columns the
 * schema does not declare are ignored.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class MetadataValidator {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataValidator.class);

    /** Validates rows using the schema's own identifier designation. */
    public ValidationResult validate(Stream<RawRow> rows, Schema schema) {
        return validate(rows.iterator(), schema, schema.identifierAttribute());
    }

    /** Validates rows using the schema's own identifier designation. */
    public ValidationResult validate(Iterable<RawRow> rows, Schema schema) {
        return validate(rows.iterator(), schema, schema.identifierAttribute());
    }

    /**
     * Validates rows, treating {@code identifierAttribute} as the identifier regardless of the
     * schema's designation.
     *
     * @param identifierAttribute attribute to use as identifier, or {@code null} for none
     * @throws SchemaException if the schema does not declare {@code identifierAttribute}
     */
    public ValidationResult validate(Stream<RawRow> rows, Schema schema, String identifierAttribute) {
        return validate(rows.iterator(), schema, identifierAttribute);
    }

    private ValidationResult validate(Iterator<RawRow> rows, Schema schema, String identifierAttribute) {
        if (identifierAttribute != null && schema.resolve(identifierAttribute) == null) {
            throw new SchemaException(
                    "Identifier attribute '" + identifierAttribute + "' is not declared by the schema",
                    schema.kind(),
                    null);
        }
        List<ValidatedRecord> records = new ArrayList<>();
        List<ValidationIssue> allIssues = new ArrayList<>();
        Map<String, Set<Object>> seenUnique = new HashMap<>();

        while (rows.hasNext()) {
            RawRow row = rows.next();
            ValidatedRecord record = validateRow(row, schema, identifierAttribute, seenUnique);
            records.add(record);
            allIssues.addAll(record.issues());
        }

        if (allIssues.isEmpty()) {
            LOG.info("Validated {} rows against schema '{}': no issues", records.size(), schema.kind());
        } else {
            LOG.info(
                    "Validated {} rows against schema '{}': {} issues in {} rows",
                    records.size(),
                    schema.kind(),
                    allIssues.size(),
                    records.stream().filter(r -> !r.isValid()).count());
        }
        return new ValidationResult(schema.kind(), records, allIssues);
    }

    private ValidatedRecord validateRow(
            RawRow row, Schema schema, String identifierAttribute, Map<String, Set<Object>> seenUnique) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        List<ValidationIssue> issues = new ArrayList<>();

        if (row.parseIssue() != null) {
            issues.add(new ValidationIssue(IssueKind.MALFORMED_ROW, null, null, row.parseIssue(), row.location()));
        }

        for (FieldSpec field : schema.fields()) {
            Object raw = row.get(field.sourceField());
            boolean required = field.required() || field.attributeName().equals(identifierAttribute);
            Object value = null;

            if (ValueCoercer.isBlank(raw)) {
                if (required) {
                    issues.add(new ValidationIssue(
                            IssueKind.MISSING_REQUIRED_FIELD,
                            field.attributeName(),
                            raw,
                            "Required column '" + field.sourceField() + "' is "
                                    + (row.has(field.sourceField()) ? "blank" : "absent"),
                            row.location()));
                }
            } else {
                ValueCoercer.Coerced coerced = ValueCoercer.coerce(raw, field);
                if (coerced.failed()) {
                    issues.add(new ValidationIssue(
                            coerced.failure(), field.attributeName(), raw, coerced.detail(), row.location()));
                } else {
                    value = coerced.value();
                    checkPattern(field, value, raw, row, issues);
                    checkUnique(field, value, raw, row, issues, seenUnique);
                }
            }
            attributes.put(field.attributeName(), value);
        }

        if (identifierAttribute != null && blankIdentifier(attributes.get(identifierAttribute))) {
            issues.add(new ValidationIssue(
                    IssueKind.MISSING_IDENTIFIER,
                    identifierAttribute,
                    row.get(schema.resolve(identifierAttribute).sourceField()),
                    "Row has no usable identifier; excluded from reconciliation",
                    row.location()));
        }

        if (!issues.isEmpty() && LOG.isDebugEnabled()) {
            issues.forEach(issue -> LOG.debug("{}: {}", schema.kind(), issue));
        }
        return new ValidatedRecord(schema.kind(), attributes, row.location(), issues);
    }

    private static void checkPattern(
            FieldSpec field, Object value, Object raw, RawRow row, List<ValidationIssue> issues) {
        if (field.pattern() == null) {
            return;
        }
        String text = value instanceof String s ? s : ValueCoercer.asText(raw);
        if (!field.pattern().matcher(text).matches()) {
            issues.add(new ValidationIssue(
                    IssueKind.PATTERN_MISMATCH,
                    field.attributeName(),
                    raw,
                    "'" + text + "' does not match pattern " + field.pattern().pattern(),
                    row.location()));
        }
    }

    private static void checkUnique(
            FieldSpec field,
            Object value,
            Object raw,
            RawRow row,
            List<ValidationIssue> issues,
            Map<String, Set<Object>> seenUnique) {
        if (!field.unique()) {
            return;
        }
        Set<Object> seen = seenUnique.computeIfAbsent(field.attributeName(), k -> new HashSet<>());
        if (!seen.add(value)) {
            issues.add(new ValidationIssue(
                    IssueKind.DUPLICATE_VALUE,
                    field.attributeName(),
                    raw,
                    "Value '" + value + "' already appeared in an earlier row",
                    row.location()));
        }
    }

    private static boolean blankIdentifier(Object value) {
        return value == null || value.toString().isBlank();
    }
}

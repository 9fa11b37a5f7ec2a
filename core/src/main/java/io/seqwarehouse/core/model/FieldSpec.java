package io.seqwarehouse.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One declared column of a schema. Immutable; created at load time by {@code SchemaParser}.
 *
 * <p>
 * Identifier fields are always required, whatever the descriptor says.
 *
 * @param attributeName stable internal key, e.g. {@code STUDY_ID}
 * @param sourceField   raw column name in the source file (exact case)
 * @param label         human-readable label
 * @param dataType      declared datatype
 * @param dateFormat    date format, present iff {@code dataType == DATE}
 * @param required      whether a blank value is a validation issue
 * @param identifier    whether this field joins records across table kinds
 * @param unique        whether values must not repeat within one table
 * @param pattern       optional regex the trimmed value must fully match
 */
public record FieldSpec(
        String attributeName,
        String sourceField,
        String label,
        DataType dataType,
        String dateFormat,
        boolean required,
        boolean identifier,
        boolean unique,
        Pattern pattern) {

    public FieldSpec {
        Objects.requireNonNull(attributeName, "attributeName must not be null");
        Objects.requireNonNull(sourceField, "sourceField must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        if (label == null) {
            label = attributeName;
        }
        if (identifier) {
            required = true;
        }
    }

    /** Convenience factory for a plain optional field. */
    public static FieldSpec of(String attributeName, String sourceField, DataType dataType) {
        return new FieldSpec(attributeName, sourceField, null, dataType, null, false, false, false, null);
    }

    /** Convenience factory for a date field. */
    public static FieldSpec date(String attributeName, String sourceField, String dateFormat) {
        return new FieldSpec(attributeName, sourceField, null, DataType.DATE, dateFormat, false, false, false, null);
    }

    public FieldSpec asRequired() {
        return new FieldSpec(
                attributeName, sourceField, label, dataType, dateFormat, true, identifier, unique, pattern);
    }

    public FieldSpec asIdentifier() {
        return new FieldSpec(attributeName, sourceField, label, dataType, dateFormat, true, true, unique, pattern);
    }
}

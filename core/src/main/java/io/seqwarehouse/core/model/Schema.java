package io.seqwarehouse.core.model;

import io.seqwarehouse.core.error.SchemaException;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable mapping of attribute name to {@link FieldSpec}, scoped to one data-source
 * kind. Thread-safe: loaded once and shared read-only.
 *
 * <p>
 * Construction through {@link #of} enforces the schema invariants: attribute names and source
 * fields are unique, date fields carry a date format, and at most one field is the identifier.
 */
public final class Schema {

    private final String kind;
    private final String category;
    private final Map<String, FieldSpec> fields;
    private final String identifierAttribute;

    private Schema(String kind, String category, Map<String, FieldSpec> fields, String identifierAttribute) {
        this.kind = kind;
        this.category = category;
        this.fields = fields;
        this.identifierAttribute = identifierAttribute;
    }

    /**
     * Builds a schema from fields in declaration order.
     *
     * @param kind     source kind, e.g. {@code seqlib} or {@code sample}
     * @param category category the kind belongs to, e.g. {@code experimental}; defaults to kind
     * @param fields   declared fields
     * @param source   descriptor path for error messages, may be null
     * @throws SchemaException if an invariant is violated
     */
    public static Schema of(String kind, String category, Collection<FieldSpec> fields, String source) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Map<String, FieldSpec> byAttribute = new LinkedHashMap<>();
        Set<String> sourceFields = new HashSet<>();
        String identifier = null;
        for (FieldSpec field : fields) {
            if (byAttribute.containsKey(field.attributeName())) {
                throw new SchemaException(
                        "Duplicate attribute name '" + field.attributeName() + "'", kind, source);
            }
            if (!sourceFields.add(field.sourceField())) {
                throw new SchemaException(
                        "Source field '" + field.sourceField() + "' is mapped by more than one attribute"
                                + " (second: '" + field.attributeName() + "')",
                        kind,
                        source);
            }
            if (field.dataType() == DataType.DATE
                    && (field.dateFormat() == null || field.dateFormat().isBlank())) {
                throw new SchemaException(
                        "Date field '" + field.attributeName() + "' requires a 'dateformat'", kind, source);
            }
            if (field.identifier()) {
                if (identifier != null) {
                    throw new SchemaException(
                            "Only one identifier field is allowed per schema, found '" + identifier + "' and '"
                                    + field.attributeName() + "'",
                            kind,
                            source);
                }
                identifier = field.attributeName();
            }
            byAttribute.put(field.attributeName(), field);
        }
        return new Schema(
                kind, category != null ? category : kind, Collections.unmodifiableMap(byAttribute), identifier);
    }

    /** Convenience overload for synthetic schemas built in code. */
    public static Schema of(String kind, List<FieldSpec> fields) {
        return of(kind, kind, fields, null);
    }

    public String kind() {
        return kind;
    }

    public String category() {
        return category;
    }

    /**
     * Looks up a field by attribute name.
     *
     * @return the field, or {@code null} if the schema does not declare it
     */
    public FieldSpec resolve(String attributeName) {
        return fields.get(attributeName);
    }

    /** Looks up a field by its raw source column name, or {@code null}. */
    public FieldSpec resolveBySourceField(String sourceField) {
        for (FieldSpec field : fields.values()) {
            if (field.sourceField().equals(sourceField)) {
                return field;
            }
        }
        return null;
    }

    /** Fields in declaration order. */
    public Collection<FieldSpec> fields() {
        return fields.values();
    }

    public Set<String> attributeNames() {
        return fields.keySet();
    }

    /** The designated identifier attribute, or {@code null} if none is declared. */
    public String identifierAttribute() {
        return identifierAttribute;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "Schema[" + kind + ", fields=" + fields.size() + "]";
    }
}

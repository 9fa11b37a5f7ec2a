package io.seqwarehouse.core.reconcile;

import io.seqwarehouse.core.model.Cardinality;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.model.ValidatedRecord;
import io.seqwarehouse.core.model.ValidationResult;
import java.util.List;
import java.util.Objects;

/**
 * One validated table taking part in reconciliation.
 *
 * @param records             validated records in source order
 * @param identifierAttribute attribute holding the join identifier
 * @param cardinality         whether one or many records per identifier are expected
 * @param primary             whether the table's identifiers define the set of output records
 * @param category            category used for precedence when the kind itself is not ranked,
 *                            may be null
 */
public record TableInput(
        List<ValidatedRecord> records,
        String identifierAttribute,
        Cardinality cardinality,
        boolean primary,
        String category) {

    public TableInput {
        records = List.copyOf(records);
        Objects.requireNonNull(identifierAttribute, "identifierAttribute must not be null");
        Objects.requireNonNull(cardinality, "cardinality must not be null");
    }

    /** A primary, one-per-identifier table. */
    public static TableInput one(List<ValidatedRecord> records, String identifierAttribute) {
        return new TableInput(records, identifierAttribute, Cardinality.ONE, true, null);
    }

    /** A primary table with many records per identifier. */
    public static TableInput many(List<ValidatedRecord> records, String identifierAttribute) {
        return new TableInput(records, identifierAttribute, Cardinality.MANY, true, null);
    }

    /**
     * Builds an input from a validation result, keeping only records that carry an identifier. The
     * category is left unset; {@link io.seqwarehouse.core.engine.WarehouseEngine#reconcile} fills it
     * from the registered schema.
     */
    public static TableInput of(ValidationResult result, String identifierAttribute, Cardinality cardinality) {
        return new TableInput(result.reconcilable(), identifierAttribute, cardinality, true, null);
    }

    /**
     * Builds an input from a validation result against {@code schema}, joining on the schema's
     * identifier attribute and ranking by its category.
     */
    public static TableInput of(ValidationResult result, Schema schema, Cardinality cardinality) {
        return new TableInput(
                result.reconcilable(), schema.identifierAttribute(), cardinality, true, schema.category());
    }

    public TableInput asSecondary() {
        return new TableInput(records, identifierAttribute, cardinality, false, category);
    }

    public TableInput withCategory(String value) {
        return new TableInput(records, identifierAttribute, cardinality, primary, value);
    }
}

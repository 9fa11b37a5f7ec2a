package io.seqwarehouse.core.export;

import io.seqwarehouse.core.model.FieldSpec;

/** Which name of a field heads its column in a canonical export. */
public enum HeaderStyle {
    /** The source column name; the export can be loaded and validated again with the same schema. */
    FIELD,
    /** The human-readable label. */
    LABEL,
    /** The internal attribute name. */
    ATTRIBUTE;

    public String headerOf(FieldSpec field) {
        switch (this) {
            case FIELD:
                return field.sourceField();
            case LABEL:
                return field.label();
            default:
                return field.attributeName();
        }
    }
}

package io.seqwarehouse.core.model;

import java.util.Locale;

/**
 * Declared datatype of a schema field. Coerced values are {@link String}, {@link Long},
 * {@link Double} and {@link java.time.LocalDate} respectively.
 */
public enum DataType {
    STR("str"),
    INT("int"),
    FLOAT("float"),
    DATE("date");

    private final String descriptorName;

    DataType(String descriptorName) {
        this.descriptorName = descriptorName;
    }

    /** The spelling used in schema descriptor files. */
    public String descriptorName() {
        return descriptorName;
    }

    /**
     * Resolves a descriptor spelling (case-insensitive).
     *
     * @param name descriptor value, e.g. {@code "int"}
     * @return the datatype, or {@code null} if the name is not recognised
     */
    public static DataType fromDescriptor(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.descriptorName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}

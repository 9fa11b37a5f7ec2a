package io.seqwarehouse.core.model;

/** How many records of one table kind may share an identifier value. */
public enum Cardinality {
    ONE,
    MANY
}

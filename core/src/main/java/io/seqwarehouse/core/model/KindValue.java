package io.seqwarehouse.core.model;

/**
 * A value contributed by one table kind, as reported on a conflict.
 *
 * @param tableKind contributing table kind
 * @param value     typed value
 */
public record KindValue(String tableKind, Object value) {

    @Override
    public String toString() {
        return tableKind + "=" + value;
    }
}

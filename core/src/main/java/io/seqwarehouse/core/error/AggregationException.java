package io.seqwarehouse.core.error;

/** Thrown when the aggregation destination cannot be created or written. */
public final class AggregationException extends WarehouseProcessingException {

    private static final long serialVersionUID = 1L;

    public AggregationException(String message, String source) {
        super(message, source);
    }

    public AggregationException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

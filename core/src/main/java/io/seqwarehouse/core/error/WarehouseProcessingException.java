package io.seqwarehouse.core.error;

/**
 * Abstract parent for errors raised while processing data sources or copying artifacts. Callers
 * catch these per source or per target and carry on with the rest of the batch.
 */
public abstract class WarehouseProcessingException extends WarehouseException {

    private static final long serialVersionUID = 1L;

    protected WarehouseProcessingException(String message, String source) {
        super(message, source, Phase.PROCESSING);
    }

    protected WarehouseProcessingException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.PROCESSING);
    }
}

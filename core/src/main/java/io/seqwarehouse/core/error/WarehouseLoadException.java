package io.seqwarehouse.core.error;

/**
 * Abstract parent for load-time configuration errors: schema descriptors, target descriptors and
 * the warehouse configuration file. These are fatal and abort a run before any data is processed.
 */
public abstract class WarehouseLoadException extends WarehouseException {

    private static final long serialVersionUID = 1L;

    protected WarehouseLoadException(String message, String source) {
        super(message, source, Phase.LOAD);
    }

    protected WarehouseLoadException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.LOAD);
    }
}

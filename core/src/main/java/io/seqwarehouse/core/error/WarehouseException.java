package io.seqwarehouse.core.error;

/**
 * Abstract base for all seq-warehouse exceptions. Never thrown directly; use the concrete
 * subclasses under {@link WarehouseLoadException} or {@link WarehouseProcessingException}.
 */
public abstract class WarehouseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        PROCESSING
    }

    private final String source;
    private final Phase phase;

    protected WarehouseException(String message, String source, Phase phase) {
        super(message);
        this.source = source;
        this.phase = phase;
    }

    protected WarehouseException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause);
        this.source = source;
        this.phase = phase;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

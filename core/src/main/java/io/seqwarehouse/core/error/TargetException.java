package io.seqwarehouse.core.error;

/** Thrown when a target descriptor file has invalid syntax or an incomplete target entry. */
public final class TargetException extends WarehouseLoadException {

    private static final long serialVersionUID = 1L;

    public TargetException(String message, String source) {
        super(message, source);
    }

    public TargetException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

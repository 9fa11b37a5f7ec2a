package io.seqwarehouse.core.error;

/**
 * Thrown when one input file cannot be opened, is corrupt, or lacks a required sheet. The file's
 * contribution is dropped; the rest of the run continues.
 */
public final class SourceUnreadableException extends WarehouseProcessingException {

    private static final long serialVersionUID = 1L;

    public SourceUnreadableException(String message, String source) {
        super(message, source);
    }

    public SourceUnreadableException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

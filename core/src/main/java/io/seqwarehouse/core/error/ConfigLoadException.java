package io.seqwarehouse.core.error;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or an invalid value.
 * Provides a descriptive message suitable for startup error output.
 */
public final class ConfigLoadException extends WarehouseLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}

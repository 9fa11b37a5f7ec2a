package io.seqwarehouse.core.error;

/** Thrown when a schema descriptor is malformed, has colliding names or an incomplete field. */
public final class SchemaException extends WarehouseLoadException {

    private static final long serialVersionUID = 1L;

    private final String schemaKind;

    public SchemaException(String message, String schemaKind, String source) {
        super(message, source);
        this.schemaKind = schemaKind;
    }

    public SchemaException(String message, Throwable cause, String schemaKind, String source) {
        super(message, cause, source);
        this.schemaKind = schemaKind;
    }

    /** The source kind whose schema failed to load, or {@code null} if not yet identified. */
    public String schemaKind() {
        return schemaKind;
    }
}

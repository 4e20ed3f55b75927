package io.segmentnav.core.error;

/**
 * Thrown when a schema definition cannot be loaded: unreadable or malformed YAML, a document that
 * violates the definition schema, an unknown node kind or duplicate node names. Carries the schema
 * id (when already known) and the {@code source} the definition was read from.
 */
public final class SchemaLoadException extends NavigationException {

    private static final long serialVersionUID = 1L;

    private final String schemaId;
    private final String source;

    public SchemaLoadException(String message, String schemaId, String source) {
        super(message, null, Phase.LOAD);
        this.schemaId = schemaId;
        this.source = source;
    }

    public SchemaLoadException(String message, Throwable cause, String schemaId, String source) {
        super(message, cause, cause instanceof NavigationException ne ? ne.nodeName() : null, Phase.LOAD);
        this.schemaId = schemaId;
        this.source = source;
    }

    /** The schema identifier, or {@code null} if the definition failed before it was read. */
    public String schemaId() {
        return schemaId;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}

package io.typedrecord.core.error;

/** Thrown when a schema definition document has invalid syntax, unknown keys or missing required fields. */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String schemaName, String source) {
        super(message, schemaName, source);
    }

    public SchemaParseException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, source);
    }
}

package io.typedrecord.core.error;

/**
 * Abstract parent for schema authoring errors. Thrown while descriptors are parsed or schema
 * definition documents are loaded. Carries an additional {@code source} field identifying the
 * descriptor text, file or resource that caused the error.
 */
public abstract class SchemaLoadException extends TypedRecordException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String schemaName, String source) {
        super(message, schemaName, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, Phase.LOAD);
        this.source = source;
    }

    /** The descriptor text, file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}

package io.typedrecord.core.error;

/**
 * Abstract base for all typed-record exceptions. Never thrown directly; use the concrete
 * subclasses under {@link SchemaLoadException} or {@link RecordValidationException}.
 *
 * <p>
 * Validation failures are normally reported as {@link io.typedrecord.core.model.ValidationResult}
 * values; exceptions are reserved for schema authoring errors and for callers that explicitly
 * opt into throwing construction.
 */
public abstract class TypedRecordException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        VALIDATION
    }

    private final String schemaName;
    private final Phase phase;

    protected TypedRecordException(String message, String schemaName, Phase phase) {
        super(message);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    protected TypedRecordException(String message, Throwable cause, String schemaName, Phase phase) {
        super(message, cause);
        this.schemaName = schemaName;
        this.phase = phase;
    }

    /** The schema that triggered the error, or {@code null} if not yet identified. */
    public String schemaName() {
        return schemaName;
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

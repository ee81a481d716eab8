package io.typedrecord.core.error;

/**
 * Abstract parent for record-level validation errors surfaced as exceptions. Carries an
 * additional {@code field} naming the first offending field, when one is known.
 */
public abstract class RecordValidationException extends TypedRecordException {

    private static final long serialVersionUID = 1L;

    private final String field;

    protected RecordValidationException(String message, String schemaName, String field) {
        super(message, schemaName, Phase.VALIDATION);
        this.field = field;
    }

    protected RecordValidationException(String message, Throwable cause, String schemaName, String field) {
        super(message, cause, schemaName, Phase.VALIDATION);
        this.field = field;
    }

    /** The offending field, or {@code null} for record-wide failures (e.g. an empty schema). */
    public String field() {
        return field;
    }
}

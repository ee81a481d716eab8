package io.typedrecord.core.error;

import io.typedrecord.core.model.ValidationResult;
import io.typedrecord.core.model.Violation;

/**
 * Thrown by {@code ValidatedRecord.createOrThrow} when the initial data fails validation. The
 * plain constructor never throws; it leaves the record empty in the {@code REJECTED} state.
 */
public final class ConstructionRejectedException extends RecordValidationException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationResult result;

    public ConstructionRejectedException(String schemaName, ValidationResult result) {
        super(buildMessage(schemaName, result), schemaName, fieldOf(result));
        this.result = result;
    }

    /** The failed validation result that caused the rejection. */
    public ValidationResult result() {
        return result;
    }

    private static String buildMessage(String schemaName, ValidationResult result) {
        Violation first = result.firstViolation();
        String detail = first != null ? first.message() : "validation failed";
        return "Construction of '" + schemaName + "' rejected: " + detail;
    }

    private static String fieldOf(ValidationResult result) {
        Violation first = result.firstViolation();
        return first != null ? first.field() : null;
    }
}

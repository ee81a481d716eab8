package io.typedrecord.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single validation failure with enough context to locate it.
 *
 * @param kind      failure classification
 * @param field     offending top-level field, or {@code null} for {@link ViolationKind#EMPTY_SCHEMA}
 * @param path      location of the failing value, e.g. {@code tags[1]}; equals {@code field} for
 *                  top-level failures
 * @param expected  descriptor text expected at {@code path}, or {@code null} when not applicable
 * @param actual    runtime kind name of the value found at {@code path}, or {@code null}
 * @param neighbors a few surrounding fields of the data, rendered for display; never null
 */
public record Violation(
        ViolationKind kind, String field, String path, String expected, String actual, Map<String, String> neighbors) {

    public Violation {
        Objects.requireNonNull(kind, "kind must not be null");
        neighbors = neighbors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(neighbors));
    }

    public static Violation emptySchema() {
        return new Violation(ViolationKind.EMPTY_SCHEMA, null, null, null, null, Map.of());
    }

    /** Human-readable description, stable for a given violation. */
    public String message() {
        return switch (kind) {
            case EMPTY_SCHEMA -> "Empty schema: nothing to validate against";
            case MISSING_FIELD -> "Missing field '" + field + "' (expected " + expected + ")";
            case TYPE_MISMATCH -> "Type mismatch for field '" + field + "'"
                    + (path != null && !path.equals(field) ? " at " + path : "")
                    + ": expected " + expected + ", got " + actual;
            case UNEXPECTED_FIELD -> "Unexpected field '" + field + "' in strict mode";
            case CONSTRUCTION_REJECTED -> "Construction rejected"
                    + (field != null ? " at field '" + field + "'" : "");
        };
    }
}

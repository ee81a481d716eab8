package io.typedrecord.core.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating a record against a schema: a pass/fail flag plus the violations found.
 * Default validation stops at the first violation, so failed results usually carry exactly one.
 *
 * @param valid      true if no violation was found
 * @param violations violations in discovery order; empty when valid
 */
public record ValidationResult(boolean valid, List<Violation> violations) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, Collections.emptyList());

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    /** The shared success result. */
    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(Violation violation) {
        return new ValidationResult(false, List.of(violation));
    }

    public static ValidationResult failure(List<Violation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("a failed result needs at least one violation");
        }
        return new ValidationResult(false, violations);
    }

    /** The first violation, or {@code null} when valid. */
    public Violation firstViolation() {
        return violations.isEmpty() ? null : violations.get(0);
    }

    /** Message of the first violation, or {@code "valid"}. */
    public String summary() {
        Violation first = firstViolation();
        return first == null ? "valid" : first.message();
    }
}

package io.typedrecord.core.model;

/**
 * Enforcement policy for record validation.
 *
 * <ul>
 * <li>{@link #STRICT}: the record's keys must equal the schema's keys. A failed mutation is
 * rolled back to the last valid state.</li>
 * <li>{@link #LOOSE}: undeclared keys are allowed. Declared keys must still match, but a failed
 * mutation is kept and only reported as a warning.</li>
 * </ul>
 */
public enum ValidationMode {
    /** Exact key-set match; failed writes are reverted. */
    STRICT,

    /** Extra keys permitted; failed writes are kept with a warning. */
    LOOSE
}

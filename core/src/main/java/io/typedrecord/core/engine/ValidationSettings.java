package io.typedrecord.core.engine;

import io.typedrecord.core.model.ValidationMode;
import java.util.Objects;

/**
 * Engine-wide validation settings.
 *
 * <ul>
 * <li>{@code enabled}: when false, record validation is a no-op that always succeeds (the
 * production escape hatch). Structural {@code check} calls are unaffected.</li>
 * <li>{@code defaultMode}: mode used by record constructors that do not name one.</li>
 * <li>{@code neighborExcerpt}: how many neighboring fields on each side of a failing field are
 * copied into a violation for display; 0 disables the excerpt.</li>
 * </ul>
 *
 * @param enabled         whether record validation runs at all
 * @param defaultMode     mode used when none is given
 * @param neighborExcerpt fields on each side of the failing one to include in diagnostics
 */
public record ValidationSettings(boolean enabled, ValidationMode defaultMode, int neighborExcerpt) {

    /** Validation on, loose by default, two neighbors on each side. */
    public static final ValidationSettings DEFAULT = new ValidationSettings(true, ValidationMode.LOOSE, 2);

    /** Validation off. */
    public static final ValidationSettings PRODUCTION = new ValidationSettings(false, ValidationMode.LOOSE, 0);

    public ValidationSettings {
        Objects.requireNonNull(defaultMode, "defaultMode must not be null");
        if (neighborExcerpt < 0) {
            throw new IllegalArgumentException("neighborExcerpt must be >= 0, got: " + neighborExcerpt);
        }
    }

    public ValidationSettings withEnabled(boolean enabled) {
        return new ValidationSettings(enabled, defaultMode, neighborExcerpt);
    }

    public ValidationSettings withDefaultMode(ValidationMode defaultMode) {
        return new ValidationSettings(enabled, defaultMode, neighborExcerpt);
    }

    public ValidationSettings withNeighborExcerpt(int neighborExcerpt) {
        return new ValidationSettings(enabled, defaultMode, neighborExcerpt);
    }
}

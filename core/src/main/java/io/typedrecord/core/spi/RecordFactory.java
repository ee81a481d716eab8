package io.typedrecord.core.spi;

import io.typedrecord.core.engine.TypeValidator;
import io.typedrecord.core.engine.ValidatedRecord;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.ValidationMode;
import java.util.Map;

/**
 * Constructor collaborator registered alongside a {@link RecordType}. Used to build nested
 * records when a raw mapping is stored in a field typed with a schema reference.
 *
 * <p>
 * The validator is passed explicitly so that nested records share their parent's registry,
 * diagnostic sink and settings.
 */
@FunctionalInterface
public interface RecordFactory {

    /**
     * Creates a record of the registered type.
     *
     * @param validator   the validator the new record delegates to
     * @param initialData the raw field values
     * @param mode        the enforcement mode
     * @return the new record; check {@link ValidatedRecord#state()} for rejection
     */
    ValidatedRecord create(TypeValidator validator, Map<String, Object> initialData, ValidationMode mode);

    /** Factory producing plain {@link ValidatedRecord} instances of {@code type}. */
    static RecordFactory of(RecordType type) {
        return (validator, initialData, mode) -> new ValidatedRecord(validator, type, initialData, mode);
    }
}

package io.typedrecord.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named schema: the fixed base fields authored by the schema's owner plus an extension store
 * that plugins may grow at runtime.
 *
 * <p>
 * The effective schema is always {@code base ∪ extension}, extension fields taking precedence
 * on key collision. Every record built from the same {@code RecordType} instance shares its
 * extension store, so {@link #extend} retroactively changes what later validations of those
 * records check.
 *
 * <p>
 * Thread-safe: the extension is an immutable {@link Schema} swapped atomically.
 */
public final class RecordType {

    private final String name;
    private final String description;
    private final Schema baseSchema;
    private final boolean extendable;
    private final AtomicReference<Schema> extension = new AtomicReference<>(Schema.empty());

    /**
     * @param name        schema name, referenced from descriptors of other schemas
     * @param description free-text description, may be null
     * @param baseSchema  the owner-authored fields
     * @param extendable  whether {@link #extend} is permitted
     */
    public RecordType(String name, String description, Schema baseSchema, boolean extendable) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("record type name must not be null or empty");
        }
        this.name = name;
        this.description = description;
        this.baseSchema = Objects.requireNonNull(baseSchema, "baseSchema must not be null");
        this.extendable = extendable;
    }

    /** Creates an extendable type without description. */
    public static RecordType of(String name, Schema baseSchema) {
        return new RecordType(name, null, baseSchema, true);
    }

    /** Creates an extendable type from descriptor strings. */
    public static RecordType of(String name, Map<String, String> baseDescriptors) {
        return new RecordType(name, null, Schema.of(baseDescriptors), true);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Schema baseSchema() {
        return baseSchema;
    }

    public boolean extendable() {
        return extendable;
    }

    /** Fields added at runtime, empty until the first {@link #extend} call. */
    public Schema extensionSchema() {
        return extension.get();
    }

    /** Base merged with extension; extension wins on collision. */
    public Schema effectiveSchema() {
        return baseSchema.merge(extension.get());
    }

    /** True if {@code field} is declared in the base schema. */
    public boolean isBaseField(String field) {
        return baseSchema.has(field);
    }

    /**
     * Merges {@code extraFields} into the extension store. A field already present in the
     * extension is replaced.
     *
     * @throws IllegalStateException if this type is not extendable
     */
    public void extend(Schema extraFields) {
        Objects.requireNonNull(extraFields, "extraFields must not be null");
        if (!extendable) {
            throw new IllegalStateException("Record type '" + name + "' is not extendable");
        }
        extension.updateAndGet(current -> current.merge(extraFields));
    }

    /** Parses {@code extraFields} descriptors and merges them into the extension store. */
    public void extend(Map<String, String> extraFields) {
        extend(Schema.of(extraFields));
    }

    @Override
    public String toString() {
        return "RecordType{" + name + ", base=" + baseSchema.size() + " fields, extension="
                + extension.get().size() + " fields}";
    }
}

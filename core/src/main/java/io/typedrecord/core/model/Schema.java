package io.typedrecord.core.model;

import io.typedrecord.core.spec.DescriptorParser;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from field name to {@link TypeDescriptor}, kept in declaration order so that
 * validation walks (and reports) fields deterministically.
 *
 * <p>
 * Field names must be non-empty and must not collide with {@link #NAMESPACE_FIELD}, which is
 * reserved for per-owner side-channel data on records.
 */
public final class Schema {

    /** Reserved record field holding namespaced side-channel data; never schema-checked. */
    public static final String NAMESPACE_FIELD = "_mod_data";

    private static final Schema EMPTY = new Schema(Map.of());

    private final Map<String, TypeDescriptor> fields;

    private Schema(Map<String, TypeDescriptor> fields) {
        this.fields = fields;
    }

    /** Returns the schema with no fields. */
    public static Schema empty() {
        return EMPTY;
    }

    /**
     * Builds a schema from field names and descriptor strings, parsing each descriptor.
     *
     * @param descriptors field name to descriptor text, iteration order is kept
     * @return the parsed schema
     * @throws io.typedrecord.core.error.DescriptorParseException if a descriptor is malformed
     * @throws IllegalArgumentException if a field name is empty or reserved
     */
    public static Schema of(Map<String, String> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        Builder builder = builder();
        descriptors.forEach(builder::field);
        return builder.build();
    }

    /**
     * Returns a new {@link Builder} for constructing a schema incrementally.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Descriptor for {@code field}, or {@code null} if the field is not declared. */
    public TypeDescriptor descriptor(String field) {
        return fields.get(field);
    }

    /** True if {@code field} is declared. */
    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /** Declared field names in declaration order. */
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /** Unmodifiable view of all fields in declaration order. */
    public Map<String, TypeDescriptor> fields() {
        return fields;
    }

    /** Field names mapped to canonical descriptor text, in declaration order. */
    public Map<String, String> toDescriptorMap() {
        Map<String, String> out = new LinkedHashMap<>();
        fields.forEach((name, descriptor) -> out.put(name, descriptor.text()));
        return out;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns the union of this schema and {@code other}. Fields of {@code other} win on key
     * collision; new fields are appended after this schema's fields.
     */
    public Schema merge(Schema other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, TypeDescriptor> merged = new LinkedHashMap<>(fields);
        merged.putAll(other.fields);
        return new Schema(Collections.unmodifiableMap(merged));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Schema" + toDescriptorMap();
    }

    /** Builder for {@link Schema}. Later declarations of the same field replace earlier ones. */
    public static final class Builder {

        private final Map<String, TypeDescriptor> fields = new LinkedHashMap<>();

        Builder() {}

        /**
         * Declares a field from descriptor text.
         *
         * @throws io.typedrecord.core.error.DescriptorParseException if the descriptor is malformed
         */
        public Builder field(String name, String descriptor) {
            return field(name, DescriptorParser.parse(descriptor));
        }

        /** Declares a field from an already-parsed descriptor. */
        public Builder field(String name, TypeDescriptor descriptor) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("field name must not be null or empty");
            }
            if (NAMESPACE_FIELD.equals(name)) {
                throw new IllegalArgumentException("field name '" + NAMESPACE_FIELD + "' is reserved");
            }
            fields.put(name, Objects.requireNonNull(descriptor, "descriptor must not be null"));
            return this;
        }

        public Schema build() {
            if (fields.isEmpty()) {
                return EMPTY;
            }
            return new Schema(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}

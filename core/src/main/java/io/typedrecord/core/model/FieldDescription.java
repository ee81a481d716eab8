package io.typedrecord.core.model;

import java.util.Objects;

/**
 * Read-only description of one field of a record type.
 *
 * @param name        field name
 * @param descriptor  canonical descriptor text, e.g. {@code Array<Item>?}
 * @param nullable    whether the descriptor carries {@code ?}
 * @param array       whether the descriptor is an array
 * @param elementType element descriptor text for arrays, {@code null} otherwise
 * @param origin      whether the field comes from the base schema or a runtime extension
 */
public record FieldDescription(
        String name, String descriptor, boolean nullable, boolean array, String elementType, Origin origin) {

    /** Where a field was declared. */
    public enum Origin {
        BASE,
        EXTENSION
    }

    public FieldDescription {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }

    /** Describes {@code descriptor} as declared for {@code name}. */
    public static FieldDescription of(String name, TypeDescriptor descriptor, Origin origin) {
        String elementType = descriptor instanceof TypeDescriptor.ArrayOf array ? array.element().text() : null;
        return new FieldDescription(
                name, descriptor.text(), descriptor.nullable(), elementType != null, elementType, origin);
    }

    public boolean isBaseField() {
        return origin == Origin.BASE;
    }
}

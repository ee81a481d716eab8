package io.typedrecord.core.model;

import io.typedrecord.core.engine.ValidatedRecord;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Closed set of runtime value kinds understood by the validator, with a total mapping to the
 * display names used in descriptors and diagnostics.
 *
 * <p>
 * The scalar kinds ({@link #BOOL}, {@link #INT}, {@link #FLOAT}, {@link #STRING},
 * {@link #OBJECT}) are the primitive names a descriptor may use. {@code int} versus {@code float}
 * is a representational distinction only: no range or overflow checks are applied.
 */
public enum ValueKind {
    NIL("null"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("String"),
    ARRAY("Array"),
    DICTIONARY("Dictionary"),
    RECORD("Record"),
    OBJECT("Object");

    private static final Set<ValueKind> PRIMITIVES = Set.of(BOOL, INT, FLOAT, STRING, OBJECT);

    private final String displayName;

    ValueKind(String displayName) {
        this.displayName = displayName;
    }

    /** The name used in descriptors and diagnostics (e.g. {@code "int"}, {@code "String"}). */
    public String displayName() {
        return displayName;
    }

    /** True for kinds that a bare descriptor identifier may name. */
    public boolean isPrimitive() {
        return PRIMITIVES.contains(this);
    }

    /**
     * Classifies a runtime value. Total: every value, including {@code null}, maps to exactly one
     * kind.
     */
    public static ValueKind of(Object value) {
        if (value == null) {
            return NIL;
        }
        if (value instanceof Boolean) {
            return BOOL;
        }
        if (value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof AtomicInteger
                || value instanceof AtomicLong) {
            return INT;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return FLOAT;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return STRING;
        }
        if (value instanceof ValidatedRecord) {
            return RECORD;
        }
        if (value instanceof Map) {
            return DICTIONARY;
        }
        if (value instanceof Collection && !(value instanceof Set)) {
            return ARRAY;
        }
        if (value.getClass().isArray()) {
            return ARRAY;
        }
        return OBJECT;
    }

    /**
     * Returns the kind name reported for a value. Records report their schema name instead of the
     * generic {@code "Record"}.
     */
    public static String nameOf(Object value) {
        if (value instanceof ValidatedRecord record) {
            return record.schemaName();
        }
        return of(value).displayName();
    }

    /**
     * Looks up a primitive kind by display name: exact match first, then case-insensitive.
     *
     * @param name the identifier as written in a descriptor
     * @return the primitive kind, or empty if the name is not a primitive
     */
    public static Optional<ValueKind> primitiveNamed(String name) {
        for (ValueKind kind : values()) {
            if (kind.isPrimitive() && kind.displayName.equals(name)) {
                return Optional.of(kind);
            }
        }
        for (ValueKind kind : values()) {
            if (kind.isPrimitive() && kind.displayName.equalsIgnoreCase(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

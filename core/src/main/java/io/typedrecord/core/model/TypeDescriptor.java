package io.typedrecord.core.model;

import java.util.Objects;

/**
 * Parsed form of a type descriptor string such as {@code "int"}, {@code "float?"},
 * {@code "Array<String>"} or {@code "Item?"}.
 *
 * <p>
 * Implementations are a sealed hierarchy: after stripping the optional nullable marker a
 * descriptor is exactly one of a primitive, the {@code Variant} wildcard, an array of another
 * descriptor, the untyped {@code Dictionary}, or a reference to a named schema. Instances are
 * produced by {@link io.typedrecord.core.spec.DescriptorParser}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface TypeDescriptor {

    /** Suffix that marks a descriptor as nullable. */
    String NULLABLE_SUFFIX = "?";

    /** True if {@code null} (or an absent field) satisfies this descriptor. */
    boolean nullable();

    /** Canonical descriptor text; parsing it yields an equal descriptor. */
    String text();

    /** Returns this descriptor with the nullable flag removed. */
    TypeDescriptor nonNull();

    private static String suffix(boolean nullable) {
        return nullable ? NULLABLE_SUFFIX : "";
    }

    /**
     * A scalar kind named by {@code name}. The author's spelling is kept so that the validator's
     * case-insensitive fallback can apply.
     */
    record Primitive(String name, boolean nullable) implements TypeDescriptor {
        public Primitive {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String text() {
            return name + suffix(nullable);
        }

        @Override
        public TypeDescriptor nonNull() {
            return nullable ? new Primitive(name, false) : this;
        }
    }

    /** {@code Variant}: any non-null value. */
    record Any(boolean nullable) implements TypeDescriptor {
        public static final String NAME = "Variant";

        @Override
        public String text() {
            return NAME + suffix(nullable);
        }

        @Override
        public TypeDescriptor nonNull() {
            return nullable ? new Any(false) : this;
        }
    }

    /** {@code Array<T>}: a sequence whose every element satisfies {@code element}. */
    record ArrayOf(TypeDescriptor element, boolean nullable) implements TypeDescriptor {
        public static final String PREFIX = "Array<";

        public ArrayOf {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String text() {
            return PREFIX + element.text() + ">" + suffix(nullable);
        }

        @Override
        public TypeDescriptor nonNull() {
            return nullable ? new ArrayOf(element, false) : this;
        }
    }

    /** {@code Dictionary}: any key/value mapping, contents unchecked. */
    record Dictionary(boolean nullable) implements TypeDescriptor {
        public static final String NAME = "Dictionary";

        @Override
        public String text() {
            return NAME + suffix(nullable);
        }

        @Override
        public TypeDescriptor nonNull() {
            return nullable ? new Dictionary(false) : this;
        }
    }

    /** Reference to a named schema, resolved through the schema registry at check time. */
    record SchemaRef(String schemaName, boolean nullable) implements TypeDescriptor {
        public SchemaRef {
            Objects.requireNonNull(schemaName, "schemaName must not be null");
        }

        @Override
        public String text() {
            return schemaName + suffix(nullable);
        }

        @Override
        public TypeDescriptor nonNull() {
            return nullable ? new SchemaRef(schemaName, false) : this;
        }
    }
}

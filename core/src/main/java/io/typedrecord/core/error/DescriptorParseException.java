package io.typedrecord.core.error;

/** Thrown when a type descriptor string is malformed (unbalanced {@code Array<...>}, stray characters). */
public final class DescriptorParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public DescriptorParseException(String message, String schemaName, String source) {
        super(message, schemaName, source);
    }

    public DescriptorParseException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, source);
    }
}

package io.typedrecord.core.model;

/** Classification of a validation failure. */
public enum ViolationKind {
    /** The schema declares no fields; validating against it always fails. */
    EMPTY_SCHEMA,
    /** A declared, non-nullable field is absent from the data. */
    MISSING_FIELD,
    /** A present field's value does not structurally match its descriptor. */
    TYPE_MISMATCH,
    /** A data key not declared in the schema (strict mode only). */
    UNEXPECTED_FIELD,
    /** The initial data of a record failed validation. */
    CONSTRUCTION_REJECTED
}

package io.typedrecord.core.model;

/** Observable validation state of a record. */
public enum RecordState {
    /** The last committed state passed validation. */
    VALID,
    /** Loose mode only: the last write failed validation but was kept. */
    TAINTED,
    /** The initial data was rejected; the record holds no data. */
    REJECTED
}

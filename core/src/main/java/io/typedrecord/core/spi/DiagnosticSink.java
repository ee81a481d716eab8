package io.typedrecord.core.spi;

import io.typedrecord.core.model.ViolationKind;

/**
 * SPI for receiving validation diagnostics.
 *
 * <p>
 * The validator and records report every failure here without owning formatting or output
 * destination. Reporting is fire-and-forget: exceptions thrown by a sink are caught and logged by
 * the caller and never change the outcome of a validation or mutation.
 *
 * <p>
 * Implementations shared between threads must be thread-safe.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /** A sink that discards everything. */
    DiagnosticSink NOOP = diagnostic -> {};

    /**
     * Called once per reported problem.
     *
     * @param diagnostic the structured event, never null
     */
    void report(Diagnostic diagnostic);

    /** Diagnostic severity. */
    enum Severity {
        WARNING,
        ERROR
    }

    /**
     * Structured diagnostic event.
     *
     * @param severity     ERROR for strict-mode and construction failures, WARNING otherwise
     * @param kind         failure classification
     * @param field        offending field or path, may be null
     * @param expected     expected descriptor text, may be null
     * @param actual       runtime kind name found, may be null
     * @param contextLabel where the failure happened, usually the schema name; may be null
     * @param message      human-readable description
     */
    record Diagnostic(
            Severity severity,
            ViolationKind kind,
            String field,
            String expected,
            String actual,
            String contextLabel,
            String message) {}
}

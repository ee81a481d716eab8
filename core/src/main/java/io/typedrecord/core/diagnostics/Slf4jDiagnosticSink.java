package io.typedrecord.core.diagnostics;

import io.typedrecord.core.spi.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DiagnosticSink}: writes each diagnostic to SLF4J. ERROR diagnostics are logged at
 * {@code error}, WARNING diagnostics at {@code warn}, both as key=value pairs prefixed by the
 * context label.
 *
 * <p>
 * Thread-safe, stateless.
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {

    private static final Logger LOG = LoggerFactory.getLogger(Slf4jDiagnosticSink.class);

    @Override
    public void report(Diagnostic diagnostic) {
        String label = diagnostic.contextLabel() != null ? diagnostic.contextLabel() : "-";
        if (diagnostic.severity() == Severity.ERROR) {
            LOG.error(
                    "[{}] {}: kind={}, field={}, expected={}, actual={}",
                    label,
                    diagnostic.message(),
                    diagnostic.kind(),
                    diagnostic.field(),
                    diagnostic.expected(),
                    diagnostic.actual());
        } else {
            LOG.warn(
                    "[{}] {}: kind={}, field={}, expected={}, actual={}",
                    label,
                    diagnostic.message(),
                    diagnostic.kind(),
                    diagnostic.field(),
                    diagnostic.expected(),
                    diagnostic.actual());
        }
    }
}

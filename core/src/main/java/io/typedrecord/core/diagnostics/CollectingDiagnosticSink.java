package io.typedrecord.core.diagnostics;

import io.typedrecord.core.spi.DiagnosticSink;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link DiagnosticSink} that keeps every diagnostic in memory so callers can read the detail of
 * the last failure after inspecting a boolean result. Optionally forwards to a delegate sink.
 *
 * <p>
 * Thread-safe: all access is synchronized on the sink.
 */
public final class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticSink delegate;

    public CollectingDiagnosticSink() {
        this(NOOP);
    }

    /** @param delegate sink every diagnostic is forwarded to after being recorded */
    public CollectingDiagnosticSink(DiagnosticSink delegate) {
        this.delegate = delegate != null ? delegate : NOOP;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        synchronized (this) {
            diagnostics.add(diagnostic);
        }
        delegate.report(diagnostic);
    }

    /** The most recent diagnostic, if any. */
    public synchronized Optional<Diagnostic> last() {
        return diagnostics.isEmpty() ? Optional.empty() : Optional.of(diagnostics.get(diagnostics.size() - 1));
    }

    /** Message of the most recent diagnostic, or {@code null}. */
    public String lastMessage() {
        return last().map(Diagnostic::message).orElse(null);
    }

    /** Snapshot of all diagnostics in report order. */
    public synchronized List<Diagnostic> all() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public synchronized int size() {
        return diagnostics.size();
    }

    public synchronized void clear() {
        diagnostics.clear();
    }
}

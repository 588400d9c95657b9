package org.pragmatica.flowchart.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only receiver for diagnostics.
 */
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);

    /**
     * A sink that keeps diagnostics in report order.
     */
    static Collecting collecting() {
        return new Collecting();
    }

    final class Collecting implements DiagnosticSink {
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private Collecting() {}

        @Override
        public void report(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
        }

        public List<Diagnostic> diagnostics() {
            return List.copyOf(diagnostics);
        }

        public boolean isEmpty() {
            return diagnostics.isEmpty();
        }
    }
}

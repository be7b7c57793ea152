package domain.model;

/**
 * Sink for pipeline diagnostics.
 *
 * <p>Diagnostics are produced by the tokenizer, the translator and the
 * orchestrator. A sink lets each of them report without knowing who collects
 * the records.</p>
 */
public interface DiagnosticSink {

    static DiagnosticSink none() {
        return NullDiagnosticSink.INSTANCE;
    }

    void report(Diagnostic diagnostic);
}

package domain.model;
/** No-op diagnostic sink. */
final class NullDiagnosticSink implements DiagnosticSink {

    static final NullDiagnosticSink INSTANCE = new NullDiagnosticSink();

    private NullDiagnosticSink() {
    }

    @Override
    public void report(Diagnostic diagnostic) {
        // no-op
    }
}

package domain.pipeline;

import domain.model.Diagnostic;
import domain.model.QueryRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A request together with its pipeline result, as handed to report writers.
 *
 * <p>{@code runDiagnostics} holds records raised around the pipeline call
 * (e.g. SLOW_QUERY), not inside it.</p>
 */
public final class QueryRun {

    private final QueryRequest request;
    private final PipelineResult result;
    private final long elapsedMs;
    private final List<Diagnostic> runDiagnostics;

    public QueryRun(QueryRequest request, PipelineResult result, long elapsedMs) {
        this(request, result, elapsedMs, List.of());
    }

    public QueryRun(QueryRequest request, PipelineResult result, long elapsedMs, List<Diagnostic> runDiagnostics) {
        this.request = Objects.requireNonNull(request, "request");
        this.result = Objects.requireNonNull(result, "result");
        this.elapsedMs = elapsedMs;
        this.runDiagnostics = runDiagnostics == null ? List.of() : List.copyOf(runDiagnostics);
    }

    public QueryRequest getRequest() {
        return request;
    }

    public String getQueryId() {
        return request.getId();
    }

    public PipelineResult getResult() {
        return result;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public List<Diagnostic> getRunDiagnostics() {
        return runDiagnostics;
    }

    /**
     * Pipeline diagnostics followed by run diagnostics.
     */
    public List<Diagnostic> getAllDiagnostics() {
        List<Diagnostic> out = new ArrayList<>(result.getDiagnostics());
        out.addAll(runDiagnostics);
        return out;
    }
}

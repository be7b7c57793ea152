package domain.pipeline;

import domain.ast.AstNode;
import domain.model.Diagnostic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one query: ordered segments plus flattened views.
 */
public final class PipelineResult {

    private final String originalQuery;
    private final List<SegmentResult> segments;

    PipelineResult(String originalQuery, List<SegmentResult> segments) {
        this.originalQuery = originalQuery == null ? "" : originalQuery;
        this.segments = List.copyOf(segments);
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public List<SegmentResult> getSegments() {
        return segments;
    }

    public List<String> getQueryParts() {
        List<String> out = new ArrayList<>(segments.size());
        for (SegmentResult s : segments) out.add(s.getOriginalText());
        return out;
    }

    /**
     * True iff at least one segment produced an AST.
     */
    public boolean isSuccess() {
        for (SegmentResult s : segments) {
            if (s.isParsed()) return true;
        }
        return false;
    }

    public List<String> getAllSql() {
        List<String> out = new ArrayList<>();
        for (SegmentResult s : segments) out.addAll(s.getSql());
        return out;
    }

    public List<AstNode> getAsts() {
        List<AstNode> out = new ArrayList<>(segments.size());
        for (SegmentResult s : segments) {
            if (s.isParsed()) out.add(s.getAst());
        }
        return out;
    }

    public List<String> getErrors() {
        List<String> out = new ArrayList<>();
        for (SegmentResult s : segments) {
            if (s.hasError()) out.add(s.getError());
        }
        return out;
    }

    /**
     * Suggestions of the segments that parsed after correction, keyed
     * {@code query_<n>} with n 1-based.
     */
    public Map<String, Map<String, String>> getCorrections() {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (SegmentResult s : segments) {
            if (s.isParsed() && !s.getSuggestions().isEmpty()) {
                out.put("query_" + (s.getIndex() + 1), s.getSuggestions());
            }
        }
        return out;
    }

    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> out = new ArrayList<>();
        for (SegmentResult s : segments) out.addAll(s.getDiagnostics());
        return out;
    }
}

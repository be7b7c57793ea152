package domain.pipeline;

import domain.ast.AstNode;
import domain.exec.StatementExecution;
import domain.model.Diagnostic;
import domain.translate.StockSql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one question segment.
 *
 * <p>{@code ast} is null when the segment could not be parsed, in which case
 * {@code error} says why and there are no statements.</p>
 */
public final class SegmentResult {

    private final int index;
    private final String originalText;
    private final String correctedText;
    private final Map<String, String> suggestions;
    private final AstNode ast;
    private final List<StockSql> statements;
    private final List<StatementExecution> executions;
    private final String error;
    private final List<Diagnostic> diagnostics;

    SegmentResult(
            int index,
            String originalText,
            String correctedText,
            Map<String, String> suggestions,
            AstNode ast,
            List<StockSql> statements,
            List<StatementExecution> executions,
            String error,
            List<Diagnostic> diagnostics
    ) {
        this.index = index;
        this.originalText = originalText == null ? "" : originalText;
        this.correctedText = correctedText;
        this.suggestions = suggestions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(suggestions));
        this.ast = ast;
        this.statements = statements == null ? List.of() : List.copyOf(statements);
        this.executions = executions == null ? List.of() : List.copyOf(executions);
        this.error = error;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    static SegmentResult crashed(int index, String text, RuntimeException e, List<Diagnostic> diagnostics) {
        String msg = e.getClass().getSimpleName() + ": " + e.getMessage();
        return new SegmentResult(index, text, null, null, null, null, null, msg, diagnostics);
    }

    /**
     * 0-based position in split order.
     */
    public int getIndex() {
        return index;
    }

    public String getOriginalText() {
        return originalText;
    }

    /**
     * @return corrected text when the corrector proposed one, else null
     */
    public String getCorrectedText() {
        return correctedText;
    }

    public Map<String, String> getSuggestions() {
        return suggestions;
    }

    public AstNode getAst() {
        return ast;
    }

    public boolean isParsed() {
        return ast != null;
    }

    public List<StockSql> getStatements() {
        return statements;
    }

    public List<String> getSql() {
        List<String> out = new ArrayList<>(statements.size());
        for (StockSql s : statements) out.add(s.render());
        return out;
    }

    public List<StatementExecution> getExecutions() {
        return executions;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}

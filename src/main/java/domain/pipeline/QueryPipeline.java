package domain.pipeline;

import domain.ast.AstNode;
import domain.correct.Correction;
import domain.correct.ErrorCorrector;
import domain.correct.Vocabulary;
import domain.exec.StatementExecution;
import domain.exec.StockQueryException;
import domain.exec.StockQueryExecutor;
import domain.lexer.TokenRules;
import domain.lexer.Tokenizer;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import domain.model.ListDiagnosticSink;
import domain.parse.CompoundSplitter;
import domain.parse.GrammarParser;
import domain.parse.GrammarRules;
import domain.parse.ParseOutcome;
import domain.translate.SqlTranslator;
import domain.translate.StockSql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * split -> parse -> (correct -> parse) -> translate -> execute, per segment.
 *
 * <p>Failures stay local to their segment. Results keep split order in both
 * sequential and parallel mode. Instances are immutable and may be shared;
 * the only collaborator with state is the optional executor passed to
 * {@link #run(String, StockQueryExecutor)}.</p>
 */
public final class QueryPipeline {

    private final CompoundSplitter splitter;
    private final GrammarParser parser;
    private final ErrorCorrector corrector;
    private final SqlTranslator translator;
    private final PipelineOptions options;

    public QueryPipeline(
            CompoundSplitter splitter,
            GrammarParser parser,
            ErrorCorrector corrector,
            SqlTranslator translator,
            PipelineOptions options
    ) {
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.options = options == null ? PipelineOptions.defaults() : options;
    }

    /**
     * Pipeline over the built-in token rules, grammar, vocabulary and product predicates.
     */
    public static QueryPipeline defaults() {
        return new QueryPipeline(
                new CompoundSplitter(),
                new GrammarParser(new Tokenizer(TokenRules.defaults()), GrammarRules.defaults()),
                new ErrorCorrector(Vocabulary.defaults()),
                new SqlTranslator(),
                PipelineOptions.defaults()
        );
    }

    public QueryPipeline withOptions(PipelineOptions newOptions) {
        return new QueryPipeline(splitter, parser, corrector, translator, newOptions);
    }

    public PipelineResult run(String query) {
        return run(query, null);
    }

    /**
     * @param executor may be null; then statements are generated but not executed
     */
    public PipelineResult run(String query, StockQueryExecutor executor) {
        List<String> parts = splitter.split(query);
        if (parts.isEmpty()) {
            List<Diagnostic> diags = List.of(Diagnostic.of(DiagnosticCode.PARSE_FAILED, "", "empty query"));
            SegmentResult empty = new SegmentResult(0, "", null, null, null, null, null, "empty query", diags);
            return new PipelineResult(query, List.of(empty));
        }

        List<SegmentResult> segments = options.isParallel() && parts.size() > 1
                ? runParallel(parts, executor)
                : runSequential(parts, executor);
        return new PipelineResult(query, segments);
    }

    private List<SegmentResult> runSequential(List<String> parts, StockQueryExecutor executor) {
        List<SegmentResult> out = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            out.add(processSegment(i, parts.get(i), executor));
        }
        return out;
    }

    private List<SegmentResult> runParallel(List<String> parts, StockQueryExecutor executor) {
        ExecutorService pool = options.getWorkerPool();
        boolean ownPool = pool == null;
        if (ownPool) {
            AtomicInteger seq = new AtomicInteger();
            pool = Executors.newFixedThreadPool(options.effectiveThreads(parts.size()), r -> {
                Thread t = new Thread(r, "query-segment-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        try {
            List<Future<SegmentResult>> futures = new ArrayList<>(parts.size());
            for (int i = 0; i < parts.size(); i++) {
                final int index = i;
                final String text = parts.get(i);
                futures.add(pool.submit(() -> processSegment(index, text, executor)));
            }

            List<SegmentResult> out = new ArrayList<>(parts.size());
            for (int i = 0; i < futures.size(); i++) {
                out.add(await(futures.get(i), i, parts.get(i)));
            }
            return out;
        } finally {
            if (ownPool) pool.shutdownNow();
        }
    }

    private static SegmentResult await(Future<SegmentResult> future, int index, String text) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for segment " + (index + 1), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            RuntimeException re = cause instanceof RuntimeException
                    ? (RuntimeException) cause
                    : new IllegalStateException(cause.getMessage(), cause);
            return SegmentResult.crashed(index, text, re, List.of(segmentError(text, re)));
        }
    }

    SegmentResult processSegment(int index, String text, StockQueryExecutor executor) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        DiagnosticSink sink = new ListDiagnosticSink(diagnostics);
        try {
            return parseTranslateExecute(index, text, executor, sink, diagnostics);
        } catch (RuntimeException e) {
            sink.report(segmentError(text, e));
            return SegmentResult.crashed(index, text, e, diagnostics);
        }
    }

    private SegmentResult parseTranslateExecute(
            int index,
            String text,
            StockQueryExecutor executor,
            DiagnosticSink sink,
            List<Diagnostic> diagnostics
    ) {
        ParseOutcome first = parser.parse(text, sink);
        AstNode ast = first.getAst();
        String correctedText = null;
        Map<String, String> suggestions = Map.of();

        if (!first.isSuccess()) {
            sink.report(new Diagnostic(DiagnosticCode.PARSE_FAILED, text, first.getErrorTokenIndex(),
                    first.getError(), ""));

            if (options.isCorrectionEnabled()) {
                Correction correction = corrector.correct(text);
                suggestions = correction.getSuggestions();
                if (correction.isCorrected()) {
                    correctedText = correction.getCorrectedText();
                    ParseOutcome retry = parser.parse(correctedText, sink);
                    if (retry.isSuccess()) {
                        ast = retry.getAst();
                        sink.report(new Diagnostic(DiagnosticCode.CORRECTION_APPLIED, text, -1,
                                "parsed after correction", suggestions.toString()));
                    } else {
                        sink.report(new Diagnostic(DiagnosticCode.CORRECTION_FAILED, text, retry.getErrorTokenIndex(),
                                "corrected text still does not parse", correctedText));
                    }
                } else {
                    sink.report(Diagnostic.of(DiagnosticCode.CORRECTION_FAILED, text, "no correction found"));
                }
            }
        }

        if (ast == null) {
            return new SegmentResult(index, text, correctedText, suggestions, null, null, null,
                    "Could not parse query: " + text, diagnostics);
        }

        List<StockSql> statements = translator.translate(ast, sink);
        List<StatementExecution> executions = executor == null
                ? List.of()
                : execute(text, statements, executor, sink);

        return new SegmentResult(index, text, correctedText, suggestions, ast, statements, executions,
                null, diagnostics);
    }

    private static List<StatementExecution> execute(
            String text,
            List<StockSql> statements,
            StockQueryExecutor executor,
            DiagnosticSink sink
    ) {
        List<StatementExecution> out = new ArrayList<>(statements.size());
        for (StockSql sql : statements) {
            long t0 = System.nanoTime();
            try {
                List<Map<String, Object>> rows = executor.execute(sql);
                out.add(StatementExecution.rows(sql, rows, elapsedMs(t0)));
            } catch (StockQueryException e) {
                sink.report(new Diagnostic(DiagnosticCode.EXECUTION_FAILED, text, -1, e.getMessage(), sql.render()));
                out.add(StatementExecution.failed(sql, e.getMessage(), elapsedMs(t0)));
            }
        }
        return out;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static Diagnostic segmentError(String text, RuntimeException e) {
        return new Diagnostic(DiagnosticCode.SEGMENT_ERROR, text, -1,
                "unexpected failure while processing segment", e.getClass().getName() + ": " + e.getMessage());
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public SqlTranslator getTranslator() {
        return translator;
    }

    public ErrorCorrector getCorrector() {
        return corrector;
    }

    public GrammarParser getParser() {
        return parser;
    }
}

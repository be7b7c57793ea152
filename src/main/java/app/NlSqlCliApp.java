package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.NlSqlCli;
import domain.ast.AstTextRenderer;
import domain.correct.ErrorCorrector;
import domain.exec.StatementExecution;
import domain.exec.StockQueryExecutor;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.QueryRequest;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.pipeline.PipelineOptions;
import domain.pipeline.PipelineResult;
import domain.pipeline.QueryPipeline;
import domain.pipeline.QueryRun;
import domain.pipeline.SegmentResult;
import domain.translate.ProductPredicateTable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link NlSqlCli}). */
public final class NlSqlCliApp {

    static final String DEFAULT_OUT = "output/sql";
    static final String DEFAULT_RESULT = "output/nl-sql-result.xlsx";
    static final String SINGLE_QUERY_ID = "q1";

    private NlSqlCliApp() {}

    public static void main(String[] args) {
        run(CliArgParser.parseArgs(args));
    }

    /**
     * Runs one CLI invocation and returns the per-question runs (for tests and embedding).
     */
    static List<QueryRun> run(Map<String, String> argv) {

        long t0 = System.nanoTime();

        // ------------------------------------------------------------
        // baseDir + options
        // ------------------------------------------------------------
        Path baseDir = CliPathResolver.resolveBaseDir(argv);

        String queryArg = CliPathResolver.trimToNull(argv.get("query"));
        Path inputCsv = CliPathResolver.resolvePath(baseDir, argv.get("input"));
        if (queryArg == null && inputCsv == null) {
            throw new IllegalArgumentException("either --query \"<question>\" or --input <queries.csv> is required");
        }

        Path outputSqlDir = CliPathResolver.resolvePathOrDefault(baseDir, argv.get("out"), DEFAULT_OUT);
        Path resultXlsx = CliPathResolver.resolvePathOrDefault(baseDir, argv.get("result"), DEFAULT_RESULT);
        Path predicatesCsv = CliPathResolver.resolvePath(baseDir, argv.get("predicates"));

        double cutoff = CliArgParser.parseDoubleInRange("cutoff", argv.get("cutoff"), ErrorCorrector.DEFAULT_CUTOFF, 0.0, 1.0);
        boolean noCorrection = CliArgParser.flag(argv, "noCorrection");
        boolean parallel = CliArgParser.flag(argv, "parallel");
        int threads = CliArgParser.parseInt(argv.get("threads"), 0);

        String jdbcUrl = CliPathResolver.trimToNull(argv.get("jdbcUrl"));
        String jdbcUser = argv.get("jdbcUser");
        String jdbcPassword = argv.get("jdbcPassword");

        boolean tree = CliArgParser.flag(argv, "tree");
        int max = CliArgParser.parseInt(argv.get("max"), -1);
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), 100));
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 500L);
        long heartbeatMs = Math.max(1_000L,
                CliArgParser.parseLong(argv.get("heartbeatMs"), CliProgressMonitor.DEFAULT_HEARTBEAT_MS));
        boolean failFast = CliArgParser.flag(argv, "failFast");

        boolean noSqlOut = CliArgParser.anyFlag(argv, "noSqlOut", "noOut");
        boolean noResult = CliArgParser.anyFlag(argv, "noResult", "noXlsx");

        System.out.println("==================================================");
        System.out.println("[START] NL stock question -> SQL");
        System.out.println("[CONF] baseDir        = " + baseDir.toAbsolutePath());
        System.out.println("[CONF] query          = " + (queryArg == null ? "" : queryArg));
        System.out.println("[CONF] input          = " + (inputCsv == null ? "" : inputCsv.toAbsolutePath()));
        System.out.println("[CONF] predicates     = " + (predicatesCsv == null ? "(defaults)" : predicatesCsv.toAbsolutePath()));
        System.out.println("[CONF] out            = " + outputSqlDir.toAbsolutePath());
        System.out.println("[CONF] result         = " + resultXlsx.toAbsolutePath());
        System.out.println("[CONF] cutoff         = " + cutoff);
        System.out.println("[CONF] correction     = " + (!noCorrection) + " (use --noCorrection)");
        System.out.println("[CONF] parallel       = " + parallel + " threads=" + threads);
        System.out.println("[CONF] jdbcUrl        = " + (jdbcUrl == null ? "(none: generate only)" : jdbcUrl));
        System.out.println("[CONF] max            = " + max);
        System.out.println("[CONF] logEvery       = " + logEvery);
        System.out.println("[CONF] slowMs         = " + slowMs);
        System.out.println("[CONF] heartbeatMs    = " + heartbeatMs);
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] enableSqlOut   = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        if (inputCsv != null) CliPathResolver.requireRegularFile(inputCsv, "query input csv (--input)");
        if (predicatesCsv != null) CliPathResolver.requireRegularFile(predicatesCsv, "product predicate csv (--predicates)");

        if (!noSqlOut) CliPathResolver.ensureDir(outputSqlDir);
        if (!noResult) CliPathResolver.ensureParentDir(resultXlsx);

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        NlSqlComponentsFactory factory = new NlSqlComponentsFactory();

        long tInit0 = System.nanoTime();
        ProductPredicateTable predicates = factory.createPredicateTable(predicatesCsv);
        ErrorCorrector corrector = factory.createCorrector(cutoff);
        PipelineOptions options = PipelineOptions.defaults()
                .withCorrection(!noCorrection)
                .withParallel(parallel, threads);
        QueryPipeline pipeline = factory.createPipeline(predicates, corrector, options);
        StockQueryExecutor executor = factory.createExecutor(jdbcUrl, jdbcUser, jdbcPassword);
        System.out.println("[STEP1] pipeline ready. products=" + predicates.size()
                + ", vocabulary=" + corrector.getVocabulary().size()
                + ", elapsed=" + ms(tInit0) + "ms");

        long tIn0 = System.nanoTime();
        List<QueryRequest> requests;
        if (queryArg != null) {
            requests = List.of(new QueryRequest(SINGLE_QUERY_ID, queryArg));
        } else {
            System.out.println("[STEP2] loading query csv...");
            requests = factory.loadRequests(inputCsv);
        }
        System.out.println("[STEP2] questions loaded. size=" + requests.size() + ", elapsed=" + ms(tIn0) + "ms");

        if (max > 0 && requests.size() > max) {
            requests = requests.subList(0, max);
            System.out.println("[STEP2] apply max => truncated to " + requests.size());
        }

        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        long tLoop0 = System.nanoTime();
        int total = requests.size();
        System.out.println("[STEP3] processing start. total=" + total);

        List<QueryRun> runs = new ArrayList<>(Math.max(16, total));
        int parsed = 0;
        int failed = 0;
        int statements = 0;

        try (CliProgressMonitor monitor = new CliProgressMonitor(total, heartbeatMs).start()) {
            for (int i = 0; i < total; i++) {
                QueryRequest req = requests.get(i);
                String key = req.getId();
                monitor.setCurrent(key, i + 1);

                long one0 = System.nanoTime();
                PipelineResult result = pipeline.run(req.getQuery(), executor);
                long oneMs = ms(one0);

                List<Diagnostic> runDiagnostics = new ArrayList<>(1);
                if (oneMs >= slowMs) {
                    System.out.println("[SLOW] " + oneMs + "ms : " + key);
                    runDiagnostics.add(new Diagnostic(DiagnosticCode.SLOW_QUERY, req.getQuery(), -1,
                            "slowMs=" + slowMs + ", actualMs=" + oneMs, key));
                }
                runs.add(new QueryRun(req, result, oneMs, runDiagnostics));

                boolean stop = false;
                for (SegmentResult seg : result.getSegments()) {
                    if (seg.isParsed()) parsed++;
                    else failed++;

                    logSegment(key, seg, tree);
                    statements += seg.getStatements().size();

                    List<String> sql = seg.getSql();
                    for (int s = 0; s < sql.size(); s++) {
                        sqlOutputWriter.write(outputSqlDir, key, seg.getIndex() + 1, s + 1, sql.get(s));
                    }

                    if (failFast && (!seg.isParsed() || hasExecutionFailure(seg))) stop = true;
                }

                if ((i + 1) % logEvery == 0 || (i + 1) == total) {
                    monitor.logProgress(i + 1, parsed, failed, statements);
                }

                if (stop) {
                    System.out.println("[FAILFAST] stop on first failed question: " + key);
                    break;
                }
            }
        }

        int diagnostics = runs.stream().mapToInt(r -> r.getAllDiagnostics().size()).sum();
        System.out.println("[STEP3] processing done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] questions=" + runs.size() + ", segments parsed=" + parsed + ", failed=" + failed);
        System.out.println("[STAT] statements=" + statements + ", diagnostics=" + diagnostics);

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP4] writing result xlsx... questions=" + runs.size());
            resultWriter.write(resultXlsx, runs);
            System.out.println("[STEP4] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP4] result xlsx skipped (--noResult). questions=" + runs.size());
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return runs;
    }

    private static void logSegment(String key, SegmentResult seg, boolean tree) {
        String label = key + "#" + (seg.getIndex() + 1);
        if (!seg.isParsed()) {
            System.out.println("[ERROR] " + label + " " + safe(seg.getError()));
            return;
        }

        if (seg.getCorrectedText() != null) {
            System.out.println("[WARN] " + label + " corrected: '" + seg.getOriginalText() + "' -> '"
                    + seg.getCorrectedText() + "' " + seg.getSuggestions());
        }
        for (String sql : seg.getSql()) {
            System.out.println("[SQL] " + label + " " + sql);
        }
        for (StatementExecution ex : seg.getExecutions()) {
            if (ex.isSuccess()) {
                System.out.println("[EXEC] " + label + " rows=" + ex.getRows().size() + " elapsed=" + ex.getElapsedMs() + "ms");
            } else {
                System.out.println("[ERROR] " + label + " execution failed: " + safe(ex.getError()));
            }
        }
        if (tree) {
            System.out.print(AstTextRenderer.render(seg.getAst()));
        }
    }

    private static boolean hasExecutionFailure(SegmentResult seg) {
        for (StatementExecution ex : seg.getExecutions()) {
            if (!ex.isSuccess()) return true;
        }
        return false;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}

package domain.pipeline;

import java.util.concurrent.ExecutorService;

/**
 * Per-run switches for {@link QueryPipeline}.
 *
 * <p>Immutable; the {@code with*} methods return copies. When a worker pool is
 * supplied the caller owns it and the pipeline never shuts it down. Without
 * one, parallel runs use a pool of {@link #getThreads()} workers that lives
 * for a single run.</p>
 */
public final class PipelineOptions {

    private static final PipelineOptions DEFAULTS = new PipelineOptions(true, false, 0, null);

    private final boolean correctionEnabled;
    private final boolean parallel;
    private final int threads;
    private final ExecutorService workerPool;

    private PipelineOptions(boolean correctionEnabled, boolean parallel, int threads, ExecutorService workerPool) {
        if (threads < 0) throw new IllegalArgumentException("threads must be >= 0: " + threads);
        this.correctionEnabled = correctionEnabled;
        this.parallel = parallel;
        this.threads = threads;
        this.workerPool = workerPool;
    }

    public static PipelineOptions defaults() {
        return DEFAULTS;
    }

    public PipelineOptions withCorrection(boolean enabled) {
        return new PipelineOptions(enabled, parallel, threads, workerPool);
    }

    /**
     * @param threads worker count, 0 = number of available processors
     */
    public PipelineOptions withParallel(boolean enabled, int threads) {
        return new PipelineOptions(correctionEnabled, enabled, threads, workerPool);
    }

    public PipelineOptions withWorkerPool(ExecutorService pool) {
        return new PipelineOptions(correctionEnabled, pool != null || parallel, threads, pool);
    }

    public boolean isCorrectionEnabled() {
        return correctionEnabled;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * @return caller-owned pool, null when the pipeline should create its own
     */
    public ExecutorService getWorkerPool() {
        return workerPool;
    }

    int effectiveThreads(int segments) {
        int t = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(t, segments));
    }
}

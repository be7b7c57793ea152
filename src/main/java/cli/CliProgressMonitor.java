package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress and heartbeat logging for a batch of questions.
 *
 * <p>The heartbeat is a daemon thread that prints the current question every
 * {@code heartbeatMs}; {@link #close()} stops it.</p>
 */
public final class CliProgressMonitor implements AutoCloseable {

    public static final long DEFAULT_HEARTBEAT_MS = 30_000L;

    private final int total;
    private final long heartbeatMs;
    private final long startNs = System.nanoTime();
    private final AtomicInteger currentIndex = new AtomicInteger();
    private volatile String currentKey = "";
    private Thread heartbeat;

    public CliProgressMonitor(int total, long heartbeatMs) {
        if (heartbeatMs <= 0) throw new IllegalArgumentException("heartbeatMs must be > 0: " + heartbeatMs);
        this.total = total;
        this.heartbeatMs = heartbeatMs;
    }

    /**
     * Starts the heartbeat unless there is only one question to process.
     */
    public CliProgressMonitor start() {
        if (total <= 1 || heartbeat != null) return this;

        heartbeat = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(heartbeatMs);
                    System.out.println("[HEARTBEAT] running... " + currentIndex.get() + "/" + total
                            + " current=" + currentKey + " elapsed=" + elapsedMs() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "nl-sql-heartbeat");
        heartbeat.setDaemon(true);
        heartbeat.start();
        return this;
    }

    public void setCurrent(String queryId, int index1Based) {
        currentKey = (queryId == null) ? "" : queryId;
        currentIndex.set(Math.max(0, index1Based));
    }

    public void logProgress(int done, int parsedSegments, int failedSegments, int statements) {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf("[PROGRESS] %d/%d parsed=%d failed=%d statements=%d elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, parsedSegments, failedSegments, statements, elapsedMs(), usedMb, maxMb, currentKey);
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }

    @Override
    public void close() {
        Thread t = heartbeat;
        if (t != null) t.interrupt();
        heartbeat = null;
    }
}

package cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress counters for one batch run, logged as {@code [PROGRESS]} lines, plus an optional
 * {@code [HEARTBEAT]} thread for long files.
 *
 * <p>Counts files and statements separately: a file holds any number of statements.</p>
 */
public final class CliProgressMonitor {

    private static final Logger log = LoggerFactory.getLogger(CliProgressMonitor.class);

    public static final long DEFAULT_HEARTBEAT_MS = 30_000L;

    private final int totalFiles;
    private final long startNs = System.nanoTime();
    private final AtomicInteger filesDone = new AtomicInteger();
    private final AtomicInteger success = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private volatile String currentFile = "";

    public CliProgressMonitor(int totalFiles) {
        this.totalFiles = Math.max(0, totalFiles);
    }

    public void fileStarted(String key) {
        currentFile = (key == null) ? "" : key;
    }

    public void fileDone() {
        filesDone.incrementAndGet();
    }

    /** Adds statement outcomes (or file-level failures) to the running totals. */
    public void record(int successRows, int failedRows) {
        success.addAndGet(Math.max(0, successRows));
        failed.addAndGet(Math.max(0, failedRows));
    }

    public int getFilesDone() {
        return filesDone.get();
    }

    public int getSuccess() {
        return success.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getStatements() {
        return success.get() + failed.get();
    }

    public void logProgress() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        log.info("[PROGRESS] files={}/{} statements={} success={} failed={} elapsed={}ms heap={}/{}MB last={}",
                filesDone.get(), totalFiles, getStatements(), success.get(), failed.get(),
                elapsedMs(), usedMb, maxMb, currentFile);
    }

    /**
     * Starts a daemon thread logging the current file every {@code intervalMs}.
     * Close the returned handle to stop it.
     */
    public Heartbeat startHeartbeat(long intervalMs) {
        if (intervalMs <= 0) throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(intervalMs);
                    log.info("[HEARTBEAT] running... files={}/{} statements={} current={}",
                            filesDone.get(), totalFiles, getStatements(), currentFile);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sql-format-heartbeat");
        t.setDaemon(true);
        t.start();
        return new Heartbeat(t);
    }

    private long elapsedMs() {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }

    /** Handle of a running heartbeat thread. */
    public static final class Heartbeat implements AutoCloseable {
        private final Thread thread;

        private Heartbeat(Thread thread) {
            this.thread = thread;
        }

        public boolean isRunning() {
            return thread.isAlive();
        }

        /** Interrupts the thread and waits briefly for it to end. */
        @Override
        public void close() {
            thread.interrupt();
            try {
                thread.join(1_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}

package taskq.engine.worker;

/**
 * Rolling in-process counters. Guarded by the instance monitor.
 */
public final class EngineStatistics {

    /** Weight of the newest sample in the processing time moving average */
    static final double EMA_ALPHA = 0.2;

    private long processed;
    private long failed;
    private long retried;
    private long expired;
    private long cancelled;
    private double averageProcessingMs;
    private boolean hasSample;
    private int activeWorkers;

    public synchronized void recordCompleted(long processingMs) {
        processed++;
        sample(processingMs);
    }

    public synchronized void recordFailed(long processingMs) {
        failed++;
        sample(processingMs);
    }

    public synchronized void recordRetried(long processingMs) {
        retried++;
        sample(processingMs);
    }

    public synchronized void recordExpired() {
        expired++;
    }

    public synchronized void recordCancelled() {
        cancelled++;
    }

    public synchronized void workerBusy() {
        activeWorkers++;
    }

    public synchronized void workerIdle() {
        activeWorkers = Math.max(0, activeWorkers - 1);
    }

    private void sample(long processingMs) {
        if (!hasSample) {
            averageProcessingMs = processingMs;
            hasSample = true;
        } else {
            averageProcessingMs = EMA_ALPHA * processingMs + (1 - EMA_ALPHA) * averageProcessingMs;
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(processed, failed, retried, expired, cancelled, averageProcessingMs, activeWorkers);
    }

    public record Snapshot(
            long processed,
            long failed,
            long retried,
            long expired,
            long cancelled,
            double averageProcessingMs,
            int activeWorkers) {
    }
}

package taskq.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the reaper on a fixed interval.
 * Uses a single-threaded executor so two cycles never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskReaper taskReaper;
    private final Duration interval;
    private final Duration shutdownTimeout;

    private volatile boolean running = false;

    public Scheduler(TaskReaper taskReaper, Duration interval, Duration shutdownTimeout) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Reaper interval must be positive: " + interval);
        }
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskq-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskReaper = taskReaper;
        this.interval = interval;
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(taskReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms", intervalMs);
    }

    public synchronized void stop() {
        if (!running) {
            executor.shutdownNow();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }
}

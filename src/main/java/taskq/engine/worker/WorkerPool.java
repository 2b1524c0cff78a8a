package taskq.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.repository.TaskQueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of worker threads sharing one queue.
 *
 * <p>
 * Stopping flips the running flag; each worker finishes its current poll and any
 * dispatched handler (bounded by the task timeout) before exiting. Workers still
 * alive after the join timeout are interrupted.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final TaskQueue taskQueue;
    private final TaskProcessor processor;
    private final Duration pollTimeout;
    private final Duration errorBackoff;
    // snapshot, swapped on start/stop
    private volatile List<Thread> threads = List.of();

    private volatile boolean running = false;

    public WorkerPool(TaskQueue taskQueue, TaskProcessor processor, Duration pollTimeout, Duration errorBackoff) {
        this.taskQueue = taskQueue;
        this.processor = processor;
        this.pollTimeout = pollTimeout;
        this.errorBackoff = errorBackoff;
    }

    public synchronized void start(int numWorkers) {
        if (numWorkers <= 0) {
            throw new IllegalArgumentException("numWorkers must be positive");
        }
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        running = true;
        List<Thread> started = new ArrayList<>();
        for (int i = 0; i < numWorkers; i++) {
            TaskWorker worker = new TaskWorker(i, taskQueue, processor, () -> running, pollTimeout, errorBackoff);
            Thread thread = new Thread(worker, "taskq-worker-" + i);
            thread.setDaemon(true);
            thread.start();
            started.add(thread);
        }
        threads = List.copyOf(started);

        log.info("Started {} workers", numWorkers);
    }

    /**
     * Stop all workers, waiting up to {@code timeout} in total.
     *
     * @return true if every worker exited within the timeout
     */
    public synchronized boolean stop(Duration timeout) {
        if (!running) {
            return true;
        }

        running = false;
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean clean = true;

        for (Thread thread : threads) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                if (remainingMs > 0) {
                    thread.join(remainingMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                clean = false;
                log.warn("{} did not stop within {}ms, interrupting", thread.getName(), timeout.toMillis());
                thread.interrupt();
            }
        }

        threads = List.of();
        log.info(clean ? "Worker pool stopped gracefully" : "Worker pool stopped with interrupted workers");
        return clean;
    }

    public boolean isRunning() {
        return running;
    }

    public int aliveWorkers() {
        int alive = 0;
        for (Thread thread : threads) {
            if (thread.isAlive()) {
                alive++;
            }
        }
        return alive;
    }
}

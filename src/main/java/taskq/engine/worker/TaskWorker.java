package taskq.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.repository.TaskQueue;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One execution loop: poll the queue, process what comes out, repeat until
 * the pool stops. Errors are logged and followed by a fixed backoff; the loop
 * never dies on its own.
 */
final class TaskWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final int workerId;
    private final TaskQueue taskQueue;
    private final TaskProcessor processor;
    private final BooleanSupplier running;
    private final Duration pollTimeout;
    private final Duration errorBackoff;

    TaskWorker(int workerId,
            TaskQueue taskQueue,
            TaskProcessor processor,
            BooleanSupplier running,
            Duration pollTimeout,
            Duration errorBackoff) {
        this.workerId = workerId;
        this.taskQueue = taskQueue;
        this.processor = processor;
        this.running = running;
        this.pollTimeout = pollTimeout;
        this.errorBackoff = errorBackoff;
    }

    @Override
    public void run() {
        log.info("Worker {} started", workerId);

        while (running.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<String> taskId = taskQueue.poll(pollTimeout);
                if (taskId.isPresent()) {
                    processor.process(taskId.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Worker {} error", workerId, e);
                try {
                    Thread.sleep(errorBackoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Worker {} stopped", workerId);
    }
}

package taskq.engine.worker;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import taskq.engine.codec.MalformedTaskRecordException;
import taskq.engine.handler.HandlerRegistry;
import taskq.engine.handler.NoHandlerException;
import taskq.engine.handler.TaskHandler;
import taskq.engine.model.ProcessOutcome;
import taskq.engine.model.Task;
import taskq.engine.model.TaskResult;
import taskq.engine.model.TaskStatus;
import taskq.engine.repository.ProcessingSet;
import taskq.engine.repository.ResultRepository;
import taskq.engine.repository.TaskQueue;
import taskq.engine.repository.TaskRepository;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one popped task through its lifecycle:
 * stale check, RUNNING, handler under deadline, then completion, retry or
 * terminal failure.
 *
 * <p>
 * The caller must own the id (it came out of {@link TaskQueue#pop()}). Store
 * failures propagate; task failures never do, they end up in the task status.
 */
public class TaskProcessor {

    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);

    private final TaskRepository taskRepository;
    private final TaskQueue taskQueue;
    private final ProcessingSet processingSet;
    private final ResultRepository resultRepository;
    private final HandlerRegistry handlers;
    private final RetryPolicy retryPolicy;
    private final EngineStatistics statistics;
    private final ExecutorService handlerExecutor;
    private final Clock clock;
    private final Duration resultTtl;

    public TaskProcessor(TaskRepository taskRepository,
            TaskQueue taskQueue,
            ProcessingSet processingSet,
            ResultRepository resultRepository,
            HandlerRegistry handlers,
            RetryPolicy retryPolicy,
            EngineStatistics statistics,
            ExecutorService handlerExecutor,
            Clock clock,
            Duration resultTtl) {
        this.taskRepository = taskRepository;
        this.taskQueue = taskQueue;
        this.processingSet = processingSet;
        this.resultRepository = resultRepository;
        this.handlers = handlers;
        this.retryPolicy = retryPolicy;
        this.statistics = statistics;
        this.handlerExecutor = handlerExecutor;
        this.clock = clock;
        this.resultTtl = resultTtl;
    }

    /**
     * Process a task id the caller has just popped from the queue.
     */
    public ProcessOutcome process(String taskId) {
        MDC.put("taskId", taskId);
        statistics.workerBusy();
        try {
            Task task;
            try {
                Optional<Task> found = taskRepository.findById(taskId);
                if (found.isEmpty()) {
                    log.error("Task {} popped from queue but has no record", taskId);
                    return ProcessOutcome.SKIPPED;
                }
                task = found.get();
            } catch (MalformedTaskRecordException e) {
                log.error("Task {} has a malformed record, giving up on it", taskId, e);
                recordMalformed(taskId, e);
                return ProcessOutcome.SKIPPED;
            }

            if (task.status() != TaskStatus.PENDING) {
                log.warn("Task {} popped in status {}, skipping", taskId, task.status());
                return ProcessOutcome.SKIPPED;
            }

            Instant now = now();
            if (task.isStale(now)) {
                return expire(task, now);
            }

            Task running = task.toBuilder()
                    .status(TaskStatus.RUNNING)
                    .startedAt(now)
                    .build();
            if (!taskRepository.update(running, TaskStatus.PENDING)) {
                log.warn("Task {} changed while being claimed, skipping", taskId);
                return ProcessOutcome.SKIPPED;
            }

            processingSet.add(taskId);
            try {
                return execute(running);
            } finally {
                try {
                    processingSet.remove(taskId);
                } catch (RuntimeException e) {
                    log.warn("Task {} could not be removed from the processing set: {}", taskId, e.getMessage());
                }
            }
        } finally {
            statistics.workerIdle();
            MDC.remove("taskId");
        }
    }

    private ProcessOutcome execute(Task task) {
        long startNanos = System.nanoTime();
        log.info("Processing task {} of type {} (attempt {})", task.id(), task.type(), task.retryCount() + 1);

        Optional<TaskHandler> handler = handlers.find(task.type());
        if (handler.isEmpty()) {
            NoHandlerException e = new NoHandlerException(task.type());
            log.error("Task {} failed: {}", task.id(), e.getMessage());
            failTerminal(task, e);
            statistics.recordFailed(elapsedMs(startNanos));
            return ProcessOutcome.FAILED;
        }

        JsonNode result;
        try {
            result = invoke(handler.get(), task);
        } catch (InterruptedException e) {
            ProcessOutcome outcome = requeue(task);
            Thread.currentThread().interrupt();
            return outcome;
        } catch (Exception e) {
            return handleFailure(task, e, startNanos);
        }

        complete(task, result);
        statistics.recordCompleted(elapsedMs(startNanos));
        log.info("Task {} completed in {}ms", task.id(), elapsedMs(startNanos));
        return ProcessOutcome.COMPLETED;
    }

    /**
     * Run the handler in its own unit and wait at most the task timeout.
     * On deadline the future is cancelled with interruption; a handler that
     * ignores interruption keeps running in the background.
     */
    private JsonNode invoke(TaskHandler handler, Task task) throws Exception {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<JsonNode> future = handlerExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return handler.handle(task.payload());
            } finally {
                MDC.clear();
            }
        });
        try {
            if (task.timeout().isZero() || task.timeout().isNegative()) {
                return future.get();
            }
            return future.get(task.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TaskTimeoutException(task.id(), task.timeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (InterruptedException e) {
            // shutdown forced while waiting; the caller requeues, then restores the flag
            future.cancel(true);
            throw e;
        }
    }

    private ProcessOutcome handleFailure(Task task, Exception cause, long startNanos) {
        String message = describe(cause);
        Instant now = now();

        if (task.canRetry()) {
            int retryCount = task.retryCount() + 1;
            Duration delay = retryPolicy.backoff(retryCount);
            Task pending = task.toBuilder()
                    .status(TaskStatus.PENDING)
                    .retryCount(retryCount)
                    .startedAt(null)
                    .error(null)
                    .build();

            if (taskRepository.update(pending, TaskStatus.RUNNING)) {
                taskQueue.enqueue(task.id(), task.priority(), now.plus(delay));
            }
            statistics.recordRetried(elapsedMs(startNanos));
            log.warn("Task {} failed: {}. Retrying in {}ms (retry {} of {})",
                    task.id(), message, delay.toMillis(), retryCount, task.maxRetries());
            return ProcessOutcome.RETRIED;
        }

        log.error("Task {} failed permanently after {} attempts: {}", task.id(), task.retryCount() + 1, message);
        failTerminal(task, cause);
        statistics.recordFailed(elapsedMs(startNanos));
        return ProcessOutcome.FAILED;
    }

    /**
     * Put an interrupted task back on the queue, eligible now, with its retry
     * count unchanged.
     */
    private ProcessOutcome requeue(Task task) {
        Task pending = task.toBuilder()
                .status(TaskStatus.PENDING)
                .startedAt(null)
                .build();
        if (taskRepository.update(pending, TaskStatus.RUNNING)) {
            taskQueue.enqueue(task.id(), task.priority(), now());
        }
        log.warn("Task {} interrupted by shutdown, requeued (retry count stays {})", task.id(), task.retryCount());
        return ProcessOutcome.REQUEUED;
    }

    private void complete(Task task, JsonNode result) {
        Instant now = now();
        Task completed = task.toBuilder()
                .status(TaskStatus.COMPLETED)
                .completedAt(now)
                .build();
        if (taskRepository.update(completed, TaskStatus.RUNNING)) {
            resultRepository.put(TaskResult.success(task.id(), result, now), now.plus(resultTtl));
        }
    }

    private void failTerminal(Task task, Exception cause) {
        Instant now = now();
        String message = describe(cause);
        Task failed = task.toBuilder()
                .status(TaskStatus.FAILED)
                .completedAt(now)
                .error(message)
                .build();
        if (taskRepository.update(failed, TaskStatus.RUNNING)) {
            resultRepository.put(TaskResult.failure(task.id(), message, stackTrace(cause), now),
                    now.plus(resultTtl));
        }
    }

    private ProcessOutcome expire(Task task, Instant now) {
        Task expired = task.toBuilder()
                .status(TaskStatus.EXPIRED)
                .completedAt(now)
                .error("Task expired")
                .build();
        if (taskRepository.update(expired, TaskStatus.PENDING)) {
            statistics.recordExpired();
            log.warn("Task {} expired before execution (age exceeded {}ms)", task.id(), task.timeout().toMillis());
            return ProcessOutcome.EXPIRED;
        }
        return ProcessOutcome.SKIPPED;
    }

    private void recordMalformed(String taskId, MalformedTaskRecordException e) {
        Instant now = now();
        resultRepository.put(TaskResult.failure(taskId, e.getMessage(), stackTrace(e), now), now.plus(resultTtl));
        statistics.recordFailed(0);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}

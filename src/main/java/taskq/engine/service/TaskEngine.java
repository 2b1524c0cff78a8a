package taskq.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.codec.MalformedTaskRecordException;
import taskq.engine.config.EngineConfig;
import taskq.engine.handler.HandlerRegistry;
import taskq.engine.handler.TaskHandler;
import taskq.engine.model.EngineStats;
import taskq.engine.model.ProcessOutcome;
import taskq.engine.model.QueueEntry;
import taskq.engine.model.QueueInfo;
import taskq.engine.model.ReapReport;
import taskq.engine.model.SubmitRequest;
import taskq.engine.model.Task;
import taskq.engine.model.TaskResult;
import taskq.engine.model.TaskStatus;
import taskq.engine.repository.ProcessingSet;
import taskq.engine.repository.ResultRepository;
import taskq.engine.repository.TaskQueue;
import taskq.engine.repository.TaskRepository;
import taskq.engine.scheduler.Scheduler;
import taskq.engine.scheduler.TaskReaper;
import taskq.engine.worker.EngineStatistics;
import taskq.engine.worker.RetryPolicy;
import taskq.engine.worker.TaskProcessor;
import taskq.engine.worker.WorkerPool;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the task engine: submission, status queries, cancellation,
 * observability and lifecycle.
 *
 * <p>
 * The engine holds no global state; everything it persists goes through the
 * injected repositories. Several engines may share one store, or each use their
 * own. An engine is started at most once; after {@link #stop()} it cannot be
 * restarted.
 */
public class TaskEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);

    private final EngineConfig config;
    private final TaskRepository taskRepository;
    private final TaskQueue taskQueue;
    private final ProcessingSet processingSet;
    private final ResultRepository resultRepository;
    private final Clock clock;

    private final HandlerRegistry handlers = new HandlerRegistry();
    private final EngineStatistics statistics = new EngineStatistics();
    private final ExecutorService handlerExecutor;
    private final TaskProcessor processor;
    private final WorkerPool workerPool;
    private final TaskReaper reaper;
    private final Scheduler scheduler;

    private volatile boolean running = false;
    private volatile boolean stopped = false;

    public TaskEngine(EngineConfig config,
            TaskRepository taskRepository,
            TaskQueue taskQueue,
            ProcessingSet processingSet,
            ResultRepository resultRepository,
            Clock clock) {
        this.config = config;
        this.taskRepository = taskRepository;
        this.taskQueue = taskQueue;
        this.processingSet = processingSet;
        this.resultRepository = resultRepository;
        this.clock = clock;

        AtomicInteger handlerThreads = new AtomicInteger();
        this.handlerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskq-handler-" + handlerThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        this.processor = new TaskProcessor(taskRepository, taskQueue, processingSet, resultRepository,
                handlers, new RetryPolicy(config.retryBackoffBase(), config.retryBackoffCap()),
                statistics, handlerExecutor, clock, config.resultTtl());
        this.workerPool = new WorkerPool(taskQueue, processor, config.queuePollTimeout(),
                config.workerErrorBackoff());
        this.reaper = new TaskReaper(taskRepository, taskQueue, resultRepository, statistics, clock,
                config.resultTtl());
        this.scheduler = new Scheduler(reaper, config.reaperInterval(), config.shutdownTimeout());
    }

    // ===== handlers =====

    public void registerHandler(String type, TaskHandler handler) {
        handlers.register(type, handler);
    }

    public boolean unregisterHandler(String type) {
        return handlers.unregister(type);
    }

    // ===== submission =====

    /**
     * Submit a task with default priority, timeout and retry budget.
     *
     * @return the new task id
     */
    public String submit(String type, JsonNode payload) {
        return submit(SubmitRequest.builder(type, payload).build());
    }

    /**
     * Submit a task. The record is durable and visible to
     * {@link #getTaskStatus(String)} when this returns.
     *
     * @return the new task id
     * @throws IllegalArgumentException if the request is invalid
     * @throws taskq.engine.store.StoreException if the store is unavailable
     */
    public String submit(SubmitRequest request) {
        validate(request);

        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .type(request.type())
                .payload(request.payload())
                .status(TaskStatus.PENDING)
                .priority(request.priority())
                .createdAt(now())
                .retryCount(0)
                .maxRetries(request.maxRetries() != null ? request.maxRetries() : config.defaultMaxRetries())
                .timeout(request.timeout() != null ? request.timeout() : config.defaultTimeout())
                .correlationId(request.correlationId())
                .build();

        taskRepository.save(task);
        try {
            taskQueue.enqueue(task.id(), task.priority(), task.createdAt());
        } catch (RuntimeException e) {
            // an unqueued PENDING record would never run; drop it
            try {
                taskRepository.delete(task.id());
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        log.info("Submitted task {} of type {} with priority {}", task.id(), task.type(), task.priority());
        return task.id();
    }

    private static void validate(SubmitRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (request.type() == null || request.type().isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        if (request.payload() == null) {
            throw new IllegalArgumentException("payload is required");
        }
        if (request.priority() == null) {
            throw new IllegalArgumentException("priority is required");
        }
        if (request.maxRetries() != null && request.maxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (request.timeout() != null && request.timeout().isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
    }

    // ===== queries =====

    /**
     * Current state of a task, with its result merged in while the result is
     * still within its TTL.
     *
     * @throws MalformedTaskRecordException if the stored record cannot be decoded
     */
    public Optional<Task> getTaskStatus(String taskId) {
        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        Task task = found.get();
        if (task.status() != TaskStatus.COMPLETED && task.status() != TaskStatus.FAILED) {
            return found;
        }

        Optional<TaskResult> result = resultRepository.find(taskId, now());
        if (result.isEmpty()) {
            return found;
        }

        TaskResult r = result.get();
        return Optional.of(task.toBuilder()
                .result(r.result())
                .error(task.error() != null ? task.error() : r.error())
                .errorDetail(r.errorDetail())
                .build());
    }

    /**
     * Best-effort cancellation of a queued task.
     *
     * @return true if the task was still queued and is now CANCELLED; false if
     *         it is unknown, already taken by a worker or terminal
     */
    public boolean cancel(String taskId) {
        if (!taskQueue.remove(taskId)) {
            log.debug("Cancel of {} ignored: not queued", taskId);
            return false;
        }

        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty() || found.get().status() != TaskStatus.PENDING) {
            log.warn("Task {} was queued but its record is not PENDING", taskId);
            return false;
        }

        Task cancelled = found.get().toBuilder()
                .status(TaskStatus.CANCELLED)
                .completedAt(now())
                .build();
        if (!taskRepository.update(cancelled, TaskStatus.PENDING)) {
            return false;
        }

        statistics.recordCancelled();
        log.info("Cancelled task {}", taskId);
        return true;
    }

    public EngineStats getStats() {
        EngineStatistics.Snapshot s = statistics.snapshot();
        return new EngineStats(
                s.processed(),
                s.failed(),
                s.retried(),
                s.expired(),
                s.cancelled(),
                s.averageProcessingMs(),
                s.activeWorkers(),
                workerPool.aliveWorkers(),
                running,
                taskQueue.size(),
                processingSet.size(),
                taskRepository.count());
    }

    public QueueInfo getQueueInfo() {
        List<QueueInfo.QueuedTask> queued = new ArrayList<>();
        int rank = 0;
        for (QueueEntry entry : taskQueue.entries()) {
            Optional<Task> task = findQuietly(entry.taskId());
            if (task.isPresent()) {
                queued.add(new QueueInfo.QueuedTask(rank++, entry.priority(), entry.eligibleAt(), task.get()));
            }
        }

        List<Task> inFlight = new ArrayList<>();
        for (String taskId : processingSet.members()) {
            findQuietly(taskId).ifPresent(inFlight::add);
        }

        return new QueueInfo(queued, inFlight, handlers.types());
    }

    private Optional<Task> findQuietly(String taskId) {
        try {
            return taskRepository.findById(taskId);
        } catch (MalformedTaskRecordException e) {
            log.warn("Omitting malformed record from queue info: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ===== lifecycle =====

    public void start() {
        start(config.maxWorkers());
    }

    public synchronized void start(int numWorkers) {
        if (stopped) {
            throw new IllegalStateException("Engine has been stopped and cannot be restarted");
        }
        if (running) {
            log.warn("Engine already running");
            return;
        }

        workerPool.start(numWorkers);
        scheduler.start();
        running = true;
        log.info("Task engine started with {} workers", numWorkers);
    }

    /**
     * Stop workers and the reaper, waiting for in-flight tasks up to the
     * shutdown timeout. Idempotent; safe to call from a shutdown hook.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        running = false;

        log.info("Stopping task engine...");
        workerPool.stop(config.shutdownTimeout());
        scheduler.stop();

        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                handlerExecutor.shutdownNow();
                log.warn("Handler executor forcefully stopped");
            }
        } catch (InterruptedException e) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Task engine stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one reaper cycle on the calling thread.
     */
    public ReapReport runMaintenance() {
        return reaper.reap();
    }

    /**
     * Pop the best-ranked eligible task, if any, and process it on the calling
     * thread. Lets a caller drive the engine without a worker pool.
     */
    public Optional<ProcessOutcome> processNext() {
        Optional<String> taskId = taskQueue.pop();
        return taskId.map(processor::process);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}

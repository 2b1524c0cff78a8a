package taskq.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.*;
import taskq.engine.codec.MalformedTaskRecordException;
import taskq.engine.codec.TaskRecordCodec;
import taskq.engine.config.EngineConfig;
import taskq.engine.model.EngineStats;
import taskq.engine.model.ProcessOutcome;
import taskq.engine.model.QueueEntry;
import taskq.engine.model.QueueInfo;
import taskq.engine.model.ReapReport;
import taskq.engine.model.SubmitRequest;
import taskq.engine.model.Task;
import taskq.engine.model.TaskPriority;
import taskq.engine.model.TaskStatus;
import taskq.engine.repository.TaskQueue;
import taskq.engine.store.Database;
import taskq.engine.store.JdbcProcessingSet;
import taskq.engine.store.JdbcResultRepository;
import taskq.engine.store.JdbcTaskQueue;
import taskq.engine.store.JdbcTaskRepository;
import taskq.engine.store.StoreException;
import taskq.engine.support.MutableClock;
import taskq.engine.support.TestStore;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class TaskEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Database db;

    private final List<TaskEngine> engines = new ArrayList<>();

    @BeforeAll
    static void setup() {
        db = TestStore.database("test-engine");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestStore.clean(db);
    }

    @AfterEach
    void stopEngines() {
        engines.forEach(TaskEngine::stop);
        engines.clear();
    }

    private static EngineConfig fastConfig() {
        return EngineConfig.defaults()
                .withQueuePollTimeout(Duration.ofMillis(200))
                .withQueuePollInterval(Duration.ofMillis(10))
                .withWorkerErrorBackoff(Duration.ofMillis(50))
                .withRetryBackoff(Duration.ofMillis(10), Duration.ofMillis(50));
    }

    private TaskEngine engine(EngineConfig config, Clock clock) {
        return engine(config, clock, db);
    }

    private TaskEngine engine(EngineConfig config, Clock clock, Database database) {
        TaskEngine engine = new TaskEngine(config,
                new JdbcTaskRepository(database),
                new JdbcTaskQueue(database, clock, config.queuePollInterval()),
                new JdbcProcessingSet(database, clock),
                new JdbcResultRepository(database),
                clock);
        engines.add(engine);
        return engine;
    }

    private TaskEngine engine() {
        return engine(fastConfig(), Clock.systemUTC());
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static Task awaitStatus(TaskEngine engine, String id, Predicate<Task> condition) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        Task last = null;
        while (System.currentTimeMillis() < deadline) {
            last = engine.getTaskStatus(id).orElseThrow();
            if (condition.test(last)) {
                return last;
            }
            Thread.sleep(20);
        }
        fail("Timed out waiting for task " + id + ", last seen: " + last);
        return last;
    }

    // ===== submission and status =====

    @Test
    void submittedTaskIsImmediatelyPending() throws Exception {
        TaskEngine engine = engine();

        String id = engine.submit("echo", json("{\"x\":1}"));

        Task task = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(0, task.retryCount());
        assertEquals(TaskPriority.NORMAL, task.priority());
        assertEquals(3, task.maxRetries());
        assertEquals(Duration.ofSeconds(300), task.timeout());
        assertNull(task.startedAt());
    }

    @Test
    void submitAppliesRequestOptionsAndConfigDefaults() throws Exception {
        TaskEngine engine = engine(fastConfig().withDefaultMaxRetries(5).withDefaultTimeout(Duration.ofSeconds(42)),
                Clock.systemUTC());

        String withDefaults = engine.submit("echo", json("{}"));
        String withOptions = engine.submit(SubmitRequest.builder("echo", json("{}"))
                .priority(TaskPriority.HIGH)
                .maxRetries(1)
                .timeout(Duration.ofSeconds(7))
                .correlationId("session-1")
                .build());

        Task defaults = engine.getTaskStatus(withDefaults).orElseThrow();
        assertEquals(5, defaults.maxRetries());
        assertEquals(Duration.ofSeconds(42), defaults.timeout());

        Task options = engine.getTaskStatus(withOptions).orElseThrow();
        assertEquals(TaskPriority.HIGH, options.priority());
        assertEquals(1, options.maxRetries());
        assertEquals(Duration.ofSeconds(7), options.timeout());
        assertEquals("session-1", options.correlationId());
    }

    @Test
    void submitRejectsInvalidRequests() throws Exception {
        TaskEngine engine = engine();
        JsonNode payload = json("{}");

        assertThrows(IllegalArgumentException.class, () -> engine.submit(" ", payload));
        assertThrows(IllegalArgumentException.class, () -> engine.submit("echo", null));
        assertThrows(IllegalArgumentException.class,
                () -> engine.submit(SubmitRequest.builder("echo", payload).maxRetries(-1).build()));
        assertThrows(IllegalArgumentException.class,
                () -> engine.submit(SubmitRequest.builder("echo", payload).timeout(Duration.ofSeconds(-1)).build()));
        assertEquals(0, engine.getStats().totalTasks());
    }

    @Test
    void unknownTaskIsNotFound() {
        assertTrue(engine().getTaskStatus("no-such-task").isEmpty());
    }

    @Test
    void getTaskStatusIsIdempotent() throws Exception {
        TaskEngine engine = engine();
        engine.registerHandler("echo", payload -> payload);
        String id = engine.submit("echo", json("{\"x\":1}"));
        engine.processNext();

        Task first = engine.getTaskStatus(id).orElseThrow();
        Task second = engine.getTaskStatus(id).orElseThrow();

        assertEquals(TaskRecordCodec.encode(first), TaskRecordCodec.encode(second));
    }

    // ===== execution with workers =====

    @Test
    void echoTaskCompletesEndToEnd() throws Exception {
        TaskEngine engine = engine();
        engine.registerHandler("echo", payload -> payload);
        engine.start(2);

        String id = engine.submit(SubmitRequest.builder("echo", json("{\"x\":1}"))
                .priority(TaskPriority.CRITICAL)
                .build());

        Task done = awaitStatus(engine, id, t -> t.status() == TaskStatus.COMPLETED);
        assertEquals(json("{\"x\":1}"), done.result());
        assertNotNull(done.startedAt());
        assertNotNull(done.completedAt());
        assertFalse(done.completedAt().isBefore(done.startedAt()));
        assertEquals(1, engine.getStats().processed());
    }

    @Test
    void handlerThatFailsTwiceThenSucceedsCompletes() throws Exception {
        TaskEngine engine = engine();
        AtomicInteger attempts = new AtomicInteger();
        engine.registerHandler("flaky", payload -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new IllegalStateException("attempt " + attempts.get() + " failed");
            }
            return JsonNodeFactory.instance.textNode("ok");
        });
        engine.start(2);

        String id = engine.submit(SubmitRequest.builder("flaky", json("{}")).maxRetries(3).build());

        Task done = awaitStatus(engine, id, t -> t.status() == TaskStatus.COMPLETED);
        assertEquals("ok", done.result().asText());
        assertEquals(2, done.retryCount());
        assertEquals(3, attempts.get());
        assertNull(done.error());
    }

    @Test
    void alwaysFailingHandlerRunsMaxRetriesPlusOneTimes() throws Exception {
        TaskEngine engine = engine();
        AtomicInteger attempts = new AtomicInteger();
        engine.registerHandler("broken", payload -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("always broken");
        });
        engine.start(2);

        String id = engine.submit(SubmitRequest.builder("broken", json("{}")).maxRetries(2).build());

        Task failed = awaitStatus(engine, id, t -> t.status() == TaskStatus.FAILED);
        assertEquals(2, failed.retryCount());
        assertEquals("always broken", failed.error());
        assertNotNull(failed.errorDetail());
        assertTrue(failed.errorDetail().contains("IllegalArgumentException"));

        // never re-enqueued after the terminal failure
        Thread.sleep(300);
        assertEquals(3, attempts.get());
        assertEquals(0, engine.getStats().queueSize());
        assertEquals(TaskStatus.FAILED, engine.getTaskStatus(id).orElseThrow().status());
    }

    @Test
    void missingHandlerFailsWithoutRetry() throws Exception {
        TaskEngine engine = engine();
        engine.start(1);

        String id = engine.submit("nobody-handles-this", json("{}"));

        Task failed = awaitStatus(engine, id, t -> t.status() == TaskStatus.FAILED);
        assertEquals(0, failed.retryCount());
        assertTrue(failed.error().contains("nobody-handles-this"));
    }

    @Test
    void manyTasksAcrossSeveralWorkersAllComplete() throws Exception {
        TaskEngine engine = engine();
        engine.registerHandler("echo", payload -> payload);
        engine.start(3);

        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ids.add(engine.submit(SubmitRequest.builder("echo", json("{\"i\":" + i + "}"))
                    .priority(TaskPriority.values()[i % 4])
                    .build()));
        }

        for (int i = 0; i < ids.size(); i++) {
            Task done = awaitStatus(engine, ids.get(i), t -> t.status() == TaskStatus.COMPLETED);
            assertEquals(i, done.result().get("i").asInt());
        }
        EngineStats stats = engine.getStats();
        assertEquals(20, stats.processed());
        assertEquals(0, stats.queueSize());
        assertEquals(0, stats.processingSize());
    }

    // ===== ordering =====

    @Test
    void criticalTasksAreDequeuedBeforeLowOnes() throws Exception {
        TaskEngine engine = engine();
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        engine.registerHandler("record", payload -> {
            order.add(payload.get("p").asText());
            return payload;
        });

        TaskPriority[] submitted = {
                TaskPriority.LOW, TaskPriority.CRITICAL, TaskPriority.NORMAL, TaskPriority.LOW,
                TaskPriority.HIGH, TaskPriority.CRITICAL, TaskPriority.LOW, TaskPriority.CRITICAL };
        for (TaskPriority p : submitted) {
            engine.submit(SubmitRequest.builder("record", json("{\"p\":\"" + p + "\"}")).priority(p).build());
        }

        while (engine.processNext().isPresent()) {
            // drain
        }

        assertEquals(List.of("CRITICAL", "CRITICAL", "CRITICAL", "HIGH", "NORMAL", "LOW", "LOW", "LOW"), order);
    }

    // ===== cancellation =====

    @Test
    void cancelPendingTaskPreventsExecution() throws Exception {
        TaskEngine engine = engine();
        AtomicInteger runs = new AtomicInteger();
        engine.registerHandler("echo", payload -> {
            runs.incrementAndGet();
            return payload;
        });
        String id = engine.submit("echo", json("{}"));

        assertTrue(engine.cancel(id));

        Task cancelled = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.CANCELLED, cancelled.status());
        assertNotNull(cancelled.completedAt());
        assertTrue(engine.processNext().isEmpty());
        assertEquals(0, runs.get());
        assertFalse(engine.cancel(id));
        assertEquals(1, engine.getStats().cancelled());
    }

    @Test
    void cancelAfterCompletionReturnsFalseAndChangesNothing() throws Exception {
        TaskEngine engine = engine();
        engine.registerHandler("echo", payload -> payload);
        String id = engine.submit("echo", json("{\"x\":2}"));
        assertEquals(Optional.of(ProcessOutcome.COMPLETED), engine.processNext());
        String before = TaskRecordCodec.encode(engine.getTaskStatus(id).orElseThrow());

        assertFalse(engine.cancel(id));

        assertEquals(before, TaskRecordCodec.encode(engine.getTaskStatus(id).orElseThrow()));
    }

    @Test
    void cancelWhileRunningReturnsFalseAndChangesNothing() throws Exception {
        TaskEngine engine = engine();
        CountDownLatch release = new CountDownLatch(1);
        engine.registerHandler("slow", payload -> {
            release.await(10, TimeUnit.SECONDS);
            return payload;
        });
        engine.start(1);
        String id = engine.submit("slow", json("{\"x\":3}"));

        try {
            Task running = awaitStatus(engine, id, t -> t.status() == TaskStatus.RUNNING);
            String before = TaskRecordCodec.encode(running);

            assertFalse(engine.cancel(id));

            assertEquals(before, TaskRecordCodec.encode(engine.getTaskStatus(id).orElseThrow()));
        } finally {
            release.countDown();
        }

        Task done = awaitStatus(engine, id, t -> t.status() == TaskStatus.COMPLETED);
        assertEquals(json("{\"x\":3}"), done.result());
        assertEquals(0, engine.getStats().cancelled());
    }

    @Test
    void cancelUnknownTaskReturnsFalse() {
        assertFalse(engine().cancel("no-such-task"));
    }

    // ===== time-dependent behaviour =====

    @Test
    void expiredTaskIsNeverStarted() throws Exception {
        MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
        TaskEngine engine = engine(fastConfig(), clock);
        engine.registerHandler("echo", payload -> payload);

        String id = engine.submit(SubmitRequest.builder("echo", json("{}")).timeout(Duration.ofSeconds(1)).build());
        clock.advance(Duration.ofSeconds(2));

        ReapReport report = engine.runMaintenance();

        assertEquals(1, report.expired());
        Task expired = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.EXPIRED, expired.status());
        assertNull(expired.startedAt());
        assertTrue(engine.processNext().isEmpty());
    }

    @Test
    void staleTaskPoppedByWorkerIsExpired() throws Exception {
        MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
        TaskEngine engine = engine(fastConfig(), clock);
        engine.registerHandler("echo", payload -> payload);

        String id = engine.submit(SubmitRequest.builder("echo", json("{}")).timeout(Duration.ofSeconds(1)).build());
        clock.advance(Duration.ofSeconds(2));

        assertEquals(Optional.of(ProcessOutcome.EXPIRED), engine.processNext());
        assertNull(engine.getTaskStatus(id).orElseThrow().startedAt());
    }

    @Test
    void retriedTaskWaitsForBackoff() throws Exception {
        MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
        TaskEngine engine = engine(fastConfig().withRetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(300)),
                clock);
        AtomicInteger attempts = new AtomicInteger();
        engine.registerHandler("flaky", payload -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
            return payload;
        });
        String id = engine.submit("flaky", json("{}"));

        assertEquals(Optional.of(ProcessOutcome.RETRIED), engine.processNext());
        assertTrue(engine.processNext().isEmpty());

        clock.advance(Duration.ofMillis(1999));
        assertTrue(engine.processNext().isEmpty());

        clock.advance(Duration.ofMillis(1));
        assertEquals(Optional.of(ProcessOutcome.COMPLETED), engine.processNext());
        assertEquals(1, engine.getTaskStatus(id).orElseThrow().retryCount());
    }

    @Test
    void resultVanishesOnceTtlElapses() throws Exception {
        MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
        TaskEngine engine = engine(fastConfig().withResultTtl(Duration.ofMinutes(5)), clock);
        engine.registerHandler("echo", payload -> payload);
        String id = engine.submit("echo", json("{\"x\":1}"));
        assertEquals(Optional.of(ProcessOutcome.COMPLETED), engine.processNext());
        assertNotNull(engine.getTaskStatus(id).orElseThrow().result());

        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        // ignored on read before the reaper runs
        Task stale = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stale.status());
        assertNull(stale.result());

        ReapReport report = engine.runMaintenance();

        assertEquals(1, report.resultsPurged());
        assertTrue(engine.getTaskStatus(id).isEmpty());
    }

    // ===== observability =====

    @Test
    void queueInfoListsQueuedTasksInRankOrder() throws Exception {
        TaskEngine engine = engine();
        engine.registerHandler("echo", payload -> payload);
        engine.registerHandler("resize", payload -> payload);
        String low = engine.submit(SubmitRequest.builder("echo", json("{}")).priority(TaskPriority.LOW).build());
        String critical = engine.submit(
                SubmitRequest.builder("echo", json("{}")).priority(TaskPriority.CRITICAL).build());
        String normal = engine.submit("echo", json("{}"));

        QueueInfo info = engine.getQueueInfo();

        assertEquals(3, info.queued().size());
        assertEquals(critical, info.queued().get(0).task().id());
        assertEquals(0, info.queued().get(0).rank());
        assertEquals(normal, info.queued().get(1).task().id());
        assertEquals(low, info.queued().get(2).task().id());
        assertEquals(TaskPriority.LOW, info.queued().get(2).priority());
        assertTrue(info.inFlight().isEmpty());
        assertEquals(List.of("echo", "resize"), new ArrayList<>(info.registeredHandlers()));

        EngineStats stats = engine.getStats();
        assertEquals(3, stats.queueSize());
        assertEquals(3, stats.totalTasks());
        assertFalse(stats.running());
    }

    // ===== errors =====

    @Test
    void storeUnavailableSurfacesToCaller() throws Exception {
        Database broken = TestStore.database("test-engine-broken");
        TaskEngine engine = engine(fastConfig(), Clock.systemUTC(), broken);
        broken.close();
        JsonNode payload = json("{}");

        assertThrows(StoreException.class, () -> engine.submit("echo", payload));
        assertThrows(StoreException.class, () -> engine.getTaskStatus("any"));
        assertThrows(StoreException.class, () -> engine.cancel("any"));
    }

    @Test
    void retryWhoseReenqueueFailsIsStillExpiredByTheReaper() throws Exception {
        MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
        EngineConfig config = fastConfig().withRetryBackoff(Duration.ofSeconds(1), Duration.ofSeconds(300));
        FlakyEnqueueQueue queue = new FlakyEnqueueQueue(new JdbcTaskQueue(db, clock, config.queuePollInterval()));
        TaskEngine engine = new TaskEngine(config,
                new JdbcTaskRepository(db),
                queue,
                new JdbcProcessingSet(db, clock),
                new JdbcResultRepository(db),
                clock);
        engines.add(engine);
        engine.registerHandler("broken", payload -> {
            throw new IllegalStateException("always broken");
        });
        String id = engine.submit(SubmitRequest.builder("broken", json("{}"))
                .timeout(Duration.ofSeconds(60))
                .build());

        queue.failNextEnqueue();
        assertThrows(StoreException.class, engine::processNext);

        Task orphaned = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.PENDING, orphaned.status());
        assertEquals(1, orphaned.retryCount());
        assertEquals(0, engine.getStats().queueSize());

        clock.advance(Duration.ofHours(1));
        ReapReport report = engine.runMaintenance();

        assertEquals(1, report.expired());
        Task expired = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.EXPIRED, expired.status());
        assertNull(expired.startedAt());
        assertEquals(0, engine.getStats().processingSize());
    }

    @Test
    void malformedRecordIsAnErrorNotNotFound() throws Exception {
        TaskEngine engine = engine();
        TestStore.insertRawRecord(db, "corrupt", "PENDING", "{\"v\":1,\"id\":\"corrupt\",\"status\":\"Pending\"}");

        assertThrows(MalformedTaskRecordException.class, () -> engine.getTaskStatus("corrupt"));
    }

    // ===== lifecycle =====

    @Test
    void startAndStopAreIdempotent() {
        TaskEngine engine = engine();

        engine.start(2);
        engine.start(2);
        assertTrue(engine.isRunning());

        engine.stop();
        engine.stop();
        assertFalse(engine.isRunning());
        assertEquals(0, engine.getStats().workersRunning());
        assertThrows(IllegalStateException.class, engine::start);
    }

    @Test
    void statsStayReadableWhileStopDrainsWorkers() throws Exception {
        TaskEngine engine = engine();
        CountDownLatch release = new CountDownLatch(1);
        engine.registerHandler("slow", payload -> {
            release.await(10, TimeUnit.SECONDS);
            return payload;
        });
        engine.start(1);
        String id = engine.submit("slow", json("{}"));
        awaitStatus(engine, id, t -> t.status() == TaskStatus.RUNNING);

        Thread stopper = new Thread(engine::stop, "test-stopper");
        try {
            stopper.start();
            while (engine.isRunning()) {
                Thread.sleep(5);
            }
            Thread.sleep(50);

            EngineStats stats = assertTimeoutPreemptively(Duration.ofSeconds(2), engine::getStats);
            assertFalse(stats.running());
            assertEquals(1, stats.workersRunning());
        } finally {
            release.countDown();
            stopper.join(10_000);
        }
        assertEquals(0, engine.getStats().workersRunning());
    }

    @Test
    void unregisteredHandlerIsNoLongerUsed() throws Exception {
        TaskEngine engine = engine();
        engine.registerHandler("echo", payload -> payload);
        assertTrue(engine.unregisterHandler("echo"));
        assertFalse(engine.unregisterHandler("echo"));

        String id = engine.submit("echo", json("{}"));
        assertEquals(Optional.of(ProcessOutcome.FAILED), engine.processNext());
        assertEquals(TaskStatus.FAILED, engine.getTaskStatus(id).orElseThrow().status());
    }

    /** Delegates to a real queue but can be told to fail the next enqueue. */
    private static final class FlakyEnqueueQueue implements TaskQueue {
        private final TaskQueue delegate;
        private volatile boolean failNext;

        FlakyEnqueueQueue(TaskQueue delegate) {
            this.delegate = delegate;
        }

        void failNextEnqueue() {
            failNext = true;
        }

        @Override
        public void enqueue(String taskId, TaskPriority priority, Instant eligibleAt) {
            if (failNext) {
                failNext = false;
                throw new StoreException("Failed to enqueue task: " + taskId,
                        new SQLException("connection reset"));
            }
            delegate.enqueue(taskId, priority, eligibleAt);
        }

        @Override
        public Optional<String> pop() {
            return delegate.pop();
        }

        @Override
        public Optional<String> poll(Duration timeout) throws InterruptedException {
            return delegate.poll(timeout);
        }

        @Override
        public boolean remove(String taskId) {
            return delegate.remove(taskId);
        }

        @Override
        public List<QueueEntry> entries() {
            return delegate.entries();
        }

        @Override
        public int size() {
            return delegate.size();
        }
    }
}

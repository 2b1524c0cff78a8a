package taskq.engine.store;

import org.junit.jupiter.api.*;
import taskq.engine.model.QueueEntry;
import taskq.engine.model.TaskPriority;
import taskq.engine.support.MutableClock;
import taskq.engine.support.TestStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskQueueTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcTaskQueue queue;

    @BeforeAll
    static void setup() {
        db = TestStore.database("test-task-queue");
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        queue = new JdbcTaskQueue(db, clock, Duration.ofMillis(10));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestStore.clean(db);
        clock.set(Instant.parse("2024-01-01T00:00:00Z"));
    }

    private static Instant now() {
        return clock.instant();
    }

    @Test
    void higherPriorityIsPoppedFirst() {
        queue.enqueue("low", TaskPriority.LOW, now());
        queue.enqueue("normal", TaskPriority.NORMAL, now());
        queue.enqueue("critical", TaskPriority.CRITICAL, now());
        queue.enqueue("high", TaskPriority.HIGH, now());

        assertEquals(Optional.of("critical"), queue.pop());
        assertEquals(Optional.of("high"), queue.pop());
        assertEquals(Optional.of("normal"), queue.pop());
        assertEquals(Optional.of("low"), queue.pop());
        assertEquals(Optional.empty(), queue.pop());
    }

    @Test
    void fifoWithinPriorityTier() {
        queue.enqueue("first", TaskPriority.NORMAL, now());
        queue.enqueue("second", TaskPriority.NORMAL, now());
        queue.enqueue("third", TaskPriority.NORMAL, now());

        assertEquals(Optional.of("first"), queue.pop());
        assertEquals(Optional.of("second"), queue.pop());
        assertEquals(Optional.of("third"), queue.pop());
    }

    @Test
    void earlierEligibilityWinsWithinTier() {
        queue.enqueue("later", TaskPriority.NORMAL, now().minusSeconds(1));
        queue.enqueue("earlier", TaskPriority.NORMAL, now().minusSeconds(5));

        assertEquals(Optional.of("earlier"), queue.pop());
    }

    @Test
    void entryIsNotHandedOutBeforeEligible() {
        queue.enqueue("delayed", TaskPriority.CRITICAL, now().plusSeconds(4));
        queue.enqueue("ready", TaskPriority.LOW, now());

        assertEquals(Optional.of("ready"), queue.pop());
        assertEquals(Optional.empty(), queue.pop());

        clock.advance(Duration.ofSeconds(4));
        assertEquals(Optional.of("delayed"), queue.pop());
    }

    @Test
    void reEnqueueReplacesRank() {
        queue.enqueue("t", TaskPriority.LOW, now());
        queue.enqueue("t", TaskPriority.HIGH, now().plusSeconds(2));

        assertEquals(1, queue.size());
        QueueEntry entry = queue.entries().get(0);
        assertEquals(TaskPriority.HIGH, entry.priority());
        assertEquals(now().plusSeconds(2), entry.eligibleAt());
    }

    @Test
    void removeSucceedsOnce() {
        queue.enqueue("t", TaskPriority.NORMAL, now());

        assertTrue(queue.remove("t"));
        assertFalse(queue.remove("t"));
        assertEquals(Optional.empty(), queue.pop());
    }

    @Test
    void entriesAreInRankOrder() {
        queue.enqueue("n1", TaskPriority.NORMAL, now());
        queue.enqueue("c1", TaskPriority.CRITICAL, now().plusSeconds(10));
        queue.enqueue("n2", TaskPriority.NORMAL, now());

        List<String> ids = queue.entries().stream().map(QueueEntry::taskId).toList();

        assertEquals(List.of("c1", "n1", "n2"), ids);
    }

    @Test
    void pollGivesUpAfterTimeout() throws Exception {
        long start = System.nanoTime();

        Optional<String> popped = queue.poll(Duration.ofMillis(100));

        assertTrue(popped.isEmpty());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 100);
    }

    @Test
    void pollReturnsImmediatelyWhenSomethingIsEligible() throws Exception {
        queue.enqueue("t", TaskPriority.NORMAL, now());

        assertEquals(Optional.of("t"), queue.poll(Duration.ofSeconds(5)));
    }

    @Test
    void concurrentPopsHandOutEachIdExactlyOnce() throws Exception {
        int tasks = 200;
        int poppers = 8;
        for (int i = 0; i < tasks; i++) {
            queue.enqueue("t-" + i, TaskPriority.values()[i % 4], now());
        }

        Queue<String> popped = new ConcurrentLinkedQueue<>();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(poppers);
        List<java.util.concurrent.Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < poppers; p++) {
            futures.add(pool.submit(() -> {
                go.await();
                Optional<String> id;
                while ((id = queue.pop()).isPresent()) {
                    popped.add(id.get());
                }
                return null;
            }));
        }

        go.countDown();
        for (var f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(tasks, popped.size());
        assertEquals(tasks, new HashSet<>(popped).size());
        assertEquals(0, queue.size());
    }
}

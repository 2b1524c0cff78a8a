package taskq.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.codec.MalformedTaskRecordException;
import taskq.engine.model.ReapReport;
import taskq.engine.model.Task;
import taskq.engine.model.TaskStatus;
import taskq.engine.repository.ResultRepository;
import taskq.engine.repository.TaskQueue;
import taskq.engine.repository.TaskRepository;
import taskq.engine.worker.EngineStatistics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Background sweep over the store.
 *
 * The reaper:
 * 1. Expires PENDING tasks older than their timeout. The status compare-and-set
 * decides ownership: a worker that popped the id fails its PENDING to RUNNING
 * update once the record is EXPIRED. A PENDING record with no queue row (a
 * retry whose re-enqueue failed) is expired the same way.
 * 2. Deletes results older than the result TTL, together with their task record
 * 3. Deletes CANCELLED and EXPIRED records older than the result TTL
 *
 * RUNNING records are never touched.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskRepository taskRepository;
    private final TaskQueue taskQueue;
    private final ResultRepository resultRepository;
    private final EngineStatistics statistics;
    private final Clock clock;
    private final Duration resultTtl;

    public TaskReaper(TaskRepository taskRepository,
            TaskQueue taskQueue,
            ResultRepository resultRepository,
            EngineStatistics statistics,
            Clock clock,
            Duration resultTtl) {
        this.taskRepository = taskRepository;
        this.taskQueue = taskQueue;
        this.resultRepository = resultRepository;
        this.statistics = statistics;
        this.clock = clock;
        this.resultTtl = resultTtl;
    }

    @Override
    public void run() {
        try {
            reap();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Run one full cycle.
     *
     * @return what was expired and purged
     */
    public ReapReport reap() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        int expired = expireStalePending(now);
        Instant cutoff = now.minus(resultTtl);
        int resultsPurged = purgeResults(cutoff);
        int recordsPurged = purgeRecords(cutoff);

        ReapReport report = new ReapReport(expired, resultsPurged, recordsPurged);
        if (report.total() > 0) {
            log.info("Task reaper: {} expired, {} results purged, {} records purged",
                    expired, resultsPurged, recordsPurged);
        } else {
            log.debug("Task reaper: nothing to do");
        }
        return report;
    }

    private int expireStalePending(Instant now) {
        List<String> pending = taskRepository.findIdsByStatus(TaskStatus.PENDING);
        int expired = 0;

        for (String taskId : pending) {
            try {
                Optional<Task> found = taskRepository.findById(taskId);
                if (found.isEmpty() || found.get().status() != TaskStatus.PENDING || !found.get().isStale(now)) {
                    continue;
                }
                Task task = found.get();

                Task expiredTask = task.toBuilder()
                        .status(TaskStatus.EXPIRED)
                        .completedAt(now)
                        .error("Task expired")
                        .build();
                if (!taskRepository.update(expiredTask, TaskStatus.PENDING)) {
                    log.debug("Stale task {} was claimed before it could be expired", taskId);
                    continue;
                }
                statistics.recordExpired();
                expired++;

                if (!taskQueue.remove(taskId)) {
                    log.debug("Expired task {} had no queue entry", taskId);
                }
                log.info("Expired task {} (pending longer than {}ms)", taskId, task.timeout().toMillis());
            } catch (MalformedTaskRecordException e) {
                log.warn("Skipping malformed record during expiry scan: {}", e.getMessage());
            } catch (Exception e) {
                log.error("Failed to expire task {}", taskId, e);
            }
        }

        return expired;
    }

    private int purgeResults(Instant cutoff) {
        int purged = 0;
        for (String taskId : resultRepository.findCompletedBefore(cutoff)) {
            try {
                resultRepository.delete(taskId);
                taskRepository.delete(taskId);
                purged++;
            } catch (Exception e) {
                log.error("Failed to purge result of task {}", taskId, e);
            }
        }
        return purged;
    }

    private int purgeRecords(Instant cutoff) {
        int purged = 0;
        List<String> old = taskRepository.findCompletedBefore(
                EnumSet.of(TaskStatus.CANCELLED, TaskStatus.EXPIRED), cutoff);
        for (String taskId : old) {
            try {
                if (taskRepository.delete(taskId)) {
                    purged++;
                }
            } catch (Exception e) {
                log.error("Failed to purge record of task {}", taskId, e);
            }
        }
        return purged;
    }
}

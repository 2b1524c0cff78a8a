package taskq.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.api.v1.HealthController;
import taskq.engine.api.v1.QueueController;
import taskq.engine.api.v1.StatsController;
import taskq.engine.api.v1.TaskController;
import taskq.engine.repository.ProcessingSet;
import taskq.engine.repository.ResultRepository;
import taskq.engine.repository.TaskQueue;
import taskq.engine.repository.TaskRepository;
import taskq.engine.server.EngineHttpServer;
import taskq.engine.server.RouterHandler;
import taskq.engine.service.TaskEngine;
import taskq.engine.store.Database;
import taskq.engine.store.JdbcProcessingSet;
import taskq.engine.store.JdbcResultRepository;
import taskq.engine.store.JdbcTaskQueue;
import taskq.engine.store.JdbcTaskRepository;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the store, the engine and the monitoring endpoint.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.engine().registerHandler("echo", payload -&gt; payload);
 * deps.start();
 * // ... submit tasks ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final TaskEngine engine;

    // Created lazily
    private RouterHandler routerHandler;
    private EngineHttpServer httpServer;

    private boolean closed = false;

    private Dependencies(EngineConfig config, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);

        TaskRepository taskRepository = new JdbcTaskRepository(database);
        TaskQueue taskQueue = new JdbcTaskQueue(database, clock, config.queuePollInterval());
        ProcessingSet processingSet = new JdbcProcessingSet(database, clock);
        ResultRepository resultRepository = new JdbcResultRepository(database);

        this.engine = new TaskEngine(config, taskRepository, taskQueue, processingSet, resultRepository, clock);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(EngineConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static Dependencies create(EngineConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public Database database() {
        return database;
    }

    public TaskEngine engine() {
        return engine;
    }

    /**
     * Router with all monitoring controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, engine))
                    .registerController(new StatsController(engine))
                    .registerController(new QueueController(engine))
                    .registerController(new TaskController(engine));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized EngineHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new EngineHttpServer(routerHandler(), config.serverHost(), config.serverPort());
        }
        return httpServer;
    }

    /**
     * Start workers, the reaper and (if enabled) the monitoring endpoint.
     */
    public void start() {
        engine.start();
        if (config.serverEnabled()) {
            httpServer().start();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Closing dependencies...");

        try {
            engine.stop();
        } catch (Exception e) {
            log.warn("Error stopping engine: {}", e.getMessage());
        }

        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}

package taskq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.config.Dependencies;
import taskq.engine.config.EngineConfig;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone engine process.
 *
 * Reads configuration from the environment, registers the built-in
 * {@code echo} handler and runs until SIGINT/SIGTERM.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config = EngineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        deps.engine().registerHandler("echo", payload -> payload);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            deps.close();
            stopped.countDown();
        }, "taskq-shutdown"));

        try {
            deps.start();
        } catch (RuntimeException e) {
            log.error("Failed to start task engine", e);
            deps.close();
            System.exit(1);
        }

        log.info("Task engine running with {} workers", config.maxWorkers());
        stopped.await();
    }
}

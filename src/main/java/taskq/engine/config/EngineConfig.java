package taskq.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Configuration holder for the task engine.
 * All settings have sensible defaults; {@link #fromIni(File)} and
 * {@link #fromEnv()} override them.
 */
public final class EngineConfig {

    // Store settings
    private String databaseUrl = "jdbc:h2:file:./data/taskq;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 16;

    // Worker settings
    private int maxWorkers = 10;
    private Duration queuePollTimeout = Duration.ofSeconds(1);
    private Duration queuePollInterval = Duration.ofMillis(50);
    private Duration workerErrorBackoff = Duration.ofSeconds(1);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    // Task defaults
    private Duration defaultTimeout = Duration.ofSeconds(300);
    private int defaultMaxRetries = 3;
    private Duration retryBackoffBase = Duration.ofSeconds(1);
    private Duration retryBackoffCap = Duration.ofSeconds(300);

    // Reaper settings
    private Duration resultTtl = Duration.ofHours(1);
    private Duration reaperInterval = Duration.ofSeconds(300);

    // Monitoring endpoint
    private boolean serverEnabled = true;
    private String serverHost = "0.0.0.0";
    private int serverPort = 8080;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Build config from the environment. If {@code TASKQ_CONFIG} names an INI
     * file it is loaded first; individual variables then override it.
     */
    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String iniPath = System.getenv("TASKQ_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            config = fromIni(new File(iniPath));
        }

        String dbUrl = System.getenv("TASKQ_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("TASKQ_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String workers = System.getenv("TASKQ_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.maxWorkers = Integer.parseInt(workers.trim());
        }

        String port = System.getenv("TASKQ_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String resultTtl = System.getenv("TASKQ_RESULT_TTL_SECONDS");
        if (resultTtl != null && !resultTtl.isBlank()) {
            config.resultTtl = Duration.ofSeconds(Long.parseLong(resultTtl.trim()));
        }

        String reaperInterval = System.getenv("TASKQ_REAPER_INTERVAL_SECONDS");
        if (reaperInterval != null && !reaperInterval.isBlank()) {
            config.reaperInterval = Duration.ofSeconds(Long.parseLong(reaperInterval.trim()));
        }

        return config;
    }

    /**
     * Load settings from an INI file. Missing sections and keys keep their
     * defaults. Durations are whole seconds unless the key ends in {@code _ms}.
     *
     * <pre>
     * [store]
     * url = jdbc:h2:mem:taskq
     * pool_size = 8
     *
     * [workers]
     * max_workers = 4
     * poll_timeout_ms = 1000
     *
     * [tasks]
     * default_timeout = 300
     * default_max_retries = 3
     *
     * [reaper]
     * result_ttl = 3600
     * interval = 300
     *
     * [server]
     * enabled = true
     * port = 8080
     * </pre>
     *
     * @throws IllegalArgumentException if the file cannot be read or a value is malformed
     */
    public static EngineConfig fromIni(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file, e);
        }

        EngineConfig config = new EngineConfig();

        Profile.Section store = ini.get("store");
        if (store != null) {
            config.databaseUrl = opt(store, "url", config.databaseUrl);
            config.databasePoolSize = optInt(store, "pool_size", config.databasePoolSize);
        }

        Profile.Section workers = ini.get("workers");
        if (workers != null) {
            config.maxWorkers = optInt(workers, "max_workers", config.maxWorkers);
            config.queuePollTimeout = optMillis(workers, "poll_timeout_ms", config.queuePollTimeout);
            config.queuePollInterval = optMillis(workers, "poll_interval_ms", config.queuePollInterval);
            config.workerErrorBackoff = optMillis(workers, "error_backoff_ms", config.workerErrorBackoff);
            config.shutdownTimeout = optSeconds(workers, "shutdown_timeout", config.shutdownTimeout);
        }

        Profile.Section tasks = ini.get("tasks");
        if (tasks != null) {
            config.defaultTimeout = optSeconds(tasks, "default_timeout", config.defaultTimeout);
            config.defaultMaxRetries = optInt(tasks, "default_max_retries", config.defaultMaxRetries);
            config.retryBackoffBase = optMillis(tasks, "backoff_base_ms", config.retryBackoffBase);
            config.retryBackoffCap = optSeconds(tasks, "backoff_cap", config.retryBackoffCap);
        }

        Profile.Section reaper = ini.get("reaper");
        if (reaper != null) {
            config.resultTtl = optSeconds(reaper, "result_ttl", config.resultTtl);
            config.reaperInterval = optSeconds(reaper, "interval", config.reaperInterval);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverEnabled = Boolean.parseBoolean(opt(server, "enabled", String.valueOf(config.serverEnabled)));
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = optInt(server, "port", config.serverPort);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public Duration queuePollTimeout() {
        return queuePollTimeout;
    }

    public Duration queuePollInterval() {
        return queuePollInterval;
    }

    public Duration workerErrorBackoff() {
        return workerErrorBackoff;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration retryBackoffBase() {
        return retryBackoffBase;
    }

    public Duration retryBackoffCap() {
        return retryBackoffCap;
    }

    public Duration resultTtl() {
        return resultTtl;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public boolean serverEnabled() {
        return serverEnabled;
    }

    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withMaxWorkers(int workers) {
        this.maxWorkers = workers;
        return this;
    }

    public EngineConfig withQueuePollTimeout(Duration timeout) {
        this.queuePollTimeout = timeout;
        return this;
    }

    public EngineConfig withQueuePollInterval(Duration interval) {
        this.queuePollInterval = interval;
        return this;
    }

    public EngineConfig withWorkerErrorBackoff(Duration backoff) {
        this.workerErrorBackoff = backoff;
        return this;
    }

    public EngineConfig withDefaultTimeout(Duration timeout) {
        this.defaultTimeout = timeout;
        return this;
    }

    public EngineConfig withDefaultMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public EngineConfig withRetryBackoff(Duration base, Duration cap) {
        this.retryBackoffBase = base;
        this.retryBackoffCap = cap;
        return this;
    }

    public EngineConfig withResultTtl(Duration ttl) {
        this.resultTtl = ttl;
        return this;
    }

    public EngineConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public EngineConfig withServerEnabled(boolean enabled) {
        this.serverEnabled = enabled;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int optInt(Profile.Section s, String key, int def) {
        String v = s.get(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "': " + v, e);
        }
    }

    private static Duration optSeconds(Profile.Section s, String key, Duration def) {
        String v = s.get(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid seconds for '" + key + "': " + v, e);
        }
    }

    private static Duration optMillis(Profile.Section s, String key, Duration def) {
        String v = s.get(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Duration.ofMillis(Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for '" + key + "': " + v, e);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", maxWorkers=" + maxWorkers +
                ", defaultTimeout=" + defaultTimeout +
                ", defaultMaxRetries=" + defaultMaxRetries +
                ", resultTtl=" + resultTtl +
                ", reaperInterval=" + reaperInterval +
                ", serverEnabled=" + serverEnabled +
                ", serverPort=" + serverPort +
                '}';
    }
}

package io.crawlrelay.config;

import io.crawlrelay.util.Jsons;
import io.crawlrelay.util.SafeNames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Process-wide configuration, loaded once from a JSON file at startup.
 *
 * <p>Root-level {@code retryChannel}, {@code maxRetries}, {@code stagingDir},
 * {@code logDir} and {@code timeoutMs} are defaults; a value set on a
 * subscription entry wins. Relative paths resolve against the directory that
 * holds the config file.
 */
public final class AgentConfig {
    public static final long DEFAULT_BUS_POLL_INTERVAL_MS = 500L;
    public static final String DEFAULT_QUEUE_DIR = "queue";
    public static final String DEFAULT_LOG_DIR = "logs";
    public static final String DEFAULT_ERROR_LOG_DB = "error-log.db";
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final Path baseDir;
    private final Path busRoot;
    private final long busPollIntervalMs;
    private final String errorLogJdbcUrl;
    private final List<WorkerConfig> workers;

    public AgentConfig(Path baseDir, Path busRoot, long busPollIntervalMs, String errorLogJdbcUrl, List<WorkerConfig> workers) {
        this.baseDir = baseDir;
        this.busRoot = busRoot;
        this.busPollIntervalMs = busPollIntervalMs <= 0L ? DEFAULT_BUS_POLL_INTERVAL_MS : busPollIntervalMs;
        this.errorLogJdbcUrl = errorLogJdbcUrl;
        this.workers = List.copyOf(workers);
    }

    public static AgentConfig load(Path configFile) {
        Path file = configFile.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config not found: " + file);
        }
        ConfigFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config: " + file + " (" + e.getMessage() + ")", e);
        }
        if (raw == null) {
            throw new IllegalArgumentException("Config is empty: " + file);
        }
        return fromFile(raw, file.getParent());
    }

    static AgentConfig fromFile(ConfigFile raw, Path baseDir) {
        List<SubscriptionEntry> entries = raw.subscriptions();
        if (entries == null || entries.isEmpty()) {
            if (raw.subscriptionName() == null || raw.subscriptionName().isBlank()) {
                throw new IllegalArgumentException("Config has no subscriptions");
            }
            entries = List.of(new SubscriptionEntry(
                    raw.subscriptionName(),
                    raw.workingDir(),
                    raw.executablePath(),
                    raw.entryArgs(),
                    raw.extraArgs(),
                    null,
                    null,
                    null,
                    null,
                    null
            ));
        }

        List<WorkerConfig> workers = new ArrayList<>(entries.size());
        Set<String> seen = new HashSet<>();
        Set<String> fileNames = new HashSet<>();
        Set<Path> stagingDirs = new HashSet<>();
        for (SubscriptionEntry entry : entries) {
            WorkerConfig worker = merge(entry, raw, baseDir);
            if (!seen.add(worker.subscriptionName())) {
                throw new IllegalArgumentException("Duplicate subscription: " + worker.subscriptionName());
            }
            // Bus directories, log files and staging dirs are keyed by the sanitized name.
            String fileName = SafeNames.sanitizeOrDefault(worker.subscriptionName(), "subscription");
            if (!fileNames.add(fileName)) {
                throw new IllegalArgumentException("Subscription name collides after sanitizing: "
                        + worker.subscriptionName() + " -> " + fileName);
            }
            if (!stagingDirs.add(worker.stagingDir())) {
                throw new IllegalArgumentException("Duplicate stagingDir: " + worker.stagingDir()
                        + " (subscription " + worker.subscriptionName() + ")");
            }
            workers.add(worker);
        }

        Path busRoot = resolve(baseDir, firstNonBlank(raw.busRoot(), "bus"));
        String jdbcUrl = raw.errorLog() == null ? null : raw.errorLog().jdbcUrl();
        if (raw.errorLog() != null && (jdbcUrl == null || jdbcUrl.isBlank())) {
            jdbcUrl = SQLITE_PREFIX + baseDir.resolve(DEFAULT_ERROR_LOG_DB);
        } else if (jdbcUrl != null) {
            jdbcUrl = resolveSqliteUrl(baseDir, jdbcUrl.trim());
        }
        long pollMs = raw.busPollIntervalMs() == null ? DEFAULT_BUS_POLL_INTERVAL_MS : raw.busPollIntervalMs();
        return new AgentConfig(baseDir, busRoot, pollMs, jdbcUrl, workers);
    }

    private static WorkerConfig merge(SubscriptionEntry entry, ConfigFile defaults, Path baseDir) {
        if (entry == null || entry.subscriptionName() == null || entry.subscriptionName().isBlank()) {
            throw new IllegalArgumentException("Subscription entry without subscriptionName");
        }
        String name = entry.subscriptionName().trim();
        if (entry.workingDir() == null || entry.workingDir().isBlank()) {
            throw new IllegalArgumentException("workingDir is required: " + name);
        }
        Path workingDir = resolve(baseDir, entry.workingDir());

        String stagingRaw = firstNonBlank(entry.stagingDir(), defaults.stagingDir());
        Path stagingBase = stagingRaw == null ? workingDir.resolve(DEFAULT_QUEUE_DIR) : resolve(baseDir, stagingRaw);
        Path stagingDir = stagingBase.resolve(SafeNames.sanitizeOrDefault(name, "subscription"));

        String logRaw = firstNonBlank(entry.logDir(), defaults.logDir());
        Path logDir = logRaw == null ? workingDir.resolve(DEFAULT_LOG_DIR) : resolve(baseDir, logRaw);

        Integer maxRetries = entry.maxRetries() != null ? entry.maxRetries() : defaults.maxRetries();
        Long timeoutMs = entry.timeoutMs() != null ? entry.timeoutMs() : defaults.timeoutMs();
        List<String> entryArgs = entry.entryArgs() != null ? entry.entryArgs() : defaults.entryArgs();
        List<String> extraArgs = entry.extraArgs() != null ? entry.extraArgs() : List.of();

        return new WorkerConfig(
                name,
                workingDir,
                entry.executablePath(),
                entryArgs,
                extraArgs,
                stagingDir,
                logDir,
                firstNonBlank(entry.retryChannel(), defaults.retryChannel()),
                maxRetries == null ? 0 : maxRetries,
                timeoutMs == null ? 0L : timeoutMs
        );
    }

    /**
     * Resolves the file part of a relative {@code jdbc:sqlite:} URL against the
     * config directory. In-memory, {@code file:} URIs and other drivers pass through.
     */
    static String resolveSqliteUrl(Path baseDir, String jdbcUrl) {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return jdbcUrl;
        }
        String location = jdbcUrl.substring(SQLITE_PREFIX.length());
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return jdbcUrl;
        }
        String query = "";
        int q = location.indexOf('?');
        if (q >= 0) {
            query = location.substring(q);
            location = location.substring(0, q);
        }
        return SQLITE_PREFIX + resolve(baseDir, location) + query;
    }

    private static Path resolve(Path baseDir, String raw) {
        Path path = Path.of(raw.trim());
        return (path.isAbsolute() ? path : baseDir.resolve(path)).normalize();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }

    public Path baseDir() {
        return baseDir;
    }

    public Path busRoot() {
        return busRoot;
    }

    public long busPollIntervalMs() {
        return busPollIntervalMs;
    }

    /** JDBC URL of the error-log store, or {@code null} when error bookkeeping is off. */
    public String errorLogJdbcUrl() {
        return errorLogJdbcUrl;
    }

    public List<WorkerConfig> workers() {
        return workers;
    }

    public WorkerConfig worker(String subscriptionName) {
        for (WorkerConfig worker : workers) {
            if (worker.subscriptionName().equals(subscriptionName)) {
                return worker;
            }
        }
        throw new IllegalArgumentException("Unknown subscription: " + subscriptionName);
    }

    record ConfigFile(
            String busRoot,
            Long busPollIntervalMs,
            String retryChannel,
            Integer maxRetries,
            String stagingDir,
            String logDir,
            Long timeoutMs,
            List<String> entryArgs,
            ErrorLogSpec errorLog,
            List<SubscriptionEntry> subscriptions,
            String subscriptionName,
            String workingDir,
            String executablePath,
            List<String> extraArgs
    ) {
    }

    record ErrorLogSpec(String jdbcUrl) {
    }

    record SubscriptionEntry(
            String subscriptionName,
            String workingDir,
            String executablePath,
            List<String> entryArgs,
            List<String> extraArgs,
            String stagingDir,
            String logDir,
            String retryChannel,
            Integer maxRetries,
            Long timeoutMs
    ) {
    }
}

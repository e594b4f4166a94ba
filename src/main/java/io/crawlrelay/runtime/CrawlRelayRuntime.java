package io.crawlrelay.runtime;

import io.crawlrelay.bus.FileBus;
import io.crawlrelay.bus.MessageBus;
import io.crawlrelay.config.AgentConfig;
import io.crawlrelay.config.WorkerConfig;
import io.crawlrelay.observability.WorkerLogs;
import io.crawlrelay.retry.Sleeper;
import io.crawlrelay.sink.ErrorSink;
import io.crawlrelay.sink.JdbcErrorSink;
import io.crawlrelay.stage.DurableStage;
import io.crawlrelay.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Starts one {@link WorkerSupervisor} per configured subscription, each on its
 * own thread, and stops them together.
 */
public final class CrawlRelayRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(CrawlRelayRuntime.class);

    private final AgentConfig config;
    private final MessageBus bus;
    private final ErrorSink errorSink;
    private final Sleeper sleeper;
    private final List<WorkerSupervisor> supervisors;
    private ExecutorService workerThreads;

    public CrawlRelayRuntime(AgentConfig config) {
        this(config, new FileBus(config.busRoot(), config.busPollIntervalMs()), buildErrorSink(config), Sleeper.SYSTEM);
    }

    public CrawlRelayRuntime(AgentConfig config, MessageBus bus, ErrorSink errorSink, Sleeper sleeper) {
        this.config = config;
        this.bus = bus;
        this.errorSink = errorSink;
        this.sleeper = sleeper;
        this.supervisors = new ArrayList<>();
    }

    /** A runtime for read-only and operator commands; it never opens the error store. */
    public static CrawlRelayRuntime forInspection(AgentConfig config) {
        return new CrawlRelayRuntime(
                config,
                new FileBus(config.busRoot(), config.busPollIntervalMs()),
                ErrorSink.disabled(),
                Sleeper.SYSTEM
        );
    }

    public static ErrorSink buildErrorSink(AgentConfig config) {
        String jdbcUrl = config.errorLogJdbcUrl();
        if (jdbcUrl == null) {
            LOG.warn("Error log not configured; error events are not recorded");
            return ErrorSink.disabled();
        }
        try {
            Database database = new Database(jdbcUrl);
            database.init();
            return new JdbcErrorSink(database);
        } catch (RuntimeException e) {
            LOG.error("Error log unavailable; error events are not recorded. jdbc_url={}", jdbcUrl, e);
            return ErrorSink.disabled();
        }
    }

    public MessageBus bus() {
        return bus;
    }

    public synchronized void start() {
        if (workerThreads != null) {
            throw new IllegalStateException("Runtime already started");
        }
        workerThreads = Executors.newFixedThreadPool(
                Math.max(1, config.workers().size()),
                runnable -> new Thread(runnable, "crawlrelay-worker")
        );
        for (WorkerConfig worker : config.workers()) {
            Logger workerLog = WorkerLogs.forSubscription(worker.subscriptionName(), worker.logDir());
            WorkerSupervisor supervisor = new WorkerSupervisor(worker, bus, errorSink, sleeper, workerLog);
            supervisors.add(supervisor);
            workerThreads.execute(() -> runSupervisor(supervisor, workerLog));
        }
        LOG.info("Started {} worker(s)", supervisors.size());
    }

    public synchronized void stop() {
        for (WorkerSupervisor supervisor : supervisors) {
            supervisor.stop();
        }
        if (workerThreads != null) {
            workerThreads.shutdown();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService threads;
        synchronized (this) {
            threads = workerThreads;
        }
        if (threads == null) {
            return true;
        }
        return threads.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized List<WorkerSupervisor> supervisors() {
        return List.copyOf(supervisors);
    }

    /**
     * Staged and quarantined files per subscription, read straight from the
     * staging directories.
     */
    public List<StagingReport> stagingReport() {
        List<StagingReport> reports = new ArrayList<>();
        for (WorkerConfig worker : config.workers()) {
            DurableStage stage = new DurableStage(worker.stagingDir(), LOG);
            reports.add(new StagingReport(
                    worker.subscriptionName(),
                    worker.stagingDir().toString(),
                    fileNames(stage.pendingFiles()),
                    fileNames(stage.quarantinedFiles())
            ));
        }
        return reports;
    }

    public Path release(String subscription, String quarantinedFile) {
        WorkerConfig worker = config.worker(subscription);
        return new DurableStage(worker.stagingDir(), LOG).release(quarantinedFile);
    }

    private void runSupervisor(WorkerSupervisor supervisor, Logger workerLog) {
        Thread.currentThread().setName("crawlrelay-worker-" + supervisor.subscriptionName());
        try {
            supervisor.run();
        } catch (RuntimeException e) {
            workerLog.error("Worker crashed. subscription={}", supervisor.subscriptionName(), e);
        }
    }

    private static List<String> fileNames(List<Path> files) {
        List<String> names = new ArrayList<>(files.size());
        for (Path file : files) {
            names.add(file.getFileName().toString());
        }
        return names;
    }

    public record StagingReport(String subscription, String stagingDir, List<String> pending, List<String> quarantined) {
    }
}
